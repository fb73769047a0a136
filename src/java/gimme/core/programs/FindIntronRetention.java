package gimme.core.programs;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;

import org.apache.log4j.Logger;

import gimme.core.error.ParseException;
import gimme.core.parser.CommandLineParser;
import gimme.core.readers.BEDReader;
import gimme.core.utils.IntronRetentionFinder;
import gimme.core.writers.GFFEventWriter;

/**
 * Identifies intron retention in assembled gene models and writes the events in GFF,
 * ready for differential exon usage analysis
 */
public class FindIntronRetention {

	static Logger logger = Logger.getLogger(FindIntronRetention.class.getName());

	public static void main(String[] args) throws IOException {
		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Finds intron retention events in a BED12 file of gene models grouped by gene");
		p.addStringArg("-in", "BED12 gene models", true);
		p.addStringArg("-out", "Output GFF file, standard output if not given", false);
		p.parseOrExit(args);

		try {
			run(new File(p.getStringArg("-in")), p.getStringArg("-out"));
		} catch (ParseException e) {
			logger.error("Could not parse gene models: " + e.getMessage());
			System.exit(-1);
		}
	}

	public static void run(File bedFile, String out) throws IOException {
		BEDReader reader = new BEDReader(bedFile, BEDReader.STRANDED);
		Writer w = out == null ? new OutputStreamWriter(System.out) : new FileWriter(out);
		GFFEventWriter writer = new GFFEventWriter(w);
		try {
			new IntronRetentionFinder(writer).run(reader);
		} finally {
			reader.close();
			if(out == null) {
				writer.flush();
			} else {
				writer.close();
			}
		}
	}
}
