package gimme.core.programs;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import gimme.core.assembly.AssemblyParameters;
import gimme.core.assembly.AssemblySummary;
import gimme.core.assembly.TranscriptAssembler;
import gimme.core.error.ParseException;
import gimme.core.parser.CommandLineParser;
import gimme.core.readers.AlignmentReaders;
import gimme.core.readers.AlignmentRecordReader;
import gimme.core.writers.BEDWriter;

/**
 * Gimme: a transcripts assembler based on alignments.
 * Reads PSL, SAM or BAM alignments and writes the assembled gene models as BED12.
 */
public class Gimme {

	static Logger logger = Logger.getLogger(Gimme.class.getName());

	public static final String VERSION = "0.8";

	public static void main(String[] args) throws IOException {
		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Gimme " + VERSION + ": builds gene models from spliced alignments and writes them in BED format");
		p.addStringArg("-in", "Comma separated alignment files, PSL or SAM/BAM by extension", true);
		p.addStringArg("-out", "Output BED file, standard output if not given", false);
		p.addIntegerArg("-minUTR", "A cutoff size of alternative UTRs (bp)", false, Integer.valueOf(AssemblyParameters.DEFAULT_MIN_UTR));
		p.addIntegerArg("-gapSize", "A maximum gap size filled inside an exon (bp)", false, Integer.valueOf(AssemblyParameters.DEFAULT_GAP_SIZE));
		p.addIntegerArg("-maxIntron", "A maximum intron size (bp)", false, Integer.valueOf(AssemblyParameters.DEFAULT_MAX_INTRON));
		p.addIntegerArg("-minExonLength", "A minimum exon size (bp)", false, Integer.valueOf(AssemblyParameters.DEFAULT_MIN_EXON_LENGTH));
		p.addIntegerArg("-minTranscriptLength", "Transcripts must be longer than this (bp)", false, Integer.valueOf(AssemblyParameters.DEFAULT_MIN_TRANSCRIPT_LENGTH));
		p.addBooleanArg("-minimalIsoformSet", "Report a minimum set of isoforms", false, Boolean.FALSE);
		p.parseOrExit(args);

		AssemblyParameters parameters;
		try {
			parameters = new AssemblyParameters.Builder()
					.minUtr(p.getIntArg("-minUTR"))
					.gapSize(p.getIntArg("-gapSize"))
					.maxIntron(p.getIntArg("-maxIntron"))
					.minExonLength(p.getIntArg("-minExonLength"))
					.minTranscriptLength(p.getIntArg("-minTranscriptLength"))
					.minimalIsoformSet(p.getBooleanArg("-minimalIsoformSet"))
					.build();
		} catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.exit(-1);
			return;
		}
		parameters.log(logger);

		String[] inputs = StringUtils.split(p.getStringArg("-in"), ',');
		String out = p.getStringArg("-out");

		try {
			run(parameters, inputs, out);
		} catch (ParseException e) {
			logger.error("Could not parse alignments: " + e.getMessage());
			System.exit(-1);
		} catch (IOException e) {
			logger.error(e.getMessage(), e);
			System.exit(-1);
		}
	}

	/**
	 * Assembles all inputs and writes the models
	 * @param out output file or null for standard output
	 */
	public static AssemblySummary run(AssemblyParameters parameters, String[] inputs, String out) throws IOException {
		TranscriptAssembler assembler = new TranscriptAssembler(parameters);
		for(String input : inputs) {
			AlignmentRecordReader reader = AlignmentReaders.open(new File(input.trim()));
			try {
				assembler.addAlignments(reader, input);
			} finally {
				reader.close();
			}
		}

		Writer w = out == null ? new OutputStreamWriter(System.out) : new FileWriter(out);
		BEDWriter writer = new BEDWriter(w);
		AssemblySummary summary;
		try {
			summary = assembler.assemble(writer);
		} finally {
			if(out == null) {
				writer.flush();
			} else {
				writer.close();
			}
		}
		summary.log(logger);
		return summary;
	}
}
