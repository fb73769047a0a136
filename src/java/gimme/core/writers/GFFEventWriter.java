package gimme.core.writers;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import gimme.core.annotation.GenomicBlock;
import gimme.core.utils.RetentionEvent;

/**
 * Writes intron retention events as GFF: one gene line per event, one mRNA for the spliced pair and one mRNA per
 * retaining exon. Coordinates are 1-based inclusive.
 */
public class GFFEventWriter implements Closeable, Flushable {

	public static final String SOURCE = "RI";

	private static final Comparator<GenomicBlock> BY_END = new Comparator<GenomicBlock>() {
		@Override
		public int compare(GenomicBlock o1, GenomicBlock o2) {
			if(o1.getEnd() != o2.getEnd()) {
				return o1.getEnd() < o2.getEnd() ? -1 : 1;
			}
			return o1.compareTo(o2);
		}
	};

	private final BufferedWriter writer;

	public GFFEventWriter(Writer out) {
		this.writer = new BufferedWriter(out);
	}

	public void write(RetentionEvent event, String geneId, int eventNumber, String strand) throws IOException {
		List<List<GenomicBlock>> isoforms = new ArrayList<List<GenomicBlock>>();
		List<GenomicBlock> spliced = new ArrayList<GenomicBlock>();
		spliced.add(event.getUpstream());
		spliced.add(event.getDownstream());
		isoforms.add(spliced);
		for(GenomicBlock exon : event.getRetainingExons()) {
			isoforms.add(Collections.singletonList(exon));
		}

		String chr = event.getUpstream().getChr();
		String eventId = geneId + ".ev" + eventNumber;
		writeLine(chr, "gene", event.getStart(), event.getEnd(), strand, "ID=" + eventId + ";Name=" + geneId);

		int mrnaId = 1;
		for(List<GenomicBlock> isoform : isoforms) {
			List<GenomicBlock> exons = new ArrayList<GenomicBlock>(isoform);
			Collections.sort(exons, BY_END);
			String mrna = eventId + "." + mrnaId;
			writeLine(chr, "mRNA", exons.get(0).getStart(), exons.get(exons.size() - 1).getEnd(), strand, "ID=" + mrna + ";Parent=" + eventId);
			int exonId = 1;
			for(GenomicBlock exon : exons) {
				writeLine(chr, "exon", exon.getStart(), exon.getEnd(), strand, "ID=" + mrna + "." + exonId + ";Parent=" + mrna);
				exonId++;
			}
			mrnaId++;
		}
	}

	private void writeLine(String chr, String feature, int start, int end, String strand, String attributes) throws IOException {
		writer.write(StringUtils.join(new Object[] {chr, SOURCE, feature, start + 1, end + 1, ".", strand, ".", attributes}, '\t'));
		writer.newLine();
	}

	@Override
	public void flush() throws IOException {
		writer.flush();
	}

	@Override
	public void close() throws IOException {
		writer.close();
	}
}
