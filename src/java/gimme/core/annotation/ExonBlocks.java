package gimme.core.annotation;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers used to turn the aligned blocks of one alignment into exons
 *
 */
public final class ExonBlocks {

	private ExonBlocks() {}

	/**
	 * Alignments may contain small gaps (indels, sequencing errors). Consecutive blocks leaving
	 * no more than gapSize unaligned bases between them are merged into one exon.
	 * @param blocks aligned blocks in reference order
	 * @param gapSize largest gap that is filled
	 * @return new list of merged blocks, the input is not modified
	 */
	public static List<GenomicBlock> fillGaps(List<GenomicBlock> blocks, int gapSize) {
		List<GenomicBlock> rtrn = new ArrayList<GenomicBlock>(blocks.size());
		if(blocks.isEmpty()) {
			return rtrn;
		}
		GenomicBlock current = blocks.get(0);
		for(int i = 1; i < blocks.size(); i++) {
			GenomicBlock next = blocks.get(i);
			if(next.getStart() - current.getEnd() - 1 <= gapSize) {
				current = current.withEnd(Math.max(current.getEnd(), next.getEnd()));
			} else {
				rtrn.add(current);
				current = next;
			}
		}
		rtrn.add(current);
		return rtrn;
	}

	/**
	 * Drops exons shorter than minExonLength. Each drop breaks the alignment, so the exons on either side
	 * end up in separate runs that are treated as independent partial transcripts.
	 * @param exons gap-filled exons
	 * @param minExonLength minimum exon length in bases
	 * @return runs of consecutive qualifying exons, never empty runs
	 */
	public static List<List<GenomicBlock>> splitByMinExonLength(List<GenomicBlock> exons, int minExonLength) {
		List<List<GenomicBlock>> runs = new ArrayList<List<GenomicBlock>>();
		List<GenomicBlock> kept = new ArrayList<GenomicBlock>();
		for(GenomicBlock exon : exons) {
			if(exon.getLength() >= minExonLength) {
				kept.add(exon);
			} else if(!kept.isEmpty()) {
				runs.add(kept);
				kept = new ArrayList<GenomicBlock>();
			}
		}
		if(!kept.isEmpty()) {
			runs.add(kept);
		}
		return runs;
	}

	/**
	 * @return summed length of the blocks, introns excluded
	 */
	public static int totalLength(List<GenomicBlock> blocks) {
		int length = 0;
		for(GenomicBlock block : blocks) {
			length += block.getLength();
		}
		return length;
	}
}
