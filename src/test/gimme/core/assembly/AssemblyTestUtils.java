package gimme.core.assembly;

import java.util.ArrayList;
import java.util.List;

import gimme.core.annotation.AlignmentRecord;
import gimme.core.annotation.GenomicBlock;

/**
 * Builds alignments from half-open (start, size) pairs
 */
final class AssemblyTestUtils {

	private AssemblyTestUtils() {}

	static List<GenomicBlock> blocks(String chr, int... startsAndSizes) {
		List<GenomicBlock> rtrn = new ArrayList<GenomicBlock>();
		for(int i = 0; i + 1 < startsAndSizes.length; i += 2) {
			rtrn.add(GenomicBlock.fromHalfOpen(chr, startsAndSizes[i], startsAndSizes[i + 1]));
		}
		return rtrn;
	}

	static AlignmentRecord alignment(String chr, int... startsAndSizes) {
		return new AlignmentRecord("read", chr, blocks(chr, startsAndSizes));
	}

	static GenomicBlock exon(String chr, int start, int size) {
		return GenomicBlock.fromHalfOpen(chr, start, size);
	}

	/**
	 * @return the paths as lists of exon coordinates
	 */
	static List<List<GenomicBlock>> toBlocks(ExonRegistry exons, List<List<Integer>> paths) {
		List<List<GenomicBlock>> rtrn = new ArrayList<List<GenomicBlock>>();
		for(List<Integer> path : paths) {
			List<GenomicBlock> blocks = new ArrayList<GenomicBlock>();
			for(Integer handle : path) {
				blocks.add(exons.get(handle.intValue()).getBlock());
			}
			rtrn.add(blocks);
		}
		return rtrn;
	}
}
