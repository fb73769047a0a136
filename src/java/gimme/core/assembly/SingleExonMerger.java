package gimme.core.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import gimme.core.annotation.GenomicBlock;

/**
 * Merges unspliced alignments by overlap. Each merged interval is reported as a one-exon gene.
 */
public class SingleExonMerger {

	private static final Comparator<GenomicBlock> BY_START = new Comparator<GenomicBlock>() {
		@Override
		public int compare(GenomicBlock o1, GenomicBlock o2) {
			if(o1.getStart() != o2.getStart()) {
				return o1.getStart() < o2.getStart() ? -1 : 1;
			}
			return o1.getEnd() < o2.getEnd() ? -1 : (o1.getEnd() == o2.getEnd() ? 0 : 1);
		}
	};

	private SingleExonMerger() {}

	/**
	 * Sweeps each chromosome once in start order; an exon starting inside the running interval extends it,
	 * any other exon closes the running interval and starts a new one.
	 * @param perChromosome unspliced exons by chromosome, not modified
	 * @return merged intervals by chromosome, chromosomes in name order
	 */
	public static Map<String, List<GenomicBlock>> mergeSingleExons(Map<String, List<GenomicBlock>> perChromosome) {
		Map<String, List<GenomicBlock>> rtrn = new TreeMap<String, List<GenomicBlock>>();
		for(Map.Entry<String, List<GenomicBlock>> entry : perChromosome.entrySet()) {
			List<GenomicBlock> sorted = new ArrayList<GenomicBlock>(entry.getValue());
			if(sorted.isEmpty()) {
				continue;
			}
			Collections.sort(sorted, BY_START);

			List<GenomicBlock> merged = new ArrayList<GenomicBlock>();
			GenomicBlock current = sorted.get(0);
			for(int i = 1; i < sorted.size(); i++) {
				GenomicBlock next = sorted.get(i);
				if(next.getStart() <= current.getEnd()) {
					if(next.getEnd() > current.getEnd()) {
						current = current.withEnd(next.getEnd());
					}
				} else {
					merged.add(current);
					current = next;
				}
			}
			merged.add(current);
			rtrn.put(entry.getKey(), merged);
		}
		return rtrn;
	}
}
