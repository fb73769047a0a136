package gimme.core.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gimme.core.annotation.GenomicBlock;

/**
 * Deduplicated store of exons. An exon seen in several alignments is a single entry whose
 * attributes are merged.
 */
public class ExonRegistry {

	private final Map<GenomicBlock, Integer> handles;
	private final List<Exon> exons;

	public ExonRegistry() {
		handles = new HashMap<GenomicBlock, Integer>();
		exons = new ArrayList<Exon>();
	}

	/**
	 * Registers the exons of one multi-exon alignment run. The first exon is seen as LEFT terminal and the last as
	 * RIGHT terminal. An exon already registered as terminal loses its flag when it shows up inside an alignment.
	 * @param blocks exons in reference order
	 * @return the handles of the exons, in the same order
	 */
	public List<Integer> addExons(List<GenomicBlock> blocks) {
		List<Integer> rtrn = new ArrayList<Integer>(blocks.size());
		int last = blocks.size() - 1;
		for(int i = 0; i < blocks.size(); i++) {
			Terminal observed = Terminal.NONE;
			if(i == 0) {
				observed = Terminal.LEFT;
			} else if(i == last) {
				observed = Terminal.RIGHT;
			}
			rtrn.add(addExon(blocks.get(i), observed));
		}
		return rtrn;
	}

	private int addExon(GenomicBlock block, Terminal observed) {
		Integer handle = handles.get(block);
		if(handle == null) {
			Exon exon = new Exon(exons.size(), block, observed);
			exons.add(exon);
			handles.put(block, Integer.valueOf(exon.getHandle()));
			return exon.getHandle();
		}
		Exon existing = exons.get(handle.intValue());
		// A LEFT/RIGHT disagreement keeps the flag seen first
		if(!observed.isTerminal() && existing.getTerminal().isTerminal()) {
			existing.setTerminal(Terminal.NONE);
		}
		return handle.intValue();
	}

	public Exon get(int handle) {
		return exons.get(handle);
	}

	/**
	 * @return the exon with these coordinates or null
	 */
	public Exon find(GenomicBlock block) {
		Integer handle = handles.get(block);
		return handle == null ? null : exons.get(handle.intValue());
	}

	/**
	 * @return all exons in registration order
	 */
	public List<Exon> getExons() {
		return Collections.unmodifiableList(exons);
	}

	public int size() {
		return exons.size();
	}
}
