package gimme.core.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gimme.core.annotation.GenomicBlock;

/**
 * Derives introns from consecutive exons and keeps them grouped in clusters
 */
public class SpliceJunctionTable {

	private final ExonRegistry exons;
	private final ClusterTable clusters;
	private final int maxIntron;
	private final Map<GenomicBlock, Integer> handles;
	private final List<SpliceJunction> junctions;

	public SpliceJunctionTable(ExonRegistry exons, ClusterTable clusters, int maxIntron) {
		this.exons = exons;
		this.clusters = clusters;
		this.maxIntron = maxIntron;
		this.handles = new HashMap<GenomicBlock, Integer>();
		this.junctions = new ArrayList<SpliceJunction>();
	}

	/**
	 * Links each pair of consecutive exons of one alignment through its intron. Pairs whose intron is longer than
	 * the maximum intron size are not linked. The junctions of the alignment end up in a single cluster, merged with
	 * every cluster they already belonged to.
	 * @param exonHandles registry handles of the alignment's exons in reference order
	 * @return id of the cluster holding the alignment's introns, -1 when no pair could be linked
	 */
	public int linkIntrons(List<Integer> exonHandles) {
		List<Integer> introns = new ArrayList<Integer>();
		for(int i = 0; i + 1 < exonHandles.size(); i++) {
			Exon currExon = exons.get(exonHandles.get(i).intValue());
			Exon nextExon = exons.get(exonHandles.get(i + 1).intValue());

			int intronStart = currExon.getEnd() + 1;
			int intronEnd = nextExon.getStart() - 1;
			if(intronEnd - intronStart + 1 > maxIntron) {
				continue;
			}

			currExon.addNextExon(nextExon.getHandle());
			SpliceJunction junction = getOrCreate(new GenomicBlock(currExon.getChr(), intronStart, intronEnd));
			junction.addEdge(currExon.getHandle(), nextExon.getHandle());
			currExon.addIntron(junction.getHandle());
			nextExon.addIntron(junction.getHandle());
			introns.add(Integer.valueOf(junction.getHandle()));
		}

		if(introns.isEmpty()) {
			return -1;
		}
		return clusters.merge(introns);
	}

	private SpliceJunction getOrCreate(GenomicBlock intron) {
		Integer handle = handles.get(intron);
		if(handle != null) {
			return junctions.get(handle.intValue());
		}
		SpliceJunction junction = new SpliceJunction(junctions.size(), intron);
		junctions.add(junction);
		handles.put(intron, Integer.valueOf(junction.getHandle()));
		return junction;
	}

	public SpliceJunction get(int handle) {
		return junctions.get(handle);
	}

	/**
	 * @return the junction with these intron coordinates or null
	 */
	public SpliceJunction find(GenomicBlock intron) {
		Integer handle = handles.get(intron);
		return handle == null ? null : junctions.get(handle.intValue());
	}

	/**
	 * @return id of the cluster currently owning the junction
	 */
	public int getCluster(int handle) {
		return clusters.getCluster(handle);
	}

	public List<SpliceJunction> getJunctions() {
		return Collections.unmodifiableList(junctions);
	}

	public int size() {
		return junctions.size();
	}
}
