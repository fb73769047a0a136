package gimme.core.assembly;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.jgrapht.alg.util.UnionFind;

/**
 * Groups splice junctions into clusters of introns connected through shared alignments.
 * Clusters only ever merge. A cluster is identified by the handle of its current representative
 * junction, and its member list is kept once, under that representative.
 */
public class ClusterTable {

	private final UnionFind<Integer> unionFind;
	private final Set<Integer> known;
	private final Map<Integer, Set<Integer>> members;

	public ClusterTable() {
		unionFind = new UnionFind<Integer>(new HashSet<Integer>());
		known = new HashSet<Integer>();
		members = new LinkedHashMap<Integer, Set<Integer>>();
	}

	/**
	 * Puts the junctions, and every cluster any of them already belongs to, into one cluster.
	 * Junctions not seen before start as their own cluster.
	 * @param introns junction handles in discovery order, at least one
	 * @return id of the resulting cluster
	 */
	public int merge(Collection<Integer> introns) {
		if(introns.isEmpty()) {
			throw new IllegalArgumentException("Cannot build a cluster without introns");
		}
		Set<Integer> roots = new LinkedHashSet<Integer>();
		for(Integer intron : introns) {
			if(known.add(intron)) {
				unionFind.addElement(intron);
				Set<Integer> single = new LinkedHashSet<Integer>();
				single.add(intron);
				members.put(intron, single);
			}
			roots.add(unionFind.find(intron));
		}

		Integer first = roots.iterator().next();
		for(Integer root : roots) {
			unionFind.union(first, root);
		}
		Integer representative = unionFind.find(first);
		if(roots.size() == 1) {
			return representative.intValue();
		}

		Set<Integer> merged = new LinkedHashSet<Integer>();
		for(Integer root : roots) {
			merged.addAll(members.remove(root));
		}
		members.put(representative, merged);
		return representative.intValue();
	}

	/**
	 * @return id of the cluster owning the junction
	 */
	public int getCluster(int intron) {
		if(!known.contains(intron)) {
			throw new IllegalArgumentException("Junction " + intron + " is not part of any cluster");
		}
		return unionFind.find(Integer.valueOf(intron)).intValue();
	}

	public boolean contains(int clusterId) {
		return members.containsKey(Integer.valueOf(clusterId));
	}

	/**
	 * @return junction handles of the cluster in discovery order
	 */
	public Set<Integer> getMembers(int clusterId) {
		Set<Integer> rtrn = members.get(Integer.valueOf(clusterId));
		if(rtrn == null) {
			throw new IllegalArgumentException("No cluster " + clusterId);
		}
		return Collections.unmodifiableSet(rtrn);
	}

	/**
	 * @return ids of the live clusters in creation order
	 */
	public Set<Integer> getClusterIds() {
		return Collections.unmodifiableSet(members.keySet());
	}

	public int size() {
		return members.size();
	}
}
