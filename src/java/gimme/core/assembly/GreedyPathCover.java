package gimme.core.assembly;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy set cover over path edges. Each round takes the path covering the most edges not covered yet;
 * ties go to the path with fewer exons, then to the earlier path.
 * A path made of a single exon has no edge and covers that exon instead.
 */
public class GreedyPathCover implements MinimumPathCover {

	private static final long NO_DOWNSTREAM = 0xFFFFFFFFL;

	@Override
	public List<List<Integer>> cover(List<List<Integer>> paths) {
		List<Set<Long>> elements = new ArrayList<Set<Long>>(paths.size());
		Set<Long> uncovered = new HashSet<Long>();
		for(List<Integer> path : paths) {
			Set<Long> pathElements = getEdges(path);
			elements.add(pathElements);
			uncovered.addAll(pathElements);
		}

		boolean[] chosen = new boolean[paths.size()];
		while(!uncovered.isEmpty()) {
			int best = -1;
			int bestGain = 0;
			for(int i = 0; i < paths.size(); i++) {
				if(chosen[i]) {
					continue;
				}
				int gain = 0;
				for(Long element : elements.get(i)) {
					if(uncovered.contains(element)) {
						gain++;
					}
				}
				if(gain > bestGain || (gain == bestGain && gain > 0 && paths.get(i).size() < paths.get(best).size())) {
					best = i;
					bestGain = gain;
				}
			}
			chosen[best] = true;
			uncovered.removeAll(elements.get(best));
		}

		List<List<Integer>> rtrn = new ArrayList<List<Integer>>();
		for(int i = 0; i < paths.size(); i++) {
			if(chosen[i]) {
				rtrn.add(paths.get(i));
			}
		}
		return rtrn;
	}

	/**
	 * @return the edges of the path encoded as (upstream << 32 | downstream)
	 */
	static Set<Long> getEdges(List<Integer> path) {
		Set<Long> edges = new LinkedHashSet<Long>();
		if(path.size() == 1) {
			edges.add(Long.valueOf(((long) path.get(0).intValue() << 32) | NO_DOWNSTREAM));
			return edges;
		}
		for(int i = 0; i + 1 < path.size(); i++) {
			long upstream = path.get(i).intValue();
			long downstream = path.get(i + 1).intValue();
			edges.add(Long.valueOf((upstream << 32) | downstream));
		}
		return edges;
	}
}
