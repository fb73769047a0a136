package gimme.core.assembly;

import java.util.List;

/**
 * Chooses a subset of the maximal paths of a splice graph that still covers all of its edges
 */
public interface MinimumPathCover {

	/**
	 * @param paths maximal paths, each a list of exon handles from a root to a leaf
	 * @return the chosen paths in their original order
	 */
	List<List<Integer>> cover(List<List<Integer>> paths);
}
