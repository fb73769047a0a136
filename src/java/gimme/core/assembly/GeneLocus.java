package gimme.core.assembly;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A group of clusters connected through shared exons. One splice graph is built per locus.
 */
public class GeneLocus {

	private final int index;
	private final Set<Integer> clusterIds;

	public GeneLocus(int index, Set<Integer> clusterIds) {
		this.index = index;
		this.clusterIds = Collections.unmodifiableSet(new LinkedHashSet<Integer>(clusterIds));
	}

	/**
	 * @return 1-based position of the locus in discovery order
	 */
	public int getIndex() {
		return index;
	}

	public Set<Integer> getClusterIds() {
		return clusterIds;
	}

	@Override
	public String toString() {
		return "locus " + index + " " + clusterIds;
	}
}
