package gimme.core.assembly;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import gimme.core.annotation.GenomicBlock;

/**
 * An intron: the gap between two consecutive exons of an alignment.
 * Alignments that share the splice sites but differ in the flanking exon boundaries add
 * more edges to the same junction.
 */
public class SpliceJunction {

	private final int handle;
	private final GenomicBlock intron;
	private final Set<Edge> edges;
	/**
	 * The number of exon pairs that were linked through this junction
	 */
	private int count;

	SpliceJunction(int handle, GenomicBlock intron) {
		this.handle = handle;
		this.intron = intron;
		this.edges = new LinkedHashSet<Edge>();
		this.count = 0;
	}

	public int getHandle() {
		return handle;
	}

	public GenomicBlock getIntron() {
		return intron;
	}

	public String getChr() {
		return intron.getChr();
	}

	public int getStart() {
		return intron.getStart();
	}

	public int getEnd() {
		return intron.getEnd();
	}

	void addEdge(int upstreamExon, int downstreamExon) {
		count++;
		edges.add(new Edge(upstreamExon, downstreamExon));
	}

	public Set<Edge> getEdges() {
		return Collections.unmodifiableSet(edges);
	}

	public int getCount() {
		return count;
	}

	@Override
	public String toString() {
		return intron.toUCSC() + " " + edges;
	}

	/**
	 * An observed transition from an upstream exon to a downstream exon, both given as registry handles
	 */
	public static final class Edge {
		private final int upstream;
		private final int downstream;

		public Edge(int upstream, int downstream) {
			this.upstream = upstream;
			this.downstream = downstream;
		}

		public int getUpstream() {
			return upstream;
		}

		public int getDownstream() {
			return downstream;
		}

		@Override
		public boolean equals(Object o) {
			if(!(o instanceof Edge)) {
				return false;
			}
			Edge other = (Edge) o;
			return upstream == other.upstream && downstream == other.downstream;
		}

		@Override
		public int hashCode() {
			return 31 * upstream + downstream;
		}

		@Override
		public String toString() {
			return upstream + "->" + downstream;
		}
	}
}
