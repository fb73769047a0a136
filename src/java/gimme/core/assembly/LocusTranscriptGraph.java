package gimme.core.assembly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import gimme.core.annotation.Assembly;
import gimme.core.annotation.GenomicBlock;

/**
 * Directed exon graph of one gene locus. Vertices are exon handles of the registry, edges are observed
 * exon-to-exon transitions.
 */
public class LocusTranscriptGraph {

	static Logger logger = Logger.getLogger(LocusTranscriptGraph.class.getName());

	private final ExonRegistry exons;
	private final Graph<Integer, DefaultEdge> graph;

	private final Comparator<Integer> byEndThenStart = new Comparator<Integer>() {
		@Override
		public int compare(Integer o1, Integer o2) {
			Exon e1 = exons.get(o1.intValue());
			Exon e2 = exons.get(o2.intValue());
			if(e1.getEnd() != e2.getEnd()) {
				return e1.getEnd() < e2.getEnd() ? -1 : 1;
			}
			return compareInts(e1.getStart(), e2.getStart());
		}
	};

	private final Comparator<Integer> byStartThenEnd = new Comparator<Integer>() {
		@Override
		public int compare(Integer o1, Integer o2) {
			Exon e1 = exons.get(o1.intValue());
			Exon e2 = exons.get(o2.intValue());
			if(e1.getStart() != e2.getStart()) {
				return e1.getStart() < e2.getStart() ? -1 : 1;
			}
			return compareInts(e1.getEnd(), e2.getEnd());
		}
	};

	public LocusTranscriptGraph(ExonRegistry exons) {
		this.exons = exons;
		this.graph = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
	}

	/**
	 * Links every exon starting an intron of the locus to its next exons. All introns of an exon belong to the
	 * same locus, so the next exons are in the locus too.
	 */
	public static LocusTranscriptGraph build(AssemblyState state, GeneLocus locus) {
		Set<Integer> upstreamExons = new LinkedHashSet<Integer>();
		for(Integer clusterId : locus.getClusterIds()) {
			for(Integer intron : state.getClusters().getMembers(clusterId.intValue())) {
				for(SpliceJunction.Edge edge : state.getJunctions().get(intron.intValue()).getEdges()) {
					upstreamExons.add(Integer.valueOf(edge.getUpstream()));
				}
			}
		}

		LocusTranscriptGraph rtrn = new LocusTranscriptGraph(state.getExons());
		for(Integer upstream : upstreamExons) {
			for(Integer next : state.getExons().get(upstream.intValue()).getNextExons()) {
				rtrn.addEdge(upstream.intValue(), next.intValue());
			}
		}
		return rtrn;
	}

	public void addEdge(int upstream, int downstream) {
		Graphs.addEdgeWithVertices(graph, Integer.valueOf(upstream), Integer.valueOf(downstream));
	}

	public Graph<Integer, DefaultEdge> getGraph() {
		return graph;
	}

	public boolean isEmpty() {
		return graph.vertexSet().isEmpty();
	}

	/**
	 * Collapses redundant alternative terminal exons, first at the 5' end then at the 3' end.
	 * The second pass runs on the graph already reduced by the first.
	 * @param minUtr largest terminal extension (bp) that is collapsed
	 */
	public void collapseExons(int minUtr) {
		collapseAlternativeStarts(minUtr);
		collapseAlternativeEnds(minUtr);
	}

	/**
	 * Exons sharing an end: a LEFT terminal exon inside a longer one is absorbed by it, and a LEFT terminal exon
	 * extending an internal exon by at most minUtr is replaced by the internal exon.
	 */
	private void collapseAlternativeStarts(int minUtr) {
		List<Integer> sorted = sortedVertices(byEndThenStart);
		if(sorted.isEmpty()) {
			return;
		}
		Exon currExon = exons.get(sorted.get(0).intValue());
		for(int i = 1; i < sorted.size(); i++) {
			Exon nextExon = exons.get(sorted.get(i).intValue());
			if(currExon.getEnd() != nextExon.getEnd()) {
				currExon = nextExon;
				continue;
			}
			if(nextExon.getTerminal() == Terminal.LEFT) {
				moveSuccessors(nextExon, currExon);
				removeExon(nextExon, currExon);
			} else {
				if(currExon.getTerminal() == Terminal.LEFT && nextExon.getStart() - currExon.getStart() <= minUtr) {
					moveSuccessors(currExon, nextExon);
					removeExon(currExon, nextExon);
				}
				currExon = nextExon;
			}
		}
	}

	/**
	 * Exons sharing a start: a RIGHT terminal exon inside a longer one is absorbed by it, and a RIGHT terminal exon
	 * extending another by at most minUtr is absorbed by the shorter one.
	 */
	private void collapseAlternativeEnds(int minUtr) {
		List<Integer> sorted = sortedVertices(byStartThenEnd);
		if(sorted.isEmpty()) {
			return;
		}
		Exon currExon = exons.get(sorted.get(0).intValue());
		for(int i = 1; i < sorted.size(); i++) {
			Exon nextExon = exons.get(sorted.get(i).intValue());
			if(currExon.getStart() != nextExon.getStart()) {
				currExon = nextExon;
				continue;
			}
			if(currExon.getTerminal() == Terminal.RIGHT) {
				movePredecessors(currExon, nextExon);
				removeExon(currExon, nextExon);
				currExon = nextExon;
			} else if(nextExon.getTerminal() == Terminal.RIGHT && nextExon.getEnd() - currExon.getEnd() <= minUtr) {
				movePredecessors(nextExon, currExon);
				removeExon(nextExon, currExon);
			} else {
				currExon = nextExon;
			}
		}
	}

	private void removeExon(Exon removed, Exon kept) {
		graph.removeVertex(Integer.valueOf(removed.getHandle()));
		if(logger.isDebugEnabled()) {
			logger.debug("Collapsed " + removed + " into " + kept);
		}
	}

	private void moveSuccessors(Exon from, Exon to) {
		Integer target = Integer.valueOf(to.getHandle());
		for(Integer successor : Graphs.successorListOf(graph, Integer.valueOf(from.getHandle()))) {
			graph.addEdge(target, successor);
		}
	}

	private void movePredecessors(Exon from, Exon to) {
		Integer target = Integer.valueOf(to.getHandle());
		for(Integer predecessor : Graphs.predecessorListOf(graph, Integer.valueOf(from.getHandle()))) {
			graph.addEdge(predecessor, target);
		}
	}

	/**
	 * All maximal paths: depth-first from every vertex without predecessor, a path ends at a vertex whose successors
	 * are all already on the path. Successors are visited in coordinate order.
	 * @return paths as lists of exon handles
	 */
	public List<List<Integer>> getPaths() {
		List<List<Integer>> paths = new ArrayList<List<Integer>>();
		for(Integer root : sortedVertices(byStartThenEnd)) {
			if(graph.inDegreeOf(root) != 0) {
				continue;
			}
			List<Integer> path = new ArrayList<Integer>();
			Set<Integer> onPath = new HashSet<Integer>();
			Deque<Iterator<Integer>> stack = new ArrayDeque<Iterator<Integer>>();

			path.add(root);
			onPath.add(root);
			List<Integer> open = openSuccessors(root, onPath);
			if(open.isEmpty()) {
				paths.add(new ArrayList<Integer>(path));
				continue;
			}
			stack.push(open.iterator());

			while(!stack.isEmpty()) {
				Iterator<Integer> iter = stack.peek();
				if(iter.hasNext()) {
					Integer next = iter.next();
					path.add(next);
					onPath.add(next);
					open = openSuccessors(next, onPath);
					if(open.isEmpty()) {
						paths.add(new ArrayList<Integer>(path));
						onPath.remove(path.remove(path.size() - 1));
					} else {
						stack.push(open.iterator());
					}
				} else {
					stack.pop();
					onPath.remove(path.remove(path.size() - 1));
				}
			}
		}
		return paths;
	}

	private List<Integer> openSuccessors(Integer vertex, Set<Integer> onPath) {
		List<Integer> rtrn = new ArrayList<Integer>();
		for(Integer successor : Graphs.successorListOf(graph, vertex)) {
			if(!onPath.contains(successor)) {
				rtrn.add(successor);
			}
		}
		Collections.sort(rtrn, byStartThenEnd);
		return rtrn;
	}

	private List<Integer> sortedVertices(Comparator<Integer> order) {
		List<Integer> rtrn = new ArrayList<Integer>(graph.vertexSet());
		Collections.sort(rtrn, order);
		return rtrn;
	}

	/**
	 * @return the exons of the path as an unnamed transcript model
	 */
	public Assembly toAssembly(List<Integer> path) {
		List<GenomicBlock> blocks = new ArrayList<GenomicBlock>(path.size());
		for(Integer handle : path) {
			blocks.add(exons.get(handle.intValue()).getBlock());
		}
		return new Assembly(blocks);
	}

	private static int compareInts(int a, int b) {
		return a < b ? -1 : (a == b ? 0 : 1);
	}
}
