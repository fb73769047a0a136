package gimme.core.assembly;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

/**
 * Cluster discovery depends on the order alignments come in, so one locus can be split into several clusters
 * until a later alignment shares an exon with them. This class joins such clusters into gene loci.
 */
public class LocusMerger {

	static Logger logger = Logger.getLogger(LocusMerger.class.getName());

	private LocusMerger() {}

	/**
	 * Links the clusters of the introns of each exon in an undirected cluster graph and returns its connected components
	 * @param state state after all alignments were registered
	 * @return gene loci in discovery order
	 */
	public static List<GeneLocus> mergeLoci(AssemblyState state) {
		Graph<Integer, DefaultEdge> bigCluster = buildClusterGraph(state);
		ConnectivityInspector<Integer, DefaultEdge> inspector = new ConnectivityInspector<Integer, DefaultEdge>(bigCluster);
		List<Set<Integer>> components = inspector.connectedSets();

		List<GeneLocus> loci = new ArrayList<GeneLocus>(components.size());
		for(Set<Integer> component : components) {
			loci.add(new GeneLocus(loci.size() + 1, component));
		}
		logger.debug(state.getClusters().size() + " clusters merged into " + loci.size() + " loci");
		return loci;
	}

	static Graph<Integer, DefaultEdge> buildClusterGraph(AssemblyState state) {
		Graph<Integer, DefaultEdge> bigCluster = new SimpleGraph<Integer, DefaultEdge>(DefaultEdge.class);
		for(Exon exon : state.getExons().getExons()) {
			Set<Integer> path = new LinkedHashSet<Integer>();
			for(Integer intron : exon.getIntrons()) {
				path.add(Integer.valueOf(state.getJunctions().getCluster(intron.intValue())));
			}

			Iterator<Integer> iter = path.iterator();
			if(!iter.hasNext()) {
				continue;
			}
			Integer previous = iter.next();
			bigCluster.addVertex(previous);
			while(iter.hasNext()) {
				Integer current = iter.next();
				Graphs.addEdgeWithVertices(bigCluster, previous, current);
				previous = current;
			}
		}
		return bigCluster;
	}
}
