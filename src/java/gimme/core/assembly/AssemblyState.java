package gimme.core.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import gimme.core.annotation.ExonBlocks;
import gimme.core.annotation.GenomicBlock;

/**
 * Everything one assembly run accumulates from its alignments: the exon registry, the splice junctions with
 * their clusters, and the unspliced alignments kept aside for {@link SingleExonMerger}.
 */
public class AssemblyState {

	private final AssemblyParameters parameters;
	private final ExonRegistry exons;
	private final ClusterTable clusters;
	private final SpliceJunctionTable junctions;
	private final Map<String, List<GenomicBlock>> singleExons;

	public AssemblyState(AssemblyParameters parameters) {
		this.parameters = parameters;
		this.exons = new ExonRegistry();
		this.clusters = new ClusterTable();
		this.junctions = new SpliceJunctionTable(exons, clusters, parameters.getMaxIntron());
		this.singleExons = new TreeMap<String, List<GenomicBlock>>();
	}

	/**
	 * Fills small gaps, drops short exons and registers every resulting run. Runs of a single exon are kept aside as
	 * unspliced alignments.
	 * @param blocks aligned blocks of one alignment in reference order
	 * @return number of runs the alignment was split into
	 */
	public int registerAlignment(List<GenomicBlock> blocks) {
		List<GenomicBlock> filled = ExonBlocks.fillGaps(blocks, parameters.getGapSize());
		List<List<GenomicBlock>> runs = ExonBlocks.splitByMinExonLength(filled, parameters.getMinExonLength());
		for(List<GenomicBlock> run : runs) {
			if(run.size() > 1) {
				List<Integer> handles = exons.addExons(run);
				junctions.linkIntrons(handles);
			} else {
				GenomicBlock exon = run.get(0);
				List<GenomicBlock> chrExons = singleExons.get(exon.getChr());
				if(chrExons == null) {
					chrExons = new ArrayList<GenomicBlock>();
					singleExons.put(exon.getChr(), chrExons);
				}
				chrExons.add(exon);
			}
		}
		return runs.size();
	}

	public AssemblyParameters getParameters() {
		return parameters;
	}

	public ExonRegistry getExons() {
		return exons;
	}

	public ClusterTable getClusters() {
		return clusters;
	}

	public SpliceJunctionTable getJunctions() {
		return junctions;
	}

	/**
	 * @return unspliced alignments per chromosome, chromosomes in name order
	 */
	public Map<String, List<GenomicBlock>> getSingleExons() {
		return Collections.unmodifiableMap(singleExons);
	}
}
