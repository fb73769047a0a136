package gimme.core.utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import htsjdk.samtools.util.IntervalTree;

import gimme.core.annotation.Assembly;
import gimme.core.annotation.GenomicBlock;
import gimme.core.writers.GFFEventWriter;

/**
 * Finds intron retention in assembled transcripts. Transcripts of one gene are joined into an exon graph; an edge
 * (upstream, downstream) is retained when the gene also has an exon starting at upstream's start and ending at
 * downstream's end.
 * Transcripts must come grouped by gene, the gene being the part of the name before the first '.'.
 */
public class IntronRetentionFinder {

	static Logger logger = Logger.getLogger(IntronRetentionFinder.class.getName());

	private final GFFEventWriter writer;
	private int geneCount;
	private int eventCount;

	public IntronRetentionFinder(GFFEventWriter writer) {
		this.writer = writer;
	}

	/**
	 * Reads all transcripts and writes the events of each gene
	 * @throws IOException if writing fails
	 */
	public void run(Iterator<Assembly> transcripts) throws IOException {
		String currentGene = null;
		List<Assembly> geneTranscripts = new ArrayList<Assembly>();
		while(transcripts.hasNext()) {
			Assembly transcript = transcripts.next();
			String gene = getGeneId(transcript.getName());
			if(currentGene != null && !gene.equals(currentGene)) {
				processGene(currentGene, geneTranscripts);
				geneTranscripts.clear();
			}
			currentGene = gene;
			geneTranscripts.add(transcript);
		}
		if(currentGene != null) {
			processGene(currentGene, geneTranscripts);
		}
		writer.flush();
		logger.info(eventCount + " intron retention events in " + geneCount + " genes");
	}

	private void processGene(String geneId, List<Assembly> transcripts) throws IOException {
		geneCount++;
		String strand = transcripts.get(0).getStrand();
		int eventNumber = 0;
		for(RetentionEvent event : findEvents(transcripts)) {
			eventNumber++;
			eventCount++;
			writer.write(event, geneId, eventNumber, strand);
		}
	}

	/**
	 * @param transcripts transcripts of one gene
	 * @return one event per spliced exon pair that some exon of the gene spans exactly
	 */
	public static List<RetentionEvent> findEvents(Collection<Assembly> transcripts) {
		Graph<GenomicBlock, DefaultEdge> graph = new DefaultDirectedGraph<GenomicBlock, DefaultEdge>(DefaultEdge.class);
		for(Assembly transcript : transcripts) {
			List<GenomicBlock> exons = transcript.getBlocks();
			if(exons.size() == 1) {
				graph.addVertex(exons.get(0));
			}
			for(int i = 0; i + 1 < exons.size(); i++) {
				Graphs.addEdgeWithVertices(graph, exons.get(i), exons.get(i + 1));
			}
		}

		IntervalTree<GenomicBlock> tree = new IntervalTree<GenomicBlock>();
		for(GenomicBlock exon : graph.vertexSet()) {
			tree.put(exon.getStart(), exon.getEnd(), exon);
		}

		List<GenomicBlock> retaining = new ArrayList<GenomicBlock>();
		List<RetentionEvent> events = new ArrayList<RetentionEvent>();
		for(DefaultEdge edge : graph.edgeSet()) {
			GenomicBlock up = graph.getEdgeSource(edge);
			GenomicBlock down = graph.getEdgeTarget(edge);
			retaining.clear();
			Iterator<IntervalTree.Node<GenomicBlock>> overlappers = tree.overlappers(up.getStart(), down.getEnd());
			while(overlappers.hasNext()) {
				IntervalTree.Node<GenomicBlock> node = overlappers.next();
				if(node.getStart() == up.getStart() && node.getEnd() == down.getEnd()) {
					retaining.add(node.getValue());
				}
			}
			if(!retaining.isEmpty()) {
				events.add(new RetentionEvent(up, down, retaining));
			}
		}
		return events;
	}

	/**
	 * <i>chr1:12.3</i> gives <i>chr1-12</i>, the colon is not allowed in GFF identifiers
	 */
	static String getGeneId(String transcriptName) {
		return StringUtils.substringBefore(transcriptName, ".").replace(':', '-');
	}

	public int getGeneCount() {
		return geneCount;
	}

	public int getEventCount() {
		return eventCount;
	}
}
