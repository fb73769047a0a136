package gimme.core.assembly;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

import gimme.core.annotation.AlignmentRecord;
import gimme.core.annotation.Assembly;
import gimme.core.annotation.GenomicBlock;
import gimme.core.readers.AlignmentRecordReader;
import gimme.core.writers.BEDWriter;

/**
 * Builds gene models from spliced alignments.
 * Alignments are added first, then {@link #assemble(BEDWriter)} merges clusters into loci, builds and collapses
 * a splice graph per locus and writes every transcript passing the length filter, followed by the merged
 * unspliced alignments.
 */
public class TranscriptAssembler {

	static Logger logger = Logger.getLogger(TranscriptAssembler.class.getName());

	private static final int PROGRESS_INTERVAL = 1000;

	private final AssemblyParameters parameters;
	private final AssemblyState state;
	private final MinimumPathCover pathCover;
	private int alignmentCount;

	public TranscriptAssembler(AssemblyParameters parameters) {
		this(parameters, new GreedyPathCover());
	}

	public TranscriptAssembler(AssemblyParameters parameters, MinimumPathCover pathCover) {
		this.parameters = parameters;
		this.state = new AssemblyState(parameters);
		this.pathCover = pathCover;
		this.alignmentCount = 0;
	}

	public void addAlignment(AlignmentRecord alignment) {
		if(alignment.getBlockCount() == 0) {
			return;
		}
		state.registerAlignment(alignment.getBlocks());
		alignmentCount++;
	}

	/**
	 * Adds every alignment of the reader. The reader is not closed.
	 * @param source name of the input, for progress messages
	 * @return number of alignments read
	 */
	public int addAlignments(AlignmentRecordReader reader, String source) {
		logger.info("Parsing alignments from " + source + "...");
		int n = 0;
		while(reader.hasNext()) {
			addAlignment(reader.next());
			n++;
			if(n % PROGRESS_INTERVAL == 0) {
				logger.info("... " + n);
			}
		}
		logger.info(n + " alignments read from " + source);
		return n;
	}

	/**
	 * Builds the gene models and writes them
	 * @param writer destination of the BED records
	 * @return counts of the run
	 * @throws IOException if writing fails
	 */
	public AssemblySummary assemble(BEDWriter writer) throws IOException {
		logger.info("Building gene models...");
		List<GeneLocus> loci = LocusMerger.mergeLoci(state);

		SummaryStatistics isoformsPerGene = new SummaryStatistics();
		int geneId = 0;
		int numTranscripts = 0;
		int excluded = 0;

		for(GeneLocus locus : loci) {
			LocusTranscriptGraph graph = LocusTranscriptGraph.build(state, locus);
			if(!graph.isEmpty()) {
				geneId++;
				int transcriptId = 0;
				graph.collapseExons(parameters.getMinUtr());
				List<List<Integer>> paths = graph.getPaths();
				if(parameters.isMinimalIsoformSet()) {
					paths = pathCover.cover(paths);
				}
				for(List<Integer> path : paths) {
					Assembly transcript = graph.toAssembly(path);
					if(passesLengthFilter(transcript, parameters.getMinTranscriptLength())) {
						transcriptId++;
						numTranscripts++;
						transcript.setName(transcriptName(transcript.getChr(), geneId, transcriptId));
						writer.write(transcript);
					} else {
						excluded++;
					}
				}
				if(transcriptId == 0) {
					geneId--;
				} else {
					isoformsPerGene.addValue(transcriptId);
				}
			}
			if(locus.getIndex() % PROGRESS_INTERVAL == 0) {
				logger.info("... " + locus.getIndex() + ": excluded " + excluded + " transcript(s)");
			}
		}

		Map<String, List<GenomicBlock>> mergedSingleExons = SingleExonMerger.mergeSingleExons(state.getSingleExons());
		for(Map.Entry<String, List<GenomicBlock>> entry : mergedSingleExons.entrySet()) {
			for(GenomicBlock exon : entry.getValue()) {
				geneId++;
				numTranscripts++;
				isoformsPerGene.addValue(1);
				Assembly transcript = new Assembly(Collections.singletonList(exon));
				transcript.setName(transcriptName(entry.getKey(), geneId, 1));
				writer.write(transcript);
			}
		}
		writer.flush();

		logger.info(alignmentCount + " alignments, " + state.getClusters().size() + " clusters, " + loci.size() + " loci");
		return new AssemblySummary(state.getExons().size(), geneId, numTranscripts, excluded, isoformsPerGene);
	}

	/**
	 * @return true if the summed exon length is strictly greater than the minimum
	 */
	public static boolean passesLengthFilter(Assembly transcript, int minTranscriptLength) {
		return transcript.getLength() > minTranscriptLength;
	}

	static String transcriptName(String chr, int geneId, int transcriptId) {
		return chr + ":" + geneId + "." + transcriptId;
	}

	public AssemblyState getState() {
		return state;
	}

	public AssemblyParameters getParameters() {
		return parameters;
	}
}
