package gimme.core.assembly;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

/**
 * Counts reported at the end of an assembly run
 */
public class AssemblySummary {

	private final int exonCount;
	private final int geneCount;
	private final int transcriptCount;
	private final int excludedCount;
	private final SummaryStatistics isoformsPerGene;

	AssemblySummary(int exonCount, int geneCount, int transcriptCount, int excludedCount, SummaryStatistics isoformsPerGene) {
		this.exonCount = exonCount;
		this.geneCount = geneCount;
		this.transcriptCount = transcriptCount;
		this.excludedCount = excludedCount;
		this.isoformsPerGene = isoformsPerGene;
	}

	public int getExonCount() {
		return exonCount;
	}

	public int getGeneCount() {
		return geneCount;
	}

	public int getTranscriptCount() {
		return transcriptCount;
	}

	/**
	 * @return number of candidate transcripts rejected by the length filter
	 */
	public int getExcludedCount() {
		return excludedCount;
	}

	/**
	 * @return mean number of reported transcripts per reported gene, 0 without genes
	 */
	public double getIsoformsPerGene() {
		return isoformsPerGene.getN() == 0 ? 0 : isoformsPerGene.getMean();
	}

	public int getMaxIsoformsPerGene() {
		return isoformsPerGene.getN() == 0 ? 0 : (int) isoformsPerGene.getMax();
	}

	public void log(Logger logger) {
		logger.info("Total exons = " + exonCount);
		logger.info("Total genes = " + geneCount);
		logger.info("Total transcripts = " + transcriptCount);
		logger.info("Excluded transcripts = " + excludedCount);
		logger.info(String.format("Isoform/gene = %.2f (max %d)", Double.valueOf(getIsoformsPerGene()), Integer.valueOf(getMaxIsoformsPerGene())));
	}
}
