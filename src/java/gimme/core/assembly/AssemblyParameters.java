package gimme.core.assembly;

import org.apache.log4j.Logger;

/**
 * Thresholds of one assembly run. Instances are immutable and always valid, invalid values are rejected by
 * {@link Builder#build()} before any input is read.
 */
public class AssemblyParameters {

	public static final int DEFAULT_GAP_SIZE = 10;
	public static final int DEFAULT_MAX_INTRON = 100000;
	public static final int DEFAULT_MIN_UTR = 100;
	public static final int DEFAULT_MIN_EXON_LENGTH = 10;
	public static final int DEFAULT_MIN_TRANSCRIPT_LENGTH = 300;

	private final int gapSize;
	private final int maxIntron;
	private final int minUtr;
	private final int minExonLength;
	private final int minTranscriptLength;
	private final boolean minimalIsoformSet;

	private AssemblyParameters(Builder builder) {
		this.gapSize = builder.gapSize;
		this.maxIntron = builder.maxIntron;
		this.minUtr = builder.minUtr;
		this.minExonLength = builder.minExonLength;
		this.minTranscriptLength = builder.minTranscriptLength;
		this.minimalIsoformSet = builder.minimalIsoformSet;
	}

	public static AssemblyParameters defaults() {
		return new Builder().build();
	}

	/**
	 * Largest alignment gap (bp) filled when building exons
	 */
	public int getGapSize() {
		return gapSize;
	}

	/**
	 * Largest intron (bp) linking two exons
	 */
	public int getMaxIntron() {
		return maxIntron;
	}

	/**
	 * Cutoff size (bp) of alternative UTRs collapsed into one terminal exon
	 */
	public int getMinUtr() {
		return minUtr;
	}

	public int getMinExonLength() {
		return minExonLength;
	}

	/**
	 * Transcripts must be strictly longer than this to be reported
	 */
	public int getMinTranscriptLength() {
		return minTranscriptLength;
	}

	/**
	 * @return true to report a minimum set of isoforms covering the splice graph instead of all maximal paths
	 */
	public boolean isMinimalIsoformSet() {
		return minimalIsoformSet;
	}

	public void log(Logger logger) {
		logValue(logger, "MIN_UTR", minUtr, DEFAULT_MIN_UTR);
		logValue(logger, "GAP_SIZE", gapSize, DEFAULT_GAP_SIZE);
		logValue(logger, "MAX_INTRON", maxIntron, DEFAULT_MAX_INTRON);
		logValue(logger, "MIN_EXON", minExonLength, DEFAULT_MIN_EXON_LENGTH);
		logValue(logger, "MIN_TRANSCRIPT_LEN", minTranscriptLength, DEFAULT_MIN_TRANSCRIPT_LENGTH);
		if(minimalIsoformSet) {
			logger.info("Search for a minimum set of isoforms = yes");
		} else {
			logger.info("Search for a maximum set of isoforms = yes");
		}
	}

	private static void logValue(Logger logger, String name, int value, int def) {
		if(value != def) {
			logger.info("User defined " + name + " = " + value);
		} else {
			logger.info("Default " + name + " = " + value);
		}
	}

	@Override
	public String toString() {
		return "gapSize=" + gapSize + " maxIntron=" + maxIntron + " minUTR=" + minUtr + " minExonLength=" + minExonLength +
				" minTranscriptLength=" + minTranscriptLength + " minimalIsoformSet=" + minimalIsoformSet;
	}

	public static class Builder {
		private int gapSize = DEFAULT_GAP_SIZE;
		private int maxIntron = DEFAULT_MAX_INTRON;
		private int minUtr = DEFAULT_MIN_UTR;
		private int minExonLength = DEFAULT_MIN_EXON_LENGTH;
		private int minTranscriptLength = DEFAULT_MIN_TRANSCRIPT_LENGTH;
		private boolean minimalIsoformSet = false;

		public Builder gapSize(int gapSize) {
			this.gapSize = gapSize;
			return this;
		}

		public Builder maxIntron(int maxIntron) {
			this.maxIntron = maxIntron;
			return this;
		}

		public Builder minUtr(int minUtr) {
			this.minUtr = minUtr;
			return this;
		}

		public Builder minExonLength(int minExonLength) {
			this.minExonLength = minExonLength;
			return this;
		}

		public Builder minTranscriptLength(int minTranscriptLength) {
			this.minTranscriptLength = minTranscriptLength;
			return this;
		}

		public Builder minimalIsoformSet(boolean minimalIsoformSet) {
			this.minimalIsoformSet = minimalIsoformSet;
			return this;
		}

		/**
		 * @throws IllegalArgumentException naming the first invalid parameter
		 */
		public AssemblyParameters build() {
			if(minUtr <= 0) {
				throw new IllegalArgumentException("Invalid UTRs size (<=0): minUTR = " + minUtr);
			}
			if(gapSize < 0) {
				throw new IllegalArgumentException("Invalid gap size (<0): gapSize = " + gapSize);
			}
			if(maxIntron <= 0) {
				throw new IllegalArgumentException("Invalid intron size (<=0): maxIntron = " + maxIntron);
			}
			if(minExonLength <= 0) {
				throw new IllegalArgumentException("Invalid exon size (<=0): minExonLength = " + minExonLength);
			}
			if(minTranscriptLength < 0) {
				throw new IllegalArgumentException("Invalid transcript length (<0): minTranscriptLength = " + minTranscriptLength);
			}
			return new AssemblyParameters(this);
		}
	}
}
