package gimme.core.annotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gimme.core.error.ParseException;
import gimme.core.general.TabbedReader;

/**
 * One alignment of a transcript read against the reference: the reference name and its aligned blocks.
 * Blocks are stored with inclusive ends in reference order.
 */
public class AlignmentRecord {

	private final String name;
	private final String chr;
	private final List<GenomicBlock> blocks;

	public AlignmentRecord(String name, String chr, List<GenomicBlock> blocks) {
		this.name = name;
		this.chr = chr;
		this.blocks = Collections.unmodifiableList(new ArrayList<GenomicBlock>(blocks));
	}

	public String getName() {
		return name;
	}

	public String getChr() {
		return chr;
	}

	public List<GenomicBlock> getBlocks() {
		return blocks;
	}

	public int getBlockCount() {
		return blocks.size();
	}

	@Override
	public String toString() {
		return name + "\t" + chr + "\t" + blocks;
	}

	/**
	 * Builds a record from the 21 columns of a BLAT PSL line.
	 * Only tName (14), blockCount (18), blockSizes (19) and tStarts (21) are used.
	 */
	public static class PSLFactory implements TabbedReader.Factory<AlignmentRecord> {

		public static final int PSL_COLUMNS = 21;

		@Override
		public AlignmentRecord create(String[] rawFields) throws ParseException {
			if (rawFields.length < PSL_COLUMNS) {
				throw new ParseException("Cannot create alignment from " + rawFields.length + " fields, PSL has " + PSL_COLUMNS);
			}

			String chr = rawFields[13];
			String name = rawFields[9];
			int nBlocks = parseInt(rawFields[17], "blockCount");
			String [] sizes = trimmedSplit(rawFields[18]);
			String [] targetStarts = trimmedSplit(rawFields[20]);
			if (sizes.length != nBlocks || targetStarts.length != nBlocks) {
				throw new ParseException("BAD PSL FORMAT the number of tStarts (" + rawFields[20] + ") and blockSizes (" + rawFields[18] +
						") items does not agree with the blockCount " + nBlocks);
			}

			List<GenomicBlock> blocks = new ArrayList<GenomicBlock>(nBlocks);
			for (int i = 0; i < nBlocks; i++) {
				int blockSize = parseInt(sizes[i], "blockSizes");
				int targetStart = parseInt(targetStarts[i], "tStarts");
				blocks.add(GenomicBlock.fromHalfOpen(chr, targetStart, blockSize));
			}
			return new AlignmentRecord(name, chr, blocks);
		}

		private static String[] trimmedSplit(String field) {
			String trimmed = field.trim();
			if(trimmed.endsWith(",")) {
				trimmed = trimmed.substring(0, trimmed.length() - 1);
			}
			return trimmed.split(",");
		}

		private static int parseInt(String value, String column) {
			try {
				return Integer.parseInt(value.trim());
			} catch (NumberFormatException e) {
				throw new ParseException("Invalid " + column + " value in PSL record: " + value, e);
			}
		}
	}
}
