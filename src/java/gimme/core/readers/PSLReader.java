package gimme.core.readers;

import java.io.File;
import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.log4j.Logger;

import gimme.core.annotation.AlignmentRecord;
import gimme.core.general.TabbedReader;

/**
 * Iterate through a PSL file. The psLayout header and any line that does not start with a match count are skipped,
 * pslx files are read like PSL.
 */
public class PSLReader implements AlignmentRecordReader {

	private static Logger logger = Logger.getLogger(PSLReader.class.getName());

	private final PSLIterator iter;

	public PSLReader(File pslFile) throws IOException {
		iter = new PSLIterator(pslFile);
	}

	public PSLReader(String pslFile) throws IOException {
		this(new File(pslFile));
	}

	@Override
	public boolean hasNext() {
		return iter.hasNext();
	}

	@Override
	public AlignmentRecord next() {
		return iter.next();
	}

	@Override
	public void remove() {
		throw new UnsupportedOperationException("Not implemented");
	}

	@Override
	public void close() throws IOException {
		iter.close();
	}

	private static class PSLIterator extends TabbedReader.TabbedIterator<AlignmentRecord> {

		PSLIterator(File file) throws IOException {
			super(file, new AlignmentRecord.PSLFactory());
		}

		@Override
		protected String getNextLine() {
			String line = super.getNextLine();
			while(line != null && !isRecord(line)) {
				line = super.getNextLine();
			}
			return line;
		}

		/**
		 * Records start with the match count and have at least the 21 PSL columns, pslx adds the sequences after them.
		 * Header and blank lines are skipped quietly, truncated records with a warning.
		 */
		private boolean isRecord(String line) {
			String[] tokens = line.trim().split("\t");
			if(!NumberUtils.isDigits(tokens[0])) {
				if(StringUtils.isNotBlank(line)) {
					logger.debug("Skipping line " + getLineNumber() + ": " + line);
				}
				return false;
			}
			if(tokens.length < AlignmentRecord.PSLFactory.PSL_COLUMNS) {
				logger.warn("Skipping line " + getLineNumber() + " with " + tokens.length + " columns, PSL has " +
						AlignmentRecord.PSLFactory.PSL_COLUMNS);
				return false;
			}
			return true;
		}
	}
}
