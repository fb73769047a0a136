package gimme.core.readers;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

import org.apache.commons.collections15.Predicate;
import org.apache.commons.collections15.functors.TruePredicate;
import org.apache.commons.collections15.iterators.FilterIterator;

import gimme.core.annotation.Assembly;
import gimme.core.general.TabbedReader;

/**
 * Iterate through the transcript models of a BED12 file. Track, browser and comment lines are skipped.
 */
public class BEDReader implements Iterator<Assembly>, Closeable {

	/**
	 * Keeps records with a known strand
	 */
	public static final Predicate<Assembly> STRANDED = new Predicate<Assembly>() {
		@Override
		public boolean evaluate(Assembly assembly) {
			return !".".equals(assembly.getStrand());
		}
	};

	private final BEDIterator lines;
	private final Iterator<Assembly> iter;

	public BEDReader(File bedFile) throws IOException {
		this(bedFile, TruePredicate.<Assembly>getInstance());
	}

	public BEDReader(File bedFile, Predicate<? super Assembly> filter) throws IOException {
		lines = new BEDIterator(bedFile);
		iter = new FilterIterator<Assembly>(lines, filter);
	}

	@Override
	public boolean hasNext() {
		return iter.hasNext();
	}

	@Override
	public Assembly next() {
		return iter.next();
	}

	@Override
	public void remove() {
		throw new UnsupportedOperationException("Not implemented");
	}

	@Override
	public void close() throws IOException {
		lines.close();
	}

	private static class BEDIterator extends TabbedReader.TabbedIterator<Assembly> {

		BEDIterator(File file) throws IOException {
			super(file, new Assembly.BEDFactory());
		}

		@Override
		protected String getNextLine() {
			String line = super.getNextLine();
			while(line != null && (line.trim().isEmpty() || line.startsWith("track") || line.startsWith("browser") || line.startsWith("#"))) {
				line = super.getNextLine();
			}
			return line;
		}
	}
}
