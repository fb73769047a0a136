package gimme.core.general;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import gimme.core.error.ParseException;

import org.apache.commons.io.LineIterator;

/**
 * Line by line reading of tab separated files, one record per line
 */
public class TabbedReader {

	public static class TabbedIterator<T> implements Iterator<T>, Closeable {
		protected LineIterator itr;
		private T curr;
		protected Factory<? extends T> factory;
		private int lineNumber;

		public TabbedIterator(File file, Factory<? extends T> factory) throws IOException {
			itr = new LineIterator(new BufferedReader(new FileReader(file)));
			this.factory = factory;
			lineNumber = 0;
		}

		@Override
		public boolean hasNext() {
			if (curr == null) {
				advance();
			}
			return (curr != null);
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			T result = curr;
			curr = null;
			return result;
		}

		private void advance() {
			String nextLine = getNextLine();
			if (nextLine != null) {
				try {
					curr = factory.create(nextLine.trim().split("\t"));
				} catch (ParseException e) {
					throw new ParseException("Line " + lineNumber + ": " + e.getMessage(), e);
				}
			}
		}

		/**
		 * Override this function to do any custom parsing (e.g., skip commented lines)
		 * @return the next line to hand to the factory or null at the end of the file
		 */
		protected String getNextLine() {
			if (itr.hasNext()) {
				lineNumber++;
				return itr.next();
			}
			return null;
		}

		protected int getLineNumber() {
			return lineNumber;
		}

		@Override
		public void remove() {
			throw new UnsupportedOperationException("Remove not supported");
		}

		@Override
		public void close() throws IOException {
			itr.close();
		}

	}


	public interface Factory<T> {
		T create(String[] rawFields) throws ParseException;
	}
}
