package gimme.core.writers;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

import gimme.core.annotation.Assembly;

/**
 * Writes transcript models as BED12 lines
 */
public class BEDWriter implements Closeable, Flushable {

	private final BufferedWriter writer;
	private int count;

	public BEDWriter(Writer out) {
		this.writer = new BufferedWriter(out);
		this.count = 0;
	}

	public void write(Assembly assembly) throws IOException {
		writer.write(assembly.toBED());
		writer.newLine();
		count++;
	}

	/**
	 * @return number of records written so far
	 */
	public int getCount() {
		return count;
	}

	@Override
	public void flush() throws IOException {
		writer.flush();
	}

	@Override
	public void close() throws IOException {
		writer.close();
	}
}
