package gimme.core.readers;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import gimme.core.annotation.Assembly;
import junit.framework.TestCase;

public class BEDReaderTest extends TestCase {

	private File bedFile() throws IOException {
		return PSLReaderTest.writeTemp(".bed", Arrays.asList(
				"track name=gimme",
				"# assembled",
				"chr1\t100\t450\tchr1:1.1\t1000\t+\t100\t450\t0,0,0\t2\t100,150\t0,200",
				"",
				"chr1\t100\t450\tchr1:1.2\t1000\t.\t100\t450\t0,0,0\t1\t350\t0"));
	}

	public void testReadsAllRecords() throws IOException {
		BEDReader reader = new BEDReader(bedFile());
		try {
			Assembly first = reader.next();
			assertEquals("chr1:1.1", first.getName());
			assertEquals(250, first.getLength());
			assertEquals(".", reader.next().getStrand());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}

	public void testStrandedFilter() throws IOException {
		BEDReader reader = new BEDReader(bedFile(), BEDReader.STRANDED);
		try {
			assertEquals("chr1:1.1", reader.next().getName());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}
}
