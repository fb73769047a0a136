package gimme.core.readers;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import gimme.core.annotation.AlignmentRecord;
import gimme.core.annotation.GenomicBlock;
import gimme.core.error.ParseException;
import junit.framework.TestCase;

public class PSLReaderTest extends TestCase {

	static final List<String> PSL_HEADER = Arrays.asList(
			"psLayout version 3",
			"",
			"match\tmis- \trep. \tN's\tQ gap\tQ gap\tT gap\tT gap\tstrand\tQ        \tQ   \tQ    \tQ  \tT        \tT   \tT    \tT  \tblock\tblockSizes \tqStarts\t tStarts",
			"     \tmatch\tmatch\t   \tcount\tbases\tcount\tbases\t      \tname     \tsize\tstart\tend\tname     \tsize\tstart\tend\tcount",
			"---------------------------------------------------------------------------------------------------------------------------------------------------------------");

	static String pslLine(String name, String chr, int[] sizes, int[] starts) {
		StringBuilder sizeList = new StringBuilder();
		StringBuilder qStarts = new StringBuilder();
		StringBuilder tStarts = new StringBuilder();
		int matches = 0;
		for(int i = 0; i < sizes.length; i++) {
			sizeList.append(sizes[i]).append(',');
			qStarts.append(matches).append(',');
			tStarts.append(starts[i]).append(',');
			matches += sizes[i];
		}
		int tEnd = starts[starts.length - 1] + sizes[sizes.length - 1];
		return matches + "\t0\t0\t0\t0\t0\t" + (sizes.length - 1) + "\t0\t+\t" + name + "\t" + matches + "\t0\t" + matches + "\t" +
				chr + "\t1000000\t" + starts[0] + "\t" + tEnd + "\t" + sizes.length + "\t" + sizeList + "\t" + qStarts + "\t" + tStarts;
	}

	static File writeTemp(String suffix, List<String> lines) throws IOException {
		File file = File.createTempFile("gimme", suffix);
		file.deleteOnExit();
		FileUtils.writeLines(file, "UTF-8", lines);
		return file;
	}

	public void testHeaderIsSkipped() throws IOException {
		List<String> lines = new ArrayList<String>(PSL_HEADER);
		lines.add(pslLine("read1", "chr1", new int[] {100, 150}, new int[] {100, 300}));
		lines.add(pslLine("read2", "chr2", new int[] {500}, new int[] {7}));
		PSLReader reader = new PSLReader(writeTemp(".psl", lines));
		try {
			assertTrue(reader.hasNext());
			AlignmentRecord first = reader.next();
			assertEquals("read1", first.getName());
			assertEquals("chr1", first.getChr());
			assertEquals(Arrays.asList(new GenomicBlock("chr1", 100, 199), new GenomicBlock("chr1", 300, 449)), first.getBlocks());

			AlignmentRecord second = reader.next();
			assertEquals(Arrays.asList(new GenomicBlock("chr2", 7, 506)), second.getBlocks());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}

	public void testFileWithoutHeader() throws IOException {
		PSLReader reader = new PSLReader(writeTemp(".psl", Arrays.asList(
				pslLine("read1", "chr1", new int[] {100, 150}, new int[] {100, 300}))));
		try {
			assertEquals(2, reader.next().getBlockCount());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}

	public void testPslxSequenceColumnsAreIgnored() throws IOException {
		List<String> lines = new ArrayList<String>(PSL_HEADER);
		lines.add(pslLine("read1", "chr1", new int[] {100, 150}, new int[] {100, 300}) + "\tacgt,acgt,\tacgt,acgt,");
		PSLReader reader = new PSLReader(writeTemp(".pslx", lines));
		try {
			assertTrue(reader.hasNext());
			assertEquals(Arrays.asList(new GenomicBlock("chr1", 100, 199), new GenomicBlock("chr1", 300, 449)), reader.next().getBlocks());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}

	public void testTruncatedRecordIsSkipped() throws IOException {
		String[] fields = pslLine("read1", "chr1", new int[] {100}, new int[] {100}).split("\t");
		String truncated = StringUtils.join(Arrays.copyOf(fields, 15), '\t');
		PSLReader reader = new PSLReader(writeTemp(".psl", Arrays.asList(
				truncated,
				pslLine("read2", "chr1", new int[] {100}, new int[] {500}))));
		try {
			assertEquals("read2", reader.next().getName());
			assertFalse(reader.hasNext());
		} finally {
			reader.close();
		}
	}

	public void testInconsistentBlockCount() throws IOException {
		String line = pslLine("read1", "chr1", new int[] {100, 150}, new int[] {100, 300});
		String[] fields = line.split("\t");
		fields[17] = "3";
		PSLReader reader = new PSLReader(writeTemp(".psl", Arrays.asList(StringUtils.join(fields, '\t'))));
		try {
			reader.hasNext();
			fail("Expected ParseException");
		} catch (ParseException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("Line 1"));
		} finally {
			reader.close();
		}
	}

	public void testMissingFile() {
		try {
			AlignmentReaders.open(new File("does/not/exist.psl"));
			fail("Expected IOException");
		} catch (IOException e) {
			// expected
		}
	}

	public void testPicksReaderByExtension() throws IOException {
		AlignmentRecordReader psl = AlignmentReaders.open(writeTemp(".psl", PSL_HEADER));
		try {
			assertTrue(psl instanceof PSLReader);
			assertFalse(psl.hasNext());
		} finally {
			psl.close();
		}
		AlignmentRecordReader sam = AlignmentReaders.open(writeTemp(".sam", Arrays.asList("@SQ\tSN:chr1\tLN:100000")));
		try {
			assertTrue(sam instanceof SAMAlignmentReader);
			assertFalse(sam.hasNext());
		} finally {
			sam.close();
		}
	}
}
