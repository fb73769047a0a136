package gimme.core.programs;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;

import gimme.core.assembly.AssemblyParameters;
import gimme.core.assembly.AssemblySummary;
import junit.framework.TestCase;

public class GimmeTest extends TestCase {

	private static final String PSL_RECORD_1 =
			"400\t0\t0\t0\t0\t0\t2\t1800\t+\tread1\t400\t0\t400\tchr1\t1000000\t0\t2200\t3\t100,100,200,\t0,100,200,\t0,1000,2000,";
	private static final String PSL_RECORD_2 =
			"300\t0\t0\t0\t0\t0\t1\t1900\t+\tread2\t300\t0\t300\tchr1\t1000000\t0\t2200\t2\t100,200,\t0,100,\t0,2000,";

	private static File temp(String suffix) throws IOException {
		File file = File.createTempFile("gimme", suffix);
		file.deleteOnExit();
		return file;
	}

	public void testAssemblesPSLIntoBED() throws IOException {
		File psl = temp(".psl");
		FileUtils.writeLines(psl, "UTF-8", Arrays.asList("psLayout version 3", "", PSL_RECORD_1));
		File psl2 = temp(".psl");
		FileUtils.writeLines(psl2, "UTF-8", Arrays.asList(PSL_RECORD_2));
		File bed = temp(".bed");

		AssemblyParameters parameters = new AssemblyParameters.Builder().minTranscriptLength(250).build();
		AssemblySummary summary = Gimme.run(parameters, new String[] {psl.getPath(), psl2.getPath()}, bed.getPath());

		List<String> lines = FileUtils.readLines(bed, "UTF-8");
		assertEquals(Arrays.asList(
				"chr1\t0\t2200\tchr1:1.1\t1000\t+\t0\t2200\t0,0,0\t3\t100,100,200\t0,1000,2000",
				"chr1\t0\t2200\tchr1:1.2\t1000\t+\t0\t2200\t0,0,0\t2\t100,200\t0,2000"), lines);
		assertEquals(1, summary.getGeneCount());
		assertEquals(2, summary.getTranscriptCount());
		assertEquals(3, summary.getExonCount());
	}

	public void testIntronRetentionFromAssembledModels() throws IOException {
		File bed = temp(".bed");
		List<String> models = new ArrayList<String>();
		models.add("chr1\t100\t400\tchr1:1.1\t1000\t+\t100\t400\t0,0,0\t2\t100,100\t0,200");
		models.add("chr1\t100\t400\tchr1:1.2\t1000\t+\t100\t400\t0,0,0\t1\t300\t0");
		FileUtils.writeLines(bed, "UTF-8", models);
		File gff = temp(".gff");

		FindIntronRetention.run(bed, gff.getPath());

		List<String> lines = FileUtils.readLines(gff, "UTF-8");
		assertEquals(6, lines.size());
		assertEquals("chr1\tRI\tgene\t101\t400\t.\t+\t.\tID=chr1-1.ev1;Name=chr1-1", lines.get(0));
	}

	public void testMissingInput() {
		try {
			Gimme.run(AssemblyParameters.defaults(), new String[] {"does/not/exist.psl"}, null);
			fail("Expected IOException");
		} catch (IOException e) {
			// expected
		}
	}
}
