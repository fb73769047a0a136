package gimme.core.annotation;

import java.util.Arrays;

import gimme.core.error.ParseException;
import junit.framework.TestCase;

public class AssemblyTest extends TestCase {

	public void testToBED() {
		Assembly assembly = new Assembly(Arrays.asList(
				GenomicBlock.fromHalfOpen("chr1", 300, 150),
				GenomicBlock.fromHalfOpen("chr1", 100, 100)), "chr1:1.1");
		assertEquals("chr1\t100\t450\tchr1:1.1\t1000\t+\t100\t450\t0,0,0\t2\t100,150\t0,200", assembly.toBED());
		assertEquals(250, assembly.getLength());
	}

	public void testBEDFactoryReadsWhatIsWritten() {
		Assembly assembly = new Assembly(Arrays.asList(
				GenomicBlock.fromHalfOpen("chr2", 1000, 50),
				GenomicBlock.fromHalfOpen("chr2", 2000, 70),
				GenomicBlock.fromHalfOpen("chr2", 3000, 20)), "chr2:4.2");
		Assembly read = new Assembly.BEDFactory().create(assembly.toBED().split("\t"));
		assertEquals(assembly.getBlocks(), read.getBlocks());
		assertEquals("chr2:4.2", read.getName());
		assertEquals("+", read.getStrand());
	}

	public void testBEDFactoryRejectsInconsistentBlocks() {
		String[] fields = "chr1\t0\t100\tx\t0\t+\t0\t100\t0\t2\t100\t0".split("\t");
		try {
			new Assembly.BEDFactory().create(fields);
			fail("Expected ParseException");
		} catch (ParseException e) {
			assertTrue(e.getMessage().contains("blockCount"));
		}
	}

	public void testEmptyAssemblyIsRejected() {
		try {
			new Assembly(Arrays.<GenomicBlock>asList());
			fail("Expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}
}
