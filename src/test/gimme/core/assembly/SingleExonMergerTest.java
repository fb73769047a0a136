package gimme.core.assembly;

import static gimme.core.assembly.AssemblyTestUtils.exon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gimme.core.annotation.GenomicBlock;
import junit.framework.TestCase;

public class SingleExonMergerTest extends TestCase {

	private static Map<String, List<GenomicBlock>> input(String chr, GenomicBlock... exons) {
		Map<String, List<GenomicBlock>> rtrn = new LinkedHashMap<String, List<GenomicBlock>>();
		rtrn.put(chr, new ArrayList<GenomicBlock>(Arrays.asList(exons)));
		return rtrn;
	}

	public void testOverlappingExonsAreMerged() {
		Map<String, List<GenomicBlock>> merged = SingleExonMerger.mergeSingleExons(input("chr1",
				exon("chr1", 400, 100), exon("chr1", 100, 100), exon("chr1", 150, 150)));
		assertEquals(Arrays.asList(new GenomicBlock("chr1", 100, 299), new GenomicBlock("chr1", 400, 499)), merged.get("chr1"));
	}

	public void testAdjacentExonsAreNotMerged() {
		Map<String, List<GenomicBlock>> merged = SingleExonMerger.mergeSingleExons(input("chr1",
				exon("chr1", 100, 100), exon("chr1", 200, 100)));
		assertEquals(2, merged.get("chr1").size());
	}

	public void testContainedExonIsAbsorbed() {
		Map<String, List<GenomicBlock>> merged = SingleExonMerger.mergeSingleExons(input("chr1",
				exon("chr1", 100, 400), exon("chr1", 200, 100), exon("chr1", 450, 100)));
		assertEquals(Arrays.asList(new GenomicBlock("chr1", 100, 549)), merged.get("chr1"));
	}

	public void testChromosomesInNameOrderAndInputUntouched() {
		Map<String, List<GenomicBlock>> perChromosome = input("chr2", exon("chr2", 500, 100), exon("chr2", 0, 100));
		perChromosome.put("chr1", new ArrayList<GenomicBlock>(Arrays.asList(exon("chr1", 0, 100))));

		Map<String, List<GenomicBlock>> merged = SingleExonMerger.mergeSingleExons(perChromosome);
		assertEquals(Arrays.asList("chr1", "chr2"), new ArrayList<String>(merged.keySet()));
		assertEquals(exon("chr2", 0, 100), merged.get("chr2").get(0));
		assertEquals(exon("chr2", 500, 100), perChromosome.get("chr2").get(0));
	}
}
