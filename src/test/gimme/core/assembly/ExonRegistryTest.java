package gimme.core.assembly;

import static gimme.core.assembly.AssemblyTestUtils.blocks;
import static gimme.core.assembly.AssemblyTestUtils.exon;

import java.util.List;

import junit.framework.TestCase;

public class ExonRegistryTest extends TestCase {

	public void testTerminalFlagsOfNewExons() {
		ExonRegistry registry = new ExonRegistry();
		List<Integer> handles = registry.addExons(blocks("chr1", 0, 100, 300, 100, 600, 100));
		assertEquals(3, handles.size());
		assertEquals(Terminal.LEFT, registry.get(handles.get(0).intValue()).getTerminal());
		assertEquals(Terminal.NONE, registry.get(handles.get(1).intValue()).getTerminal());
		assertEquals(Terminal.RIGHT, registry.get(handles.get(2).intValue()).getTerminal());
	}

	public void testSameCoordinatesGiveOneEntry() {
		ExonRegistry registry = new ExonRegistry();
		List<Integer> first = registry.addExons(blocks("chr1", 100, 100, 300, 100));
		List<Integer> second = registry.addExons(blocks("chr1", 100, 100, 300, 150));
		assertEquals(3, registry.size());
		assertEquals(first.get(0), second.get(0));
		assertSame(registry.get(first.get(0).intValue()), registry.find(exon("chr1", 100, 100)));
	}

	public void testSameCoordinatesOnOtherChromosomeAreDistinct() {
		ExonRegistry registry = new ExonRegistry();
		registry.addExons(blocks("chr1", 100, 100, 300, 100));
		registry.addExons(blocks("chr2", 100, 100, 300, 100));
		assertEquals(4, registry.size());
	}

	public void testInternalOccurrenceClearsTerminalFlag() {
		ExonRegistry registry = new ExonRegistry();
		registry.addExons(blocks("chr1", 300, 100, 600, 100));
		assertEquals(Terminal.LEFT, registry.find(exon("chr1", 300, 100)).getTerminal());
		registry.addExons(blocks("chr1", 0, 100, 300, 100, 600, 100));
		assertEquals(Terminal.NONE, registry.find(exon("chr1", 300, 100)).getTerminal());
		assertEquals(Terminal.RIGHT, registry.find(exon("chr1", 600, 100)).getTerminal());
	}

	public void testTerminalOccurrenceDoesNotRestoreFlag() {
		ExonRegistry registry = new ExonRegistry();
		registry.addExons(blocks("chr1", 0, 100, 300, 100, 600, 100));
		registry.addExons(blocks("chr1", 300, 100, 600, 100));
		assertEquals(Terminal.NONE, registry.find(exon("chr1", 300, 100)).getTerminal());
	}

	public void testLeftRightConflictKeepsFirstFlag() {
		ExonRegistry registry = new ExonRegistry();
		registry.addExons(blocks("chr1", 300, 100, 600, 100));
		registry.addExons(blocks("chr1", 0, 100, 300, 100));
		assertEquals(Terminal.LEFT, registry.find(exon("chr1", 300, 100)).getTerminal());
	}
}
