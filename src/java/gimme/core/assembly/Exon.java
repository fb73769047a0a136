package gimme.core.assembly;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import gimme.core.annotation.GenomicBlock;

/**
 * This class represents an exon of the registry. Exons are identified by their coordinates and
 * referenced everywhere else by their integer handle.
 */
public class Exon {

	private final int handle;
	private final GenomicBlock block;
	private Terminal terminal;
	private final Set<Integer> nextExons;
	private final Set<Integer> introns;

	Exon(int handle, GenomicBlock block, Terminal terminal) {
		this.handle = handle;
		this.block = block;
		this.terminal = terminal;
		this.nextExons = new LinkedHashSet<Integer>();
		this.introns = new LinkedHashSet<Integer>();
	}

	public int getHandle() {
		return handle;
	}

	public GenomicBlock getBlock() {
		return block;
	}

	public String getChr() {
		return block.getChr();
	}

	public int getStart() {
		return block.getStart();
	}

	public int getEnd() {
		return block.getEnd();
	}

	public int getLength() {
		return block.getLength();
	}

	public Terminal getTerminal() {
		return terminal;
	}

	void setTerminal(Terminal terminal) {
		this.terminal = terminal;
	}

	/**
	 * @return handles of the exons observed directly downstream of this one
	 */
	public Set<Integer> getNextExons() {
		return Collections.unmodifiableSet(nextExons);
	}

	void addNextExon(int exonHandle) {
		nextExons.add(exonHandle);
	}

	/**
	 * @return handles of the splice junctions this exon borders
	 */
	public Set<Integer> getIntrons() {
		return Collections.unmodifiableSet(introns);
	}

	void addIntron(int intronHandle) {
		introns.add(intronHandle);
	}

	public String getName() {
		return block.toUCSC();
	}

	@Override
	public String toString() {
		return getName() + (terminal.isTerminal() ? " [" + terminal + "]" : "");
	}
}
