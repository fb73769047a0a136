package gimme.core.annotation;

/**
 * A contiguous block on a reference sequence.
 * Start is 0-based and end is 0-based <b>inclusive</b>, so a block covering a single base has start == end.
 * Two blocks with the same chromosome, start and end are equal.
 *
 */
public class GenomicBlock implements Comparable<GenomicBlock> {

	private final String chr;
	private final int start;
	private final int end;

	public GenomicBlock(String chr, int start, int end) {
		this.chr = chr;
		this.start = start;
		this.end = end;
	}

	/**
	 * Builds a block from half-open input coordinates (PSL, BED, SAM blocks)
	 * @param chr reference name
	 * @param start 0-based start
	 * @param size number of aligned bases
	 * @return block with an inclusive end
	 */
	public static GenomicBlock fromHalfOpen(String chr, int start, int size) {
		return new GenomicBlock(chr, start, start + size - 1);
	}

	public String getChr() {
		return chr;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @return the exclusive end, as written to BED files
	 */
	public int getEndExclusive() {
		return end + 1;
	}

	public int getLength() {
		return end - start + 1;
	}

	public GenomicBlock withEnd(int newEnd) {
		return new GenomicBlock(chr, start, newEnd);
	}

	public String toUCSC() {
		return chr + ":" + start + "-" + end;
	}

	@Override
	public int compareTo(GenomicBlock other) {
		int cmp = chr.compareTo(other.chr);
		if(cmp != 0) {
			return cmp;
		}
		if(start != other.start) {
			return start < other.start ? -1 : 1;
		}
		if(end != other.end) {
			return end < other.end ? -1 : 1;
		}
		return 0;
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) {
			return true;
		}
		if(!(o instanceof GenomicBlock)) {
			return false;
		}
		GenomicBlock other = (GenomicBlock) o;
		return start == other.start && end == other.end && chr.equals(other.chr);
	}

	@Override
	public int hashCode() {
		int result = chr.hashCode();
		result = 31 * result + start;
		result = 31 * result + end;
		return result;
	}

	@Override
	public String toString() {
		return toUCSC();
	}
}
