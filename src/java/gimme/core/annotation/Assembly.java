package gimme.core.annotation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import gimme.core.error.ParseException;
import gimme.core.general.TabbedReader;

/**
 * This class represents an assembled transcript model: an ordered set of exon blocks on one chromosome
 */
public class Assembly {

	public static final int BED_SCORE = 1000;
	public static final String ITEM_RGB = "0,0,0";

	private final String chr;
	private final List<GenomicBlock> blocks;
	private String name;
	private String strand;

	public Assembly(Collection<GenomicBlock> exons) {
		if(exons.isEmpty()) {
			throw new IllegalArgumentException("An assembly needs at least one exon");
		}
		List<GenomicBlock> sorted = new ArrayList<GenomicBlock>(exons);
		Collections.sort(sorted);
		this.blocks = Collections.unmodifiableList(sorted);
		this.chr = sorted.get(0).getChr();
		this.strand = "+";
	}

	public Assembly(Collection<GenomicBlock> exons, String name) {
		this(exons);
		this.name = name;
	}

	public String getChr() {
		return chr;
	}

	public List<GenomicBlock> getBlocks() {
		return blocks;
	}

	public int getStart() {
		return blocks.get(0).getStart();
	}

	/**
	 * @return inclusive end of the last exon
	 */
	public int getEnd() {
		return blocks.get(blocks.size() - 1).getEnd();
	}

	/**
	 * @return summed exon length, introns excluded
	 */
	public int getLength() {
		return ExonBlocks.totalLength(blocks);
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getStrand() {
		return strand;
	}

	public void setStrand(String strand) {
		this.strand = strand;
	}

	/**
	 * BED12 line without a trailing newline
	 */
	public String toBED() {
		int chromStart = getStart();
		int chromEnd = blocks.get(blocks.size() - 1).getEndExclusive();
		List<Integer> sizes = new ArrayList<Integer>(blocks.size());
		List<Integer> starts = new ArrayList<Integer>(blocks.size());
		for(GenomicBlock block : blocks) {
			sizes.add(block.getLength());
			starts.add(block.getStart() - chromStart);
		}
		return StringUtils.join(new Object[] {
				chr,
				chromStart,
				chromEnd,
				name,
				BED_SCORE,
				strand,
				chromStart,
				chromEnd,
				ITEM_RGB,
				blocks.size(),
				StringUtils.join(sizes, ','),
				StringUtils.join(starts, ',')}, '\t');
	}

	@Override
	public String toString() {
		return name + " " + blocks;
	}

	/**
	 * Reads back the BED12 lines written by {@link #toBED()}
	 */
	public static class BEDFactory implements TabbedReader.Factory<Assembly> {

		public static final int BED12_COLUMNS = 12;

		@Override
		public Assembly create(String[] rawFields) throws ParseException {
			if(rawFields.length < BED12_COLUMNS) {
				throw new ParseException("Cannot create assembly from " + rawFields.length + " fields, BED12 needs " + BED12_COLUMNS);
			}
			try {
				String chr = rawFields[0];
				int chromStart = Integer.parseInt(rawFields[1]);
				int blockCount = Integer.parseInt(rawFields[9]);
				String[] sizes = StringUtils.split(rawFields[10], ',');
				String[] starts = StringUtils.split(rawFields[11], ',');
				if(sizes.length != blockCount || starts.length != blockCount) {
					throw new ParseException("BAD BED FORMAT the number of start (" + rawFields[11] + ") and size (" + rawFields[10] +
							") items does not agree with the blockCount " + blockCount);
				}
				List<GenomicBlock> exons = new ArrayList<GenomicBlock>(blockCount);
				for(int i = 0; i < blockCount; i++) {
					exons.add(GenomicBlock.fromHalfOpen(chr, chromStart + Integer.parseInt(starts[i].trim()), Integer.parseInt(sizes[i].trim())));
				}
				Assembly assembly = new Assembly(exons, rawFields[3]);
				assembly.setStrand(rawFields[5]);
				return assembly;
			} catch (NumberFormatException e) {
				throw new ParseException("Invalid number in BED record " + StringUtils.join(rawFields, '\t'), e);
			}
		}
	}
}
