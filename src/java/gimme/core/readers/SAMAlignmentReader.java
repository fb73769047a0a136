package gimme.core.readers;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import htsjdk.samtools.AlignmentBlock;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;

import gimme.core.annotation.AlignmentRecord;
import gimme.core.annotation.GenomicBlock;

/**
 * Reading a SAM or BAM file and iterate as alignment records.
 * Unmapped, secondary and supplementary records are skipped. Every aligned block of a record becomes
 * one block of the alignment; splits at insertions and deletions are closed later by gap filling.
 */
public class SAMAlignmentReader implements AlignmentRecordReader {

	private final SamReader reader;
	private final SAMRecordIterator iter;
	private AlignmentRecord nextAlignment;

	public SAMAlignmentReader(File samFile) {
		reader = SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT).open(samFile);
		iter = reader.iterator();
		nextAlignment = advance();
	}

	@Override
	public boolean hasNext() {
		return nextAlignment != null;
	}

	@Override
	public AlignmentRecord next() {
		if(nextAlignment == null) {
			throw new NoSuchElementException();
		}
		AlignmentRecord lastAlignment = nextAlignment;
		nextAlignment = advance();
		return lastAlignment;
	}

	private AlignmentRecord advance() {
		while(iter.hasNext()) {
			SAMRecord record = iter.next();
			if(record.getReadUnmappedFlag() || record.isSecondaryOrSupplementary()) {
				continue;
			}
			return toAlignment(record);
		}
		return null;
	}

	static AlignmentRecord toAlignment(SAMRecord record) {
		String chr = record.getReferenceName();
		List<GenomicBlock> blocks = new ArrayList<GenomicBlock>();
		for(AlignmentBlock block : record.getAlignmentBlocks()) {
			// SAM blocks are 1-based
			blocks.add(GenomicBlock.fromHalfOpen(chr, block.getReferenceStart() - 1, block.getLength()));
		}
		return new AlignmentRecord(record.getReadName(), chr, blocks);
	}

	@Override
	public void remove() {
		throw new UnsupportedOperationException("Not implemented");
	}

	@Override
	public void close() throws IOException {
		iter.close();
		reader.close();
	}
}
