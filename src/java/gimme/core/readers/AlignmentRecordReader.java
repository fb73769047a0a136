package gimme.core.readers;

import java.io.Closeable;
import java.util.Iterator;

import gimme.core.annotation.AlignmentRecord;

/**
 * Iterates over the alignments of one input file
 */
public interface AlignmentRecordReader extends Iterator<AlignmentRecord>, Closeable {

}
