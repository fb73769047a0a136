package gimme.core.readers;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FilenameUtils;

/**
 * Picks the alignment reader from the file extension: <i>.sam</i> and <i>.bam</i> are read with htsjdk,
 * anything else is read as PSL.
 */
public final class AlignmentReaders {

	private AlignmentReaders() {}

	public static AlignmentRecordReader open(File file) throws IOException {
		if(!file.isFile()) {
			throw new IOException("Alignment file " + file + " does not exist");
		}
		String extension = FilenameUtils.getExtension(file.getName()).toLowerCase();
		if(extension.equals("sam") || extension.equals("bam")) {
			return new SAMAlignmentReader(file);
		}
		return new PSLReader(file);
	}
}
