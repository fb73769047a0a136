package gimme.core.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gimme.core.annotation.GenomicBlock;

/**
 * A spliced exon pair together with the exons of the same gene that span it, retaining the intron
 */
public class RetentionEvent {

	private final GenomicBlock upstream;
	private final GenomicBlock downstream;
	private final List<GenomicBlock> retainingExons;

	public RetentionEvent(GenomicBlock upstream, GenomicBlock downstream, List<GenomicBlock> retainingExons) {
		this.upstream = upstream;
		this.downstream = downstream;
		this.retainingExons = Collections.unmodifiableList(new ArrayList<GenomicBlock>(retainingExons));
	}

	public GenomicBlock getUpstream() {
		return upstream;
	}

	public GenomicBlock getDownstream() {
		return downstream;
	}

	public List<GenomicBlock> getRetainingExons() {
		return retainingExons;
	}

	public int getStart() {
		return upstream.getStart();
	}

	public int getEnd() {
		return downstream.getEnd();
	}

	@Override
	public String toString() {
		return upstream + "^" + downstream + " retained by " + retainingExons;
	}
}
