package gimme.core.assembly;

/**
 * Position of an exon in the alignments it was seen in.
 * LEFT marks the first exon of an alignment, RIGHT the last one.
 */
public enum Terminal {
	NONE,
	LEFT,
	RIGHT;

	public boolean isTerminal() {
		return this != NONE;
	}
}
