package oztree.tokens;

import java.io.File;

/**
 * A node label ending in '@' that marks where another tree is spliced in. There are exactly two
 *	kinds: ReferenceInclusion (a subtree of the Open Tree, already fully resolved) and
 *	FragmentInclusion (a hand curated OneZoom file, which may hold further tokens).
 *
 * start and end are offsets of the whole token in the scanned text, optional quotes and the
 *	trailing ":<edge length>" included.
 */
public abstract class InclusionToken {

	private final int start;
	private final int end;
	private final String nodeNameInParent;
	private final String edgeLengthInParent;

	protected InclusionToken(int start, int end, String nodeNameInParent, String edgeLengthInParent) {
		this.start = start;
		this.end = end;
		this.nodeNameInParent = nodeNameInParent;
		this.edgeLengthInParent = edgeLengthInParent;
	}

	public int getStart() {return this.start;}

	public int getEnd() {return this.end;}

	/** @return the node name with the inclusion syntax (~ clause, @) removed */
	public String getNodeNameInParent() {return this.nodeNameInParent;}

	/** @return the ":<length>" after the '@' as written, or null */
	public String getEdgeLengthInParent() {return this.edgeLengthInParent;}

	/** @return true if the included tree must itself be scanned for tokens */
	public abstract boolean expandNodes();

	/** @return the edge length replacing the one the included tree ends with, or null */
	public abstract String getOverrideEdgeLength();

	/** @return the node name replacing the one the included tree ends with, or null */
	public abstract String getOverrideTaxon();

	/**
	 * @param fragmentsFolder folder holding the hand curated OneZoom files
	 * @param referencePartsFolder folder holding the extracted Open Tree parts
	 * @return the file whose contents replace this token
	 */
	public abstract File resolveFile(File fragmentsFolder, File referencePartsFolder);
}
