package oztree.newick;

/**
 * One node as seen by the NewickScanner. Nodes are never linked to each other: the record only
 * knows where the node sits in the source text and how deeply it is nested.
 *
 * The span [start, end) starts at the open parenthesis of an interior node (or at the label of a
 *	leaf) and ends after the edge length, if any.
 */
public class NodeRecord {

	private final String taxon;
	private final String ott;
	private final String label;
	private final double edgeLength;
	private final boolean hasEdgeLength;
	private final int start;
	private final int end;
	private final int labelStart;
	private final int depth;
	private final boolean leaf;

	public NodeRecord(String taxon, String ott, String label, double edgeLength, boolean hasEdgeLength,
			int start, int end, int labelStart, int depth, boolean leaf) {
		this.taxon = taxon;
		this.ott = ott;
		this.label = label;
		this.edgeLength = edgeLength;
		this.hasEdgeLength = hasEdgeLength;
		this.start = start;
		this.end = end;
		this.labelStart = labelStart;
		this.depth = depth;
		this.leaf = leaf;
	}

	/** @return the name without any _ott suffix or quotes, or null */
	public String getTaxon() {return this.taxon;}

	/** @return the digits after _ott in the name (possibly empty), or null */
	public String getOtt() {return this.ott;}

	/** @return the label exactly as written, quotes and _ott suffix included, or null */
	public String getLabel() {return this.label;}

	public double getEdgeLength() {return this.edgeLength;}

	public boolean hasEdgeLength() {return this.hasEdgeLength;}

	public int getStart() {return this.start;}

	public int getEnd() {return this.end;}

	/** @return offset of the first character of the label (after the closing parenthesis for interior nodes) */
	public int getLabelStart() {return this.labelStart;}

	public int getDepth() {return this.depth;}

	public boolean isLeaf() {return this.leaf;}

	/**
	 * @return true if either the taxon name or the ott id is in `ids`
	 */
	public boolean matches(java.util.Set<String> ids) {
		return (this.taxon != null && ids.contains(this.taxon)) || (this.ott != null && ids.contains(this.ott));
	}

	/**
	 * @return the ott id if there is one, otherwise the taxon name
	 */
	public String getKey() {
		if (this.ott != null && !this.ott.isEmpty()) {
			return this.ott;
		}
		return this.taxon;
	}

	@Override
	public String toString() {
		return "NodeRecord[taxon=" + this.taxon + ", ott=" + this.ott + ", edge_length=" + this.edgeLength
				+ ", span=" + this.start + ".." + this.end + ", depth=" + this.depth + ", leaf=" + this.leaf + "]";
	}
}
