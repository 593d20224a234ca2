package oztree.tokens;

/**
 * Where a symbolic inclusion token (e.g. AMORPHEA@) points: the fragment file, plus the edge
 *	length and node name that override whatever the fragment itself ends with.
 */
public class MappingEntry {

	private final String file;
	private final String edgeLength;
	private final String taxon;

	/**
	 * @param file fragment file name, relative to the fragments folder
	 * @param edgeLength edge length as it should be written out, or null
	 * @param taxon node name to use for the fragment root, or null
	 */
	public MappingEntry(String file, String edgeLength, String taxon) {
		this.file = file;
		this.edgeLength = edgeLength;
		this.taxon = taxon;
	}

	public String getFile() {return this.file;}

	public String getEdgeLength() {return this.edgeLength;}

	public String getTaxon() {return this.taxon;}

	@Override
	public String toString() {
		return "{file: " + this.file + ", edge_length: " + this.edgeLength + ", taxon: " + this.taxon + "}";
	}
}
