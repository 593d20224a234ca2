package oztree.tokens;

import java.io.File;

/**
 * Inclusion of a hand curated OneZoom file through the token mapping, e.g. AMORPHEA@ -> Amorphea.PHY.
 */
public class FragmentInclusion extends InclusionToken {

	private final MappingEntry mappingEntry;

	public FragmentInclusion(int start, int end, String nodeNameInParent, String edgeLengthInParent,
			MappingEntry mappingEntry) {
		super(start, end, nodeNameInParent, edgeLengthInParent);
		this.mappingEntry = mappingEntry;
	}

	public MappingEntry getMappingEntry() {return this.mappingEntry;}

	@Override
	public boolean expandNodes() {
		return true;
	}

	@Override
	public String getOverrideEdgeLength() {
		return this.mappingEntry.getEdgeLength();
	}

	@Override
	public String getOverrideTaxon() {
		return this.mappingEntry.getTaxon();
	}

	@Override
	public File resolveFile(File fragmentsFolder, File referencePartsFolder) {
		return new File(fragmentsFolder, this.mappingEntry.getFile());
	}

	@Override
	public String toString() {
		return "FragmentInclusion[" + this.getNodeNameInParent() + " -> " + this.mappingEntry + "]";
	}
}
