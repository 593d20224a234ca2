package oztree.tokens;

import java.io.File;
import java.util.Collections;
import java.util.List;
import oztree.constants.GeneralConstants;

/**
 * Inclusion of an Open Tree subtree, e.g. Brachiopoda_ott826261@ or foobar_ott123~456-789-111@.
 *	The subtree rooted at base_ott has been extracted ahead of time to <base_ott>.phy, minus the
 *	subtrees of the excluded otts.
 */
public class ReferenceInclusion extends InclusionToken {

	private final String baseOtt;
	private final List<String> excludedOtts;

	public ReferenceInclusion(int start, int end, String nodeNameInParent, String edgeLengthInParent,
			String baseOtt, List<String> excludedOtts) {
		super(start, end, nodeNameInParent, edgeLengthInParent);
		this.baseOtt = baseOtt;
		this.excludedOtts = Collections.unmodifiableList(excludedOtts);
	}

	public String getBaseOtt() {return this.baseOtt;}

	public List<String> getExcludedOtts() {return this.excludedOtts;}

	@Override
	public boolean expandNodes() {
		return false;
	}

	@Override
	public String getOverrideEdgeLength() {
		return null;
	}

	@Override
	public String getOverrideTaxon() {
		return null;
	}

	/**
	 * @return <base_ott>.phy, or <base_ott>.nwk (used for additional copied files) if there is no .phy
	 */
	@Override
	public File resolveFile(File fragmentsFolder, File referencePartsFolder) {
		File f = new File(referencePartsFolder, this.baseOtt + GeneralConstants.REFERENCE_PART_EXTENSION.stringValue());
		if (!f.exists()) {
			f = new File(referencePartsFolder, this.baseOtt + GeneralConstants.REFERENCE_PART_FALLBACK_EXTENSION.stringValue());
		}
		return f;
	}

	@Override
	public String toString() {
		return "ReferenceInclusion[" + this.getNodeNameInParent() + ", base_ott=" + this.baseOtt
				+ ", excluded_otts=" + this.excludedOtts + "]";
	}
}
