package oztree.extract;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import oztree.GeneralUtils;
import oztree.constants.GeneralConstants;
import oztree.exceptions.TokenNotFoundException;
import oztree.tokens.InclusionToken;
import oztree.tokens.ReferenceInclusion;
import oztree.tokens.TokenDecoder;

/**
 * Prepares the reference parts that the TreeAssembler splices in: every Open Tree inclusion found
 *	in the OneZoom fragment files (e.g. Brachiopoda_ott826261@) is extracted from the full Open Tree
 *	into <output dir>/<ott>.phy, minus the subtrees its token excludes.
 */
public class OpenTreePartsExtractor {
	static Logger _LOG = Logger.getLogger(OpenTreePartsExtractor.class);

	private final TokenDecoder decoder;
	private final Set<String> includedOtts = new TreeSet<String>();
	private final Set<String> excludedOtts = new TreeSet<String>();

	public OpenTreePartsExtractor(TokenDecoder decoder) {
		this.decoder = decoder;
	}

	/**
	 * Gathers the included and excluded ott ids of every reference token in a fragment file.
	 *	Excluded otts apply to all extracted parts, not just the one that named them.
	 */
	public void addFragmentFile(File fragmentFile) throws IOException, TokenNotFoundException {
		_LOG.info("== Processing One Zoom file " + fragmentFile);
		try {
			this.addFragment(GeneralUtils.readTreeFile(fragmentFile));
		} catch (TokenNotFoundException tnfx) {
			tnfx.setSourceFile(fragmentFile.getPath());
			throw tnfx;
		}
	}

	public void addFragment(String fragmentTree) throws TokenNotFoundException {
		List<InclusionToken> tokens = this.decoder.findTokens(fragmentTree);
		for (InclusionToken token : tokens) {
			// inclusions of other OneZoom files have no ott
			if (token instanceof ReferenceInclusion) {
				ReferenceInclusion ref = (ReferenceInclusion) token;
				this.includedOtts.add(ref.getBaseOtt());
				this.excludedOtts.addAll(ref.getExcludedOtts());
			}
		}
	}

	public Set<String> getIncludedOtts() {
		return this.includedOtts;
	}

	public Set<String> getExcludedOtts() {
		return this.excludedOtts;
	}

	/**
	 * Extracts all gathered subtrees from the full reference tree and writes one file per ott id.
	 *
	 * @return the number of files written
	 */
	public int writeParts(File referenceTreeFile, File outputDir) throws IOException {
		if (!referenceTreeFile.isFile()) {
			_LOG.warn("Could not find the OpenTree file " + referenceTreeFile);
		}
		String fullTree = GeneralUtils.readTrimmedTree(referenceTreeFile);
		Map<String, String> trees = SubtreeExtractor.extract(fullTree, this.includedOtts, this.excludedOtts);
		_LOG.info("Extracted " + trees.size() + " trees from Open Tree file");

		FileUtils.forceMkdir(outputDir);
		for (Map.Entry<String, String> e : trees.entrySet()) {
			File f = new File(outputDir, e.getKey() + GeneralConstants.REFERENCE_PART_EXTENSION.stringValue());
			_LOG.debug("Writing file: " + f);
			FileUtils.writeStringToFile(f, e.getValue() + ";\n", StandardCharsets.UTF_8);
		}
		return trees.size();
	}
}
