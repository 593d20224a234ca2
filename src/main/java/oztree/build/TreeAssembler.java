package oztree.build;

import java.io.File;
import java.io.IOException;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import oztree.GeneralUtils;
import oztree.MessageLogger;
import oztree.exceptions.TokenNotFoundException;
import oztree.exceptions.TreeAssemblyException;
import oztree.newick.NewickScanner;
import oztree.tokens.FragmentInclusion;
import oztree.tokens.InclusionToken;
import oztree.tokens.TokenDecoder;

/**
 * Builds the complete OneZoom tree in one pass, starting with the base file (e.g. base.PHY) and
 *	recursively replacing every inclusion token with the file it points to. Hand curated
 *	fragments are expanded in turn; extracted Open Tree parts are copied as they are.
 *
 * A missing included file is not fatal: the token is left in the output as written and a warning is
 *	logged. A fragment that is not valid Newick aborts the whole build.
 */
public class TreeAssembler {
	static Logger _LOG = Logger.getLogger(TreeAssembler.class);

	private final TokenDecoder decoder;
	private MessageLogger fileTreeLogger = null;

	public TreeAssembler(TokenDecoder decoder) {
		this.decoder = decoder;
	}

	/**
	 * Prints one indented line per expanded fragment while building (the --printfiletree report).
	 *	Pass null to turn it off again.
	 */
	public void setFileTreeLogger(MessageLogger fileTreeLogger) {
		this.fileTreeLogger = fileTreeLogger;
	}

	/**
	 * Builds the tree, assuming the fragments live in the same folder as the base file.
	 */
	public void build(File baseFile, File referencePartsFolder, Appendable out)
			throws TreeAssemblyException, TokenNotFoundException {
		this.build(baseFile, baseFile.getAbsoluteFile().getParentFile(), referencePartsFolder, out);
	}

	/**
	 * @param baseFile the root fragment
	 * @param fragmentsFolder folder the mapping table file names are relative to
	 * @param referencePartsFolder folder holding the <ott>.phy / <ott>.nwk Open Tree parts
	 * @param out receives the assembled tree, terminated with a semicolon
	 * @throws TreeAssemblyException if the base file is missing or a file cannot be read
	 * @throws TokenNotFoundException if a fragment uses a symbolic token with no mapping
	 */
	public void build(File baseFile, File fragmentsFolder, File referencePartsFolder, Appendable out)
			throws TreeAssemblyException, TokenNotFoundException {
		if (!baseFile.isFile()) {
			throw new TreeAssemblyException("Base tree file " + baseFile + " does not exist");
		}
		AssemblyContext ctx = new AssemblyContext(fragmentsFolder, referencePartsFolder, this.decoder, out,
				this.fileTreeLogger);
		try {
			this.processNewick(ctx, baseFile, null);
			out.append(';');
		} catch (IOException e) {
			throw new TreeAssemblyException("Could not assemble the tree from " + baseFile + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Builds the whole tree into a String, so nothing is written out unless the build succeeds.
	 */
	public String build(File baseFile, File fragmentsFolder, File referencePartsFolder)
			throws TreeAssemblyException, TokenNotFoundException {
		StringBuilder sb = new StringBuilder();
		this.build(baseFile, fragmentsFolder, referencePartsFolder, sb);
		return sb.toString();
	}

	/**
	 * Copies one file to the output, expanding its tokens if it is a fragment.
	 *
	 * @param token the token this file replaces, or null for the base file
	 * @return false if the file does not exist, in which case nothing was written
	 */
	private boolean processNewick(AssemblyContext ctx, File file, InclusionToken token)
			throws IOException, TokenNotFoundException {
		_LOG.debug("Processing " + file);

		FragmentInclusion fragment = (token instanceof FragmentInclusion) ? (FragmentInclusion) token : null;
		boolean expandNodes = token == null || token.expandNodes();

		if (ctx.fileTreeLogger != null && expandNodes) {
			String name = token == null ? file.getName() : token.getNodeNameInParent();
			String edgeInParent = token == null ? null : token.getEdgeLengthInParent();
			String mappingEdge = fragment == null ? null : fragment.getOverrideEdgeLength();
			ctx.fileTreeLogger.indentKeyValue(ctx.depth, name, edgeInParent + " "
					+ StringUtils.defaultIfEmpty(mappingEdge, "0"));
		}

		if (!file.exists()) {
			_LOG.warn("Subtree file " + file + " does not exist");
			return false;
		}

		String tree = GeneralUtils.trimTree(GeneralUtils.readTreeFile(file), true);
		// fail before any of this file reaches the output
		NewickScanner.validate(tree + ";");

		int index = 0;
		// only OneZoom fragments can hold further tokens
		if (expandNodes) {
			List<InclusionToken> children;
			try {
				children = ctx.decoder.findTokens(tree);
			} catch (TokenNotFoundException tnfx) {
				tnfx.setSourceFile(file.getPath());
				throw tnfx;
			}
			for (InclusionToken child : children) {
				ctx.out.append(tree, index, child.getStart());

				File subFile = child.resolveFile(ctx.fragmentsFolder, ctx.referencePartsFolder);
				ctx.depth++;
				if (this.processNewick(ctx, subFile, child)) {
					index = child.getEnd();
				} else {
					// the token is written as is
					index = child.getStart();
				}
				ctx.depth--;
			}
		}

		// the rest of the tree, except the last name:edge_length which needs special handling
		String lastChunk = tree.substring(index);
		int lastClosedBracket = lastChunk.lastIndexOf(')');
		ctx.out.append(lastChunk, 0, lastClosedBracket + 1);

		String lastToken = lastChunk.substring(lastClosedBracket + 1);
		String[] lastTokenSegments = lastToken.split(":", -1);
		String lastTokenName = lastTokenSegments[0];
		String lastTokenEdgeLength = lastTokenSegments.length > 1 ? lastTokenSegments[1] : null;

		// the mapping length wins over the file's own; the length in the parent is never used
		String edgeLength = fragment == null ? null : fragment.getOverrideEdgeLength();
		edgeLength = StringUtils.defaultIfEmpty(edgeLength, lastTokenEdgeLength);

		String parentName = token == null ? null : token.getNodeNameInParent();
		String nodeName;
		if (fragment != null) {
			// mapping, then last token, then parent
			nodeName = StringUtils.firstNonEmpty(fragment.getOverrideTaxon(), lastTokenName, parentName);
		} else {
			// parent first for Open Tree parts: the reverse of the order used for fragments
			nodeName = StringUtils.firstNonEmpty(parentName, lastTokenName);
		}

		// a file that is a single token has an empty trailer, so this name follows the included one
		ctx.out.append(StringUtils.defaultString(nodeName));
		if (StringUtils.isNotEmpty(edgeLength)) {
			ctx.out.append(':').append(edgeLength);
		}
		return true;
	}
}
