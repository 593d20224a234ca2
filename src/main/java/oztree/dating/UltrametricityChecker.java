package oztree.dating;

import gnu.trove.list.array.TDoubleArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.log4j.Logger;
import oztree.GeneralUtils;
import oztree.MessageLogger;
import oztree.constants.GeneralConstants;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Checks whether every leaf of a tree is the same distance from the root. The age of the first leaf
 *	found is the reference; the first leaf that disagrees with it is reported.
 *
 * Nodes whose name ends in '@' are unexpanded inclusions and are skipped along with everything under
 *	them, since they can never look ultrametric within their own file.
 */
public class UltrametricityChecker {
	static Logger _LOG = Logger.getLogger(UltrametricityChecker.class);

	private boolean strictEdgeLengths = false;
	private MessageLogger detailsLogger = null;

	/**
	 * By default a missing edge length counts as zero. In strict mode it makes the tree fail the check.
	 */
	public void setStrictEdgeLengths(boolean strict) {
		this.strictEdgeLengths = strict;
	}

	/**
	 * Report every leaf age (and the age histogram) to this logger. Null turns details off.
	 */
	public void setDetailsLogger(MessageLogger detailsLogger) {
		this.detailsLogger = detailsLogger;
	}

	public static class Result {
		private final String nonUltrametricMessage;
		private final Map<Double, Integer> ageCounts;

		Result(String nonUltrametricMessage, Map<Double, Integer> ageCounts) {
			this.nonUltrametricMessage = nonUltrametricMessage;
			this.ageCounts = Collections.unmodifiableMap(ageCounts);
		}

		public boolean isUltrametric() {
			return this.nonUltrametricMessage == null;
		}

		/** @return why the tree is not ultrametric, or null */
		public String getMessage() {
			return this.nonUltrametricMessage;
		}

		/** @return how many leaves have each age, in the order the ages were first seen */
		public Map<Double, Integer> getAgeCounts() {
			return this.ageCounts;
		}
	}

	// state of one check
	private class Walk {
		Double knownAge = null;
		String initialName = null;
		String nonUltrametricMessage = null;
		TDoubleArrayList edgeLengths = new TDoubleArrayList();
		Map<Double, Integer> ageCounts = new LinkedHashMap<Double, Integer>();

		void fail(String msg) {
			if (this.nonUltrametricMessage == null) {
				this.nonUltrametricMessage = msg;
			}
		}
	}

	public Result check(Tree tree) {
		Walk w = new Walk();
		this.processNode(tree.getRoot(), w);

		if (this.detailsLogger != null) {
			StringBuilder sb = new StringBuilder("{");
			for (Map.Entry<Double, Integer> e : w.ageCounts.entrySet()) {
				if (sb.length() > 1) {
					sb.append(", ");
				}
				sb.append(GeneralUtils.formatNumber(e.getKey())).append(": ").append(e.getValue());
			}
			sb.append('}');
			this.detailsLogger.message("Age counts instances (" + w.ageCounts.size() + " variants): " + sb);
		}
		if (w.nonUltrametricMessage != null) {
			_LOG.debug(w.nonUltrametricMessage);
		}
		return new Result(w.nonUltrametricMessage, w.ageCounts);
	}

	private void processNode(TreeNode node, Walk w) {
		String name = getTaxonName(node);
		if (name.endsWith("@")) {
			return;
		}

		if (node.isExternal()) {
			double sum = 0.0;
			for (int i = 0; i < w.edgeLengths.size(); i++) {
				sum += w.edgeLengths.get(i);
			}
			double age = GeneralUtils.round(sum, GeneralConstants.LEAF_AGE_DECIMALS.intValue());

			// an age of zero is not a usable reference, so the next leaf takes over
			if (w.knownAge == null || w.knownAge == 0.0) {
				w.knownAge = age;
				w.initialName = name;
			} else if (w.knownAge != age) {
				w.fail("Not ultrametric! " + name + " has age " + GeneralUtils.formatNumber(age) + ", but "
						+ w.initialName + " has age " + GeneralUtils.formatNumber(w.knownAge));
			}

			if (this.detailsLogger != null) {
				StringBuilder sb = new StringBuilder();
				for (int i = 0; i < w.edgeLengths.size(); i++) {
					if (i > 0) {
						sb.append('+');
					}
					sb.append(GeneralUtils.formatNumber(w.edgeLengths.get(i)));
				}
				this.detailsLogger.indentKeyValue(1, name, GeneralUtils.formatNumber(age) + "=" + sb);
			}

			Integer count = w.ageCounts.get(age);
			w.ageCounts.put(age, count == null ? 1 : count + 1);
		} else {
			for (TreeNode child : node.getChildren()) {
				if (!child.hasBL() && this.strictEdgeLengths) {
					w.fail("Not ultrametric! " + getTaxonName(child) + " has no edge length");
				}
				w.edgeLengths.add(child.hasBL() ? child.getBL() : 0.0);
				this.processNode(child, w);
				w.edgeLengths.removeAt(w.edgeLengths.size() - 1);
			}
		}
	}

	/**
	 * @return the name used to report a node: its own name, "Root", "(Unnamed node)" for other
	 *	interior nodes, or "<parent> (Extinct)" for a leaf without a name (usually an extinct
	 *	prop-up node)
	 */
	public static String getTaxonName(TreeNode node) {
		if (node.hasName()) {
			return node.getName();
		}
		if (node.isTheRoot()) {
			return "Root";
		}
		if (node.isInternal()) {
			return "(Unnamed node)";
		}
		return node.getParent().getName() + " (Extinct)";
	}
}
