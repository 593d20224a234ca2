package oztree.dating;

import org.apache.log4j.Logger;
import oztree.GeneralUtils;
import oztree.constants.GeneralConstants;
import oztree.exceptions.UltrametricToleranceException;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Makes a nearly ultrametric tree exactly ultrametric, by stretching or shrinking each leaf's own
 *	edge so the leaf ends up at the expected distance from the root. Only small adjustments are
 *	allowed: anything larger means the tree is really not ultrametric.
 */
public class UltrametricityFixer {
	static Logger _LOG = Logger.getLogger(UltrametricityFixer.class);

	private final double expectedAge;
	private final double maxAdjustment;

	public UltrametricityFixer(double expectedAge) {
		this(expectedAge, GeneralConstants.DEFAULT_MAX_ULTRAMETRIC_ADJUSTMENT.doubleValue());
	}

	public UltrametricityFixer(double expectedAge, double maxAdjustment) {
		this.expectedAge = expectedAge;
		this.maxAdjustment = maxAdjustment;
	}

	/**
	 * Rounds every edge length to 6 decimals and adjusts the leaf edges. The tree is modified in place.
	 *
	 * @throws UltrametricToleranceException on the first leaf that is too far off
	 */
	public void fix(Tree tree) throws UltrametricToleranceException {
		this.processNode(tree.getRoot(), 0.0);
	}

	private void processNode(TreeNode node, double ageSoFar) throws UltrametricToleranceException {
		String name = UltrametricityChecker.getTaxonName(node);
		if (name.endsWith("@")) {
			return;
		}

		int decimals = GeneralConstants.FIXED_EDGE_DECIMALS.intValue();
		if (node.isExternal()) {
			if (ageSoFar != this.expectedAge) {
				if (Math.abs(ageSoFar - this.expectedAge) > this.maxAdjustment) {
					throw new UltrametricToleranceException(name, ageSoFar, this.expectedAge, this.maxAdjustment);
				}
				_LOG.debug("Adjusting " + name + " by " + (this.expectedAge - ageSoFar));
				node.setBL(GeneralUtils.round(node.getBL() + this.expectedAge - ageSoFar, decimals));
			}
		} else {
			for (TreeNode child : node.getChildren()) {
				if (child.hasBL()) {
					child.setBL(GeneralUtils.round(child.getBL(), decimals));
				}
				this.processNode(child, ageSoFar + child.getBL());
			}
		}
	}
}
