package oztree.tree;

public class TreeUtils {

	/**
	 * Rewrites every branch length as parent date minus child date. Only nodes where both dates are
	 *	known are changed.
	 *
	 * @return the smallest branch length that was written, or +infinity if none was
	 */
	public static double setBranchLengthsFromDates(Tree tree) {
		double min = Double.POSITIVE_INFINITY;
		for (TreeNode n : tree.getNodes(TreeNode.NodeOrder.PREORDER)) {
			if (n.isTheRoot() || n.getDate() == null || n.getParent().getDate() == null) {
				continue;
			}
			double bl = n.getParent().getDate() - n.getDate();
			n.setBL(bl);
			min = Math.min(min, bl);
		}
		return min;
	}
}
