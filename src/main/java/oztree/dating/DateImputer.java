package oztree.dating;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;
import oztree.constants.GeneralConstants;
import oztree.exceptions.TreeDatingException;
import oztree.tokens.TokenDecoder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;
import oztree.tree.TreeUtils;

/**
 * Fills in the dates of undated interior nodes, given a dated root.
 *
 * A postorder pass labels every node with the oldest date found below it and the number of steps
 *	down to that date. When several paths lead to the same oldest date (usually 0, at the tips) there
 *	are two ways to choose: the longest path and the shortest path. Both are kept.
 *
 * A preorder pass then places each undated node on the path between its (already dated) parent and
 *	that oldest date. The longest-path and shortest-path solutions are blended:
 * <pre>
 *	date = l * date_from_longest_path + (1 - l) * date_from_shortest_path
 * </pre>
 * Along a path the dates are spaced equally (m = 0), or along exp(m * x), which biases them older
 *	(m > 0) or younger (m < 0). Values of m between -2 and 2 are sensible.
 */
public class DateImputer {
	static Logger _LOG = Logger.getLogger(DateImputer.class);

	private final double longestPathWeight;
	private final double spacingExponent;

	public DateImputer() {
		this(GeneralConstants.DATE_LONGEST_PATH_WEIGHT.doubleValue(), GeneralConstants.DATE_SPACING_EXPONENT.doubleValue());
	}

	/**
	 * @param longestPathWeight l, the share of the longest-path solution
	 * @param spacingExponent m, the exponential spacing along a path
	 */
	public DateImputer(double longestPathWeight, double spacingExponent) {
		this.longestPathWeight = longestPathWeight;
		this.spacingExponent = spacingExponent;
	}

	/**
	 * Oldest date below a node, and how many steps down it is.
	 */
	static class OldestPath {
		final double age;
		final int length;

		OldestPath(double age, int length) {
			this.age = age;
			this.length = length;
		}

		OldestPath step() {
			return new OldestPath(this.age, this.length + 1);
		}

		// older wins, then the longer path
		static OldestPath longest(OldestPath a, OldestPath b) {
			if (a == null) {
				return b;
			}
			if (a.age != b.age) {
				return a.age > b.age ? a : b;
			}
			return b.length > a.length ? b : a;
		}

		// older wins, then the shorter path
		static OldestPath shortest(OldestPath a, OldestPath b) {
			if (a == null) {
				return b;
			}
			if (a.age != b.age) {
				return a.age > b.age ? a : b;
			}
			return b.length < a.length ? b : a;
		}

		@Override
		public String toString() {
			return "[" + this.age + ", " + this.length + "]";
		}
	}

	/**
	 * Dates every undated node of the tree in place.
	 *
	 * @throws TreeDatingException if the root has no date
	 */
	public void dateTree(Tree tree) throws TreeDatingException {
		if (!tree.getRoot().isDated()) {
			throw new TreeDatingException("the root node must be dated before imputing missing dates");
		}
		Map<TreeNode, OldestPath[]> labels = this.labelDates(tree);
		this.imputeMissingDates(tree, labels);
	}

	/**
	 * Postorder pass: for each node, the oldest path below it as {longest, shortest}. A dated node
	 *	is its own oldest path, of length 0.
	 *
	 * Undated leaves are taken to be 0, except unexpanded inclusions, which stay undated and are
	 *	ignored by their parent.
	 */
	Map<TreeNode, OldestPath[]> labelDates(Tree tree) {
		Map<TreeNode, OldestPath[]> labels = new IdentityHashMap<TreeNode, OldestPath[]>();
		// what each node hands up to its parent, one step longer than its own label
		Map<TreeNode, OldestPath[]> returned = new IdentityHashMap<TreeNode, OldestPath[]>();

		for (TreeNode node : tree.getNodes(TreeNode.NodeOrder.POSTORDER)) {
			if (node.isExternal() && !node.isDated()) {
				if (TokenDecoder.isInclusionLabel(node.getName())) {
					continue;
				}
				node.setDate(0.0);
			}

			OldestPath[] label;
			if (node.isDated()) {
				OldestPath own = new OldestPath(node.getDate(), 0);
				label = new OldestPath[] {own, own};
			} else {
				OldestPath longest = null;
				OldestPath shortest = null;
				for (TreeNode child : node.getChildren()) {
					OldestPath[] fromChild = returned.get(child);
					if (fromChild != null) {
						longest = OldestPath.longest(longest, fromChild[0]);
						shortest = OldestPath.shortest(shortest, fromChild[1]);
					}
				}
				if (longest == null) {
					// nothing dated below
					longest = new OldestPath(0.0, 0);
					shortest = longest;
				}
				label = new OldestPath[] {longest, shortest};
			}
			labels.put(node, label);
			returned.put(node, new OldestPath[] {label[0].step(), label[1].step()});
		}
		return labels;
	}

	/**
	 * Preorder pass giving each undated node a date between its parent's date and the oldest date
	 *	below it.
	 */
	void imputeMissingDates(Tree tree, Map<TreeNode, OldestPath[]> labels) {
		for (TreeNode node : tree.getNodes(TreeNode.NodeOrder.PREORDER)) {
			OldestPath[] label = labels.get(node);
			if (node.isDated() || label == null || node.isTheRoot()) {
				continue;
			}
			double dateAbove = node.getParent().getDate();
			double dateLong = interpolate(dateAbove, label[0], this.spacingExponent);
			double dateShort = interpolate(dateAbove, label[1], this.spacingExponent);
			node.setDate(this.longestPathWeight * dateLong + (1 - this.longestPathWeight) * dateShort);
			_LOG.debug("Imputed " + node);
		}
	}

	private static double interpolate(double dateAbove, OldestPath path, double m) {
		return dateAbove - (dateAbove - path.age) * spacingFraction(path.length, m);
	}

	/**
	 * @return the share of the remaining time taken by the first of the k + 1 steps down a path of k
	 *	undated nodes: 1 / sum_{i=0..k} exp(m * i / k). Equal spacing (1 / (k + 1)) when m is 0.
	 */
	static double spacingFraction(int k, double m) {
		if (k <= 0) {
			return 1.0;
		}
		double sum = 0.0;
		for (int i = 0; i <= k; i++) {
			sum += Math.exp(m * i / k);
		}
		return 1.0 / sum;
	}

	/**
	 * Sets every branch length to the parent's date minus the node's date. Nodes that are still
	 *	undated keep their branch length.
	 *
	 * @throws TreeDatingException if a node would get a negative branch length, i.e. it is older
	 *	than its parent. The tree is left unchanged in that case.
	 */
	public static void computeBranchLengths(Tree tree) throws TreeDatingException {
		List<TreeNode> nodes = tree.getNodes(TreeNode.NodeOrder.PREORDER);
		for (TreeNode n : nodes) {
			if (n.isTheRoot() || n.getDate() == null || n.getParent().getDate() == null) {
				continue;
			}
			if (n.getParent().getDate() - n.getDate() < 0) {
				throw new TreeDatingException("Negative branch length found: " + n.getLabel() + " (" + n.getDate()
						+ ") is older than its parent " + n.getParent().getLabel() + " (" + n.getParent().getDate() + ")");
			}
		}
		TreeUtils.setBranchLengthsFromDates(tree);
	}
}
