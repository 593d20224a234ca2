package oztree.tree;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import oztree.GeneralUtils;
import oztree.newick.NewickScanner;
import oztree.newick.NodeRecord;

/**
 * Builds a Tree from Newick text, on top of the NewickScanner. Since nodes come in post-order, the
 *	nodes waiting for their parent are kept per depth: when an interior node shows up, everything
 *	waiting one level deeper is its children.
 */
public class TreeReader {

	public TreeReader() {
	}

	/**
	 * @param treeString a Newick tree, terminated with a semicolon
	 */
	public Tree readTree(String treeString) {
		List<List<TreeNode>> pending = new ArrayList<List<TreeNode>>();
		TreeNode root = null;
		for (NodeRecord r : new NewickScanner(treeString)) {
			TreeNode node = new TreeNode(r.getLabel(), r.getEdgeLength(), r.hasEdgeLength());
			int depth = r.getDepth();
			while (pending.size() <= depth + 1) {
				pending.add(new ArrayList<TreeNode>());
			}
			if (!r.isLeaf()) {
				List<TreeNode> children = pending.get(depth + 1);
				for (TreeNode c : children) {
					node.addChild(c);
				}
				children.clear();
			}
			pending.get(depth).add(node);
			root = node;
		}
		return new Tree(root);
	}

	/**
	 * Reads a tree file, ignoring a leading [...] comment block and surrounding whitespace.
	 */
	public Tree readTree(File file) throws IOException {
		return this.readTree(GeneralUtils.readTrimmedTree(file));
	}
}
