package oztree.tree;

import java.util.List;

public class Tree {

	private TreeNode root;

	public Tree(TreeNode root) {
		this.root = root;
	}

	public TreeNode getRoot() {
		return this.root;
	}

	public List<TreeNode> getNodes(TreeNode.NodeOrder order) {
		return this.root.getDescendants(order);
	}

	/**
	 * @return the tree in Newick form, terminated with a semicolon
	 */
	public String getNewick(boolean bl, boolean dates) {
		return this.root.getNewick(bl, dates) + ";";
	}
}
