package oztree.tree;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import oztree.GeneralUtils;

/**
 * A node of the in-memory tree used by the dating and ultrametricity tools. The label is kept
 *	exactly as written in the Newick text, so a tree can be written back without changing names.
 */
public class TreeNode {

	private String label;
	private double BL; // branch length
	private boolean hasBL;
	private Double date; // age in millions of years, or null if undated
	private TreeNode parent;
	private ArrayList<TreeNode> children;

	public TreeNode() {
		this(null, 0.0, false);
	}

	public TreeNode(String label, double BL, boolean hasBL) {
		this.label = label;
		this.BL = BL;
		this.hasBL = hasBL;
		this.date = null;
		this.parent = null;
		this.children = new ArrayList<TreeNode>();
	}

	/* ---------------------------- begin node iterators --------------------------------*/

	public enum NodeOrder {PREORDER, POSTORDER};

	/**
	 * Iterative, so that very deep trees don't blow the stack.
	 */
	public List<TreeNode> getDescendants(NodeOrder order) {
		LinkedList<TreeNode> nodes = new LinkedList<TreeNode>();
		LinkedList<TreeNode> stack = new LinkedList<TreeNode>();
		stack.push(this);
		while (!stack.isEmpty()) {
			TreeNode n = stack.pop();
			if (order == NodeOrder.PREORDER) {
				nodes.addLast(n);
				for (int i = n.children.size() - 1; i >= 0; i--) {
					stack.push(n.children.get(i));
				}
			} else {
				// reversed preorder with children visited right to left gives postorder
				nodes.addFirst(n);
				for (TreeNode c : n.children) {
					stack.push(c);
				}
			}
		}
		return nodes;
	}

	/* ---------------------------- end node iterators --------------------------------*/

	public ArrayList<TreeNode> getChildren() {return this.children;}

	public int getChildCount() {return this.children.size();}

	public TreeNode getChild(int c) {return this.children.get(c);}

	public boolean isExternal() {return (this.children.size() < 1);}

	public boolean isInternal() {return (this.children.size() > 0);}

	public boolean isTheRoot() {return (this.parent == null);}

	public TreeNode getParent() {return this.parent;}

	public void setParent(TreeNode p) {this.parent = p;}

	public void addChild(TreeNode c) {
		this.children.add(c);
		c.setParent(this);
	}

	/** @return the label as written, quotes included, or null */
	public String getLabel() {return this.label;}

	/** @return the label without surrounding quotes, or null */
	public String getName() {
		if (this.label != null && this.label.length() >= 2 && this.label.startsWith("'") && this.label.endsWith("'")) {
			return this.label.substring(1, this.label.length() - 1);
		}
		return this.label;
	}

	public boolean hasName() {
		return this.label != null && !this.getName().isEmpty();
	}

	public double getBL() {return this.BL;}

	public boolean hasBL() {return this.hasBL;}

	public void setBL(double b) {
		this.BL = b;
		this.hasBL = true;
	}

	public Double getDate() {return this.date;}

	public void setDate(Double date) {this.date = date;}

	public boolean isDated() {return this.date != null;}

	/**
	 * @param bl should be true to include branch lengths
	 * @param dates should be true to add [&&NHX:date=...] annotations to dated nodes
	 * @return string with newick representation of the subtree rooted at this node
	 */
	public String getNewick(boolean bl, boolean dates) {
		StringBuilder ret = new StringBuilder();
		this.appendNewick(ret, bl, dates);
		return ret.toString();
	}

	private void appendNewick(StringBuilder ret, boolean bl, boolean dates) {
		for (int i = 0; i < this.getChildCount(); i++) {
			ret.append(i == 0 ? "(" : ",");
			this.getChild(i).appendNewick(ret, bl, dates);
		}
		if (this.getChildCount() > 0) {
			ret.append(")");
		}
		if (this.label != null) {
			ret.append(this.label);
		}
		if (bl && this.hasBL) {
			ret.append(':').append(GeneralUtils.formatNumber(this.BL));
		}
		if (dates && this.date != null) {
			ret.append("[&&NHX:date=").append(GeneralUtils.formatNumber(this.date)).append(']');
		}
	}

	@Override
	public String toString() {
		return "TreeNode[" + this.label + (this.hasBL ? ":" + this.BL : "") + ", date=" + this.date + "]";
	}
}
