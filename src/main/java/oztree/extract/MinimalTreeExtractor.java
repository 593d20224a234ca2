package oztree.extract;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import oztree.newick.NewickScanner;
import oztree.newick.NodeRecord;

/**
 * Extracts the smallest tree connecting a set of taxa: only the target nodes and the interior nodes
 *	where two or more of their lineages meet are kept; every other node is collapsed away.
 *
 * For example, from "(A,(BA,(BBB,BBC)BB)B,C)Root;" the taxa {BA, BBC} give "(BA,BBC)B".
 */
public class MinimalTreeExtractor {
	static Logger _LOG = Logger.getLogger(MinimalTreeExtractor.class);

	private static class PendingNode {
		String treeString;
		int depth;

		PendingNode(String treeString, int depth) {
			this.treeString = treeString;
			this.depth = depth;
		}
	}

	/**
	 * @param tree the full Newick tree, with its terminating semicolon
	 * @param targetTaxa names or ott ids to keep
	 * @return the minimal tree without a semicolon, or null if none of the taxa were found
	 */
	public static String extract(CharSequence tree, Set<String> targetTaxa) {
		List<PendingNode> nodeList = new ArrayList<PendingNode>();
		Set<String> remaining = new HashSet<String>(targetTaxa);

		for (NodeRecord node : new NewickScanner(tree)) {
			boolean foundTarget = false;
			if (node.matches(remaining)) {
				String taxon = node.getTaxon();
				remaining.remove(taxon != null && remaining.contains(taxon) ? taxon : node.getOtt());
				foundTarget = true;
			}

			if (foundTarget || !node.isLeaf()) {
				// anything deeper than this node is one of its descendants; pending nodes are
				// always bubbled up to depth + 1 before the parent shows up
				List<PendingNode> children = new ArrayList<PendingNode>();
				for (PendingNode pending : nodeList) {
					if (pending.depth > node.getDepth()) {
						assert pending.depth == node.getDepth() + 1;
						pending.depth--;
						children.add(pending);
					}
				}

				if (foundTarget || children.size() > 1) {
					for (Iterator<PendingNode> it = nodeList.iterator(); it.hasNext();) {
						if (children.contains(it.next())) {
							it.remove();
						}
					}
					// name and edge length as written
					String treeString = tree.subSequence(node.getLabelStart(), node.getEnd()).toString();
					if (!children.isEmpty()) {
						List<String> childStrings = new ArrayList<String>();
						for (PendingNode child : children) {
							childStrings.add(child.treeString);
						}
						treeString = "(" + StringUtils.join(childStrings, ",") + ")" + treeString;
					}
					nodeList.add(new PendingNode(treeString, node.getDepth()));
				}
			}

			if (remaining.isEmpty() && nodeList.size() <= 1) {
				break;
			}
		}

		if (!remaining.isEmpty()) {
			_LOG.warn("Could not find the following taxa: " + StringUtils.join(remaining, ", "));
		}

		if (nodeList.isEmpty()) {
			return null;
		}
		return nodeList.get(0).treeString;
	}
}
