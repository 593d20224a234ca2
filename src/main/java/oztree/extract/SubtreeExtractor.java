package oztree.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import oztree.exceptions.TreeAssemblyException;
import oztree.newick.NewickScanner;
import oztree.newick.NodeRecord;

/**
 * Extracts one or more subtrees from a Newick tree, leaving out the subtrees of excluded taxa.
 *
 * Everything happens in a single pass of the NewickScanner: since nodes come in post-order, the
 *	exclusions inside a target are always known by the time the target itself is reached. Each
 *	target can also be wrapped in a number of its ancestors, to give some context around it.
 *
 * Taxa are matched on either their name or their ott id.
 */
public class SubtreeExtractor {
	static Logger _LOG = Logger.getLogger(SubtreeExtractor.class);

	private static class Subtree {
		String name;
		String ott;
		StringBuilder treeString = new StringBuilder();
		int start;
		int ancestorsNeeded;

		String getKey() {
			return StringUtils.isEmpty(this.ott) ? this.name : this.ott;
		}
	}

	public static Map<String, String> extract(CharSequence tree, Set<String> targetTaxa) {
		return extract(tree, targetTaxa, Collections.<String>emptySet(), 0);
	}

	public static Map<String, String> extract(CharSequence tree, Set<String> targetTaxa, Set<String> excludedTaxa) {
		return extract(tree, targetTaxa, excludedTaxa, 0);
	}

	/**
	 * @param tree the full Newick tree, with its terminating semicolon
	 * @param targetTaxa names or ott ids of the subtrees to extract
	 * @param excludedTaxa names or ott ids of subtrees to leave out
	 * @param includedAncestorCount how many ancestors to wrap around each subtree found
	 * @return subtree text (no semicolon) keyed by ott id, or by name for nodes without one. Taxa
	 *	that are not found are logged and left out.
	 */
	public static Map<String, String> extract(CharSequence tree, Set<String> targetTaxa, Set<String> excludedTaxa,
			int includedAncestorCount) {
		if (excludedTaxa == null) {
			excludedTaxa = Collections.emptySet();
		}
		// clone the taxa set so we don't modify the original
		Set<String> remaining = new HashSet<String>(targetTaxa);
		List<Subtree> subtrees = new ArrayList<Subtree>();
		ExclusionRanges excludedRanges = new ExclusionRanges();

		// how many ancestors are still needed over all subtrees, so we can stop once everything is found
		int overallAncestorsNeeded = 0;

		for (NodeRecord node : new NewickScanner(tree)) {
			int nodeStart = node.getStart();
			int nodeEnd = node.getEnd();

			if (overallAncestorsNeeded > 0) {
				for (Subtree st : subtrees) {
					// a node seen after the subtree that starts before it must enclose it
					if (st.ancestorsNeeded > 0 && nodeStart < st.start) {
						st.treeString.insert(0, '(').append(')').append(StringUtils.defaultString(node.getTaxon()));
						st.ancestorsNeeded--;
						overallAncestorsNeeded--;
					}
				}
			}

			if (node.matches(remaining)) {
				String taxon = node.getTaxon();
				remaining.remove(taxon != null && remaining.contains(taxon) ? taxon : node.getOtt());

				Subtree st = new Subtree();
				st.name = taxon;
				st.ott = node.getOtt();
				st.start = nodeStart;
				st.ancestorsNeeded = includedAncestorCount;
				excludedRanges.appendWithout(tree, nodeStart, nodeEnd, st.treeString);
				subtrees.add(st);
				overallAncestorsNeeded += includedAncestorCount;
				_LOG.debug("Found " + st.getKey() + " at " + nodeStart);
			}

			// registered after the target check, so a node that is both included and excluded
			// still keeps its own exclusions
			if (node.matches(excludedTaxa)) {
				if (nodeStart > 0 && tree.charAt(nodeStart - 1) == ',') {
					// (A,B,REMOVE_ME) --> (A,B)
					excludedRanges.add(nodeStart - 1, nodeEnd);
				} else if (nodeEnd < tree.length() && tree.charAt(nodeEnd) == ',') {
					// (REMOVE_ME,B,C) --> (B,C)
					excludedRanges.add(nodeStart, nodeEnd + 1);
				} else {
					// (REMOVE_ME) --> (), harmless enough
					excludedRanges.add(nodeStart, nodeEnd);
				}
			}

			if (remaining.isEmpty() && overallAncestorsNeeded == 0) {
				break;
			}
		}

		if (!remaining.isEmpty()) {
			_LOG.warn("Could not find the following taxa: " + StringUtils.join(remaining, ", "));
		}

		Map<String, String> result = new LinkedHashMap<String, String>();
		for (Subtree st : subtrees) {
			result.put(st.getKey(), st.treeString.toString());
		}
		return result;
	}

	/**
	 * Extracts a single subtree, given a taxon name or ott id.
	 *
	 * @return the subtree, terminated with a semicolon
	 */
	public static String getTaxonSubtree(CharSequence tree, String taxon) throws TreeAssemblyException {
		Set<String> target = new HashSet<String>();
		target.add(taxon);
		Map<String, String> subtrees = extract(tree, target);
		if (subtrees.isEmpty()) {
			throw new TreeAssemblyException("No subtree found for taxon " + taxon);
		}
		return subtrees.values().iterator().next() + ";";
	}
}
