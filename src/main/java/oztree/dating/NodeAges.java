package oztree.dating;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;
import oztree.tokens.TokenDecoder;
import oztree.tree.Tree;
import oztree.tree.TreeNode;

/**
 * Sets node dates, either from a node_ages.json file or from the branch lengths of the tree.
 *
 * node_ages.json looks like
 * <pre>
 *	{"node_ages": {"ott93302": [{"age": 330.3}, {"age": "312"}], "Tetrapoda": [{"age": 350}]}}
 * </pre>
 * Nodes are looked up by "ott<id>" when their name ends in _ott<id> (or " ott<id>"), otherwise by
 *	their whole name.
 */
public class NodeAges {
	static Logger _LOG = Logger.getLogger(NodeAges.class);

	private static final Pattern EXTRACT_OTT = Pattern.compile("[_ ](ott\\d+)$");

	public static Map<String, List<Double>> load(File file) throws IOException, DataFormatException {
		_LOG.debug("Loading node ages from " + file);
		try {
			return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
		} catch (DataFormatException dfx) {
			dfx.setFilePath(file.getPath());
			throw dfx;
		}
	}

	public static Map<String, List<Double>> parse(String json) throws DataFormatException {
		Object parsed;
		try {
			parsed = new JSONParser().parse(json);
		} catch (ParseException pe) {
			throw new DataFormatException("node ages are not valid JSON: " + pe);
		}
		if (!(parsed instanceof JSONObject) || !(((JSONObject) parsed).get("node_ages") instanceof JSONObject)) {
			throw new DataFormatException("node ages must be a JSON object with a \"node_ages\" object");
		}
		JSONObject nodeAges = (JSONObject) ((JSONObject) parsed).get("node_ages");
		Map<String, List<Double>> ages = new HashMap<String, List<Double>>();
		for (Object key : nodeAges.keySet()) {
			Object value = nodeAges.get(key);
			if (!(value instanceof JSONArray)) {
				throw new DataFormatException("ages for \"" + key + "\" must be a JSON array");
			}
			List<Double> list = new ArrayList<Double>();
			for (Object o : (JSONArray) value) {
				Object age = (o instanceof JSONObject) ? ((JSONObject) o).get("age") : null;
				if (age == null) {
					throw new DataFormatException("ages for \"" + key + "\" must be objects with an \"age\"");
				}
				try {
					list.add(Double.parseDouble(age.toString()));
				} catch (NumberFormatException nfe) {
					throw new DataFormatException("age \"" + age + "\" for \"" + key + "\" is not a number");
				}
			}
			ages.put((String) key, list);
		}
		return ages;
	}

	/**
	 * @return the key a node's ages are listed under, or null for an unnamed node
	 */
	public static String getKey(TreeNode node) {
		String name = node.getName();
		if (name == null) {
			return null;
		}
		Matcher m = EXTRACT_OTT.matcher(name);
		return m.find() ? m.group(1) : name;
	}

	/**
	 * @return the median of the ages, or null for an empty list
	 */
	public static Double median(List<Double> ages) {
		if (ages == null || ages.isEmpty()) {
			return null;
		}
		List<Double> sorted = new ArrayList<Double>(ages);
		Collections.sort(sorted);
		int midpoint = (sorted.size() - 1) / 2;
		if (sorted.size() % 2 == 0) {
			return (sorted.get(midpoint) + sorted.get(midpoint + 1)) / 2;
		}
		return sorted.get(midpoint);
	}

	/**
	 * Dates every node with the median of its listed ages. Without any listed age, leaves get 0
	 *	(unless they are unexpanded inclusions) and interior nodes are left undated. An empty map
	 *	leaves the tree untouched.
	 */
	public static void apply(Tree tree, Map<String, List<Double>> nodeAges) {
		if (nodeAges == null || nodeAges.isEmpty()) {
			return;
		}
		double minInteriorAge = GeneralConstants.MIN_INTERIOR_AGE.doubleValue();
		for (TreeNode n : tree.getNodes(TreeNode.NodeOrder.PREORDER)) {
			String key = getKey(n);
			Double date = key == null ? null : median(nodeAges.get(key));
			if (date == null && n.isExternal() && !TokenDecoder.isInclusionLabel(n.getName())) {
				date = 0.0;
			}
			if (date != null && n.isInternal() && date < minInteriorAge) {
				_LOG.warn("Interior node " + n.getLabel() + " has a median age of 0, leaving it undated");
				date = null;
			}
			n.setDate(date);
		}
	}

	/**
	 * Dates the tree from its branch lengths: leaves are 0, a parent is as old as its oldest child
	 *	plus that child's branch. A node stays undated if any child is undated or has no branch
	 *	length; unexpanded inclusions are undated.
	 */
	public static void fromBranchLengths(Tree tree) {
		for (TreeNode n : tree.getNodes(TreeNode.NodeOrder.POSTORDER)) {
			if (n.isExternal() && TokenDecoder.isInclusionLabel(n.getName())) {
				n.setDate(null);
				continue;
			}
			Double parentDate = 0.0;
			for (TreeNode c : n.getChildren()) {
				if (c.getDate() == null || !c.hasBL()) {
					parentDate = null;
					break;
				}
				parentDate = Math.max(parentDate, c.getDate() + c.getBL());
			}
			n.setDate(parentDate);
		}
	}
}
