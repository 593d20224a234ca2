package oztree.newick;

import gnu.trove.list.array.TIntArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import oztree.exceptions.NewickSyntaxException;

/**
 * Lightweight one-pass Newick scanner. It does not build a tree: each call to iterator() walks the
 *	text from the start and hands back NodeRecords in post-order (children before the parent
 *	that follows them, which is the order nodes are written in Newick).
 *
 * Only the open-parenthesis offsets are kept on a stack, so a scan is O(n) time and O(depth) space,
 *	which is what makes it usable on the full Open Tree with its millions of tips.
 *
 * The text is assumed to hold no whitespace or comments. For example
 *	"(A_ott123,B:1.2)C_ott789:5.5;" yields A (ott 123, edge 0.0), B (edge 1.2), C (ott 789, edge 5.5).
 */
public class NewickScanner implements Iterable<NodeRecord> {

	// plain decimal or scientific notation; Java-only forms such as 1f, 1d or 0x1p3 are rejected
	private static final Pattern EDGE_LENGTH = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

	private final CharSequence tree;

	public NewickScanner(CharSequence tree) {
		this.tree = tree;
	}

	@Override
	public Iterator<NodeRecord> iterator() {
		return new NodeIterator();
	}

	/**
	 * Scans the whole tree, throwing NewickSyntaxException if it is malformed.
	 * @return the number of nodes in the tree
	 */
	public static int validate(CharSequence tree) {
		int count = 0;
		for (Iterator<NodeRecord> it = new NewickScanner(tree).iterator(); it.hasNext(); it.next()) {
			count++;
		}
		return count;
	}

	static boolean isNameTerminator(char c) {
		return c == ',' || c == ';' || c == ':' || c == '(' || c == ')';
	}

	private class NodeIterator implements Iterator<NodeRecord> {

		private int index = 0;
		private final TIntArrayList openStack = new TIntArrayList();
		private boolean closedBrace = false;
		private boolean started = false;
		private boolean finished = false;
		private NodeRecord nextRecord = null;

		@Override
		public boolean hasNext() {
			if (this.nextRecord == null && !this.finished) {
				this.nextRecord = this.scanNext();
			}
			return this.nextRecord != null;
		}

		@Override
		public NodeRecord next() {
			if (!this.hasNext()) {
				throw new NoSuchElementException();
			}
			NodeRecord r = this.nextRecord;
			this.nextRecord = null;
			return r;
		}

		private char at(int i) {
			if (i >= tree.length()) {
				throw new NewickSyntaxException("unexpected end of tree", tree, i);
			}
			return tree.charAt(i);
		}

		private int nextTerminator(int from) {
			for (int i = from; i < tree.length(); i++) {
				if (isNameTerminator(tree.charAt(i))) {
					return i;
				}
			}
			return -1;
		}

		private NodeRecord scanNext() {
			if (this.started) {
				// the previous node was the root once every parenthesis is balanced
				if (this.openStack.isEmpty()) {
					this.finished = true;
					if (this.index >= tree.length() || tree.charAt(this.index) != ';') {
						throw new NewickSyntaxException("expected a semicolon at the end of the tree", tree, this.index);
					}
					return null;
				}
				// after a node we expect a comma or a closed brace
				char c = this.at(this.index);
				this.closedBrace = (c == ')');
				if (c == ',') {
					this.index++;
				} else if (!this.closedBrace) {
					throw new NewickSyntaxException("expected ',' or ')'", tree, this.index);
				}
			}
			this.started = true;

			while (this.at(this.index) == '(') {
				this.openStack.add(this.index);
				this.index++;
			}

			int nodeStart;
			if (this.closedBrace) {
				if (this.openStack.isEmpty()) {
					throw new NewickSyntaxException("unbalanced ')'", tree, this.index);
				}
				this.index++;
				nodeStart = this.openStack.removeAt(this.openStack.size() - 1);
			} else {
				nodeStart = this.index;
			}

			String taxon = null;
			String ott = null;
			String label = null;
			int labelStart = this.index;
			if (this.at(this.index) == '\'') {
				int endQuote = -1;
				for (int i = this.index + 1; i < tree.length(); i++) {
					if (tree.charAt(i) == '\'') {
						endQuote = i;
						break;
					}
				}
				if (endQuote < 0) {
					throw new NewickSyntaxException("unterminated quoted name", tree, this.index);
				}
				taxon = tree.subSequence(this.index + 1, endQuote).toString();
				this.index = endQuote + 1;
				label = tree.subSequence(labelStart, this.index).toString();
			} else {
				int stop = this.nextTerminator(this.index);
				if (stop < 0) {
					throw new NewickSyntaxException("expected a semicolon at the end of the tree", tree, tree.length());
				}
				this.index = stop;
				if (stop > labelStart) {
					taxon = tree.subSequence(labelStart, stop).toString();
					label = taxon;
				}
			}

			double edgeLength = 0.0;
			boolean hasEdgeLength = false;
			if (this.at(this.index) == ':') {
				this.index++;
				int stop = this.nextTerminator(this.index);
				if (stop < 0) {
					throw new NewickSyntaxException("expected a semicolon at the end of the tree", tree, tree.length());
				}
				String edgeLengthStr = tree.subSequence(this.index, stop).toString();
				if (!EDGE_LENGTH.matcher(edgeLengthStr).matches()) {
					throw new NewickSyntaxException("'" + edgeLengthStr + "' is not a valid edge length", tree, this.index);
				}
				edgeLength = Double.parseDouble(edgeLengthStr);
				hasEdgeLength = true;
				this.index = stop;
			}

			if (taxon != null) {
				int ottIndex = taxon.indexOf("_ott");
				if (ottIndex >= 0) {
					ott = taxon.substring(ottIndex + 4);
					taxon = taxon.substring(0, ottIndex);
				}
			}

			return new NodeRecord(taxon, ott, label, edgeLength, hasEdgeLength, nodeStart, this.index, labelStart,
					this.openStack.size(), !this.closedBrace);
		}

		@Override
		public void remove() {
			throw new UnsupportedOperationException();
		}
	}
}
