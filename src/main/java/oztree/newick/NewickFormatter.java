package oztree.newick;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import oztree.GeneralUtils;
import oztree.exceptions.NewickSyntaxException;

/**
 * Writes a Newick tree with one node per line, indented by depth, to make it human readable:
 * <pre>
 * (Tupaia_tana:8.5,(Tupaia_montana:7.0,Tupaia_splendidula:7.0):1.0):4.5;
 * </pre>
 * becomes
 * <pre>
 * (
 *   Tupaia_tana:8.5,
 *   (
 *     Tupaia_montana:7.0,
 *     Tupaia_splendidula:7.0
 *   ):1.0
 * ):4.5;
 * </pre>
 */
public class NewickFormatter {

	// token may be quoted or not
	private static final Pattern WHOLE_TOKEN = Pattern.compile("('[^']*'|[^(),;\\[]+)(:[0-9.]+)?");

	private final String indentString;

	public NewickFormatter(int indentSpaces) {
		this.indentString = StringUtils.repeat(' ', indentSpaces);
	}

	public NewickFormatter() {
		this(2);
	}

	public String format(String newickTree) {
		StringBuilder sb = new StringBuilder();
		try {
			this.format(newickTree, sb);
		} catch (IOException e) {
			// StringBuilder does not throw
			throw new IllegalStateException(e);
		}
		return sb.toString();
	}

	public void format(String newickTree, Appendable out) throws IOException {
		String tree = GeneralUtils.trimTree(newickTree, false);
		Matcher m = WHOLE_TOKEN.matcher(tree);

		int index = 0;
		int depth = 0;
		while (index < tree.length()) {
			int loopStart = index;

			// a new branch: write the opening brace and go one level deeper
			if (tree.charAt(index) == '(') {
				index++;
				this.indent(out, depth);
				out.append("(\n");
				depth++;
				continue;
			}

			boolean closedBrace = tree.charAt(index) == ')';
			if (closedBrace) {
				index++;
				depth--;
				out.append('\n');
				this.indent(out, depth);
				out.append(')');
			}

			m.region(index, tree.length());
			if (index < tree.length() && m.lookingAt()) {
				index = m.end();
				if (!closedBrace) {
					this.indent(out, depth);
				}
				out.append(m.group());

				// only comments directly after a token are supported
				if (index < tree.length() && tree.charAt(index) == '[') {
					int endComment = tree.indexOf(']', index);
					if (endComment < 0) {
						throw new NewickSyntaxException("unterminated comment", tree, index);
					}
					out.append(tree, index, endComment + 1);
					index = endComment + 1;
				}
			}

			if (index < tree.length() && tree.charAt(index) == ',') {
				out.append(",\n");
				index++;
			}

			if (index < tree.length() && tree.charAt(index) == ';') {
				out.append(";\n");
				break;
			}

			if (index == loopStart) {
				throw new NewickSyntaxException("unexpected character '" + tree.charAt(index) + "'", tree, index);
			}
		}
	}

	private void indent(Appendable out, int depth) throws IOException {
		for (int i = 0; i < depth; i++) {
			out.append(this.indentString);
		}
	}
}
