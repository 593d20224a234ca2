package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when tree text is not well formed Newick: unbalanced parentheses, a bad edge length
 *	literal or a missing terminating semicolon. Unchecked, since it is raised from inside a
 *	node iterator.
 *
 * The context is the text within 20 characters either side of the failing offset.
 */
public class NewickSyntaxException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	public static final int CONTEXT_WIDTH = 20;

	private String msg;
	private int offset;
	private String context;

	public NewickSyntaxException(String msg, CharSequence tree, int offset) {
		super(msg);
		this.msg = msg;
		this.offset = offset;
		int from = Math.max(offset - CONTEXT_WIDTH, 0);
		int to = Math.min(offset + CONTEXT_WIDTH, tree.length());
		this.context = from < to ? tree.subSequence(from, to).toString() : "";
	}

	public int getOffset() {
		return this.offset;
	}

	public String getContext() {
		return this.context;
	}

	@Override
	public String toString() {
		return "Newick syntax error at offset " + this.offset + ": " + this.msg + " (near \"" + this.context + "\")";
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String m = failedAction + " failed due to " + this.toString();
		out.println(m);
	}
}
