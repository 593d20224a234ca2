package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when node ages are inconsistent: an undated root, or a child older than its parent.
 */
public class TreeDatingException extends Exception {

	private static final long serialVersionUID = 1L;
	private String msg;

	public TreeDatingException(String msg) {
		super(msg);
		this.msg = msg;
	}

	@Override
	public String toString() {
		return "TreeDatingException: " + this.msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed due to " + this.toString());
	}
}
