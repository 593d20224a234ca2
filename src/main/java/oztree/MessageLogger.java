package oztree;

import java.io.PrintStream;

/**
 * Emits human-facing reports, one line per message, indented to show hierarchy:
 * <pre>
 *	Base.PHY: null 0
 *	  AMORPHEA: 50 50
 *	    METAZOA: null 150
 * </pre>
 * A non-empty prefix is written in front of every line, followed by the separator.
 *
 * This is not a replacement for log4j: it is only used for output that was explicitly asked for
 *	(the inclusion file tree of a build, the leaf age details of the ultrametricity check).
 */
public class MessageLogger {
	String msgPrefix;
	PrintStream outStream;
	String sep = "\t";
	String kvSep = ": ";
	String indentString = "  ";

	public MessageLogger(String pref) {
		this.msgPrefix = pref;
		this.outStream = System.out;
	}

	public MessageLogger(String pref, String separator) {
		this(pref);
		this.sep = separator;
	}

	public void setPrintStream(PrintStream ps) {
		this.outStream = ps;
	}

	public void message(String label) {
		this.indentMessage(0, label);
	}

	public void indentMessage(int indentLevel, String label) {
		this._write_prefix();
		this._indent(indentLevel);
		this.outStream.println(label);
	}

	/**
	 * Writes "key: value" at the given depth. A null value is written as "null".
	 */
	public void indentKeyValue(int indentLevel, String key, Object value) {
		this.indentMessage(indentLevel, key + this.kvSep + value);
	}

	public void close() {
		this.outStream.flush();
	}

	protected void _write_prefix() {
		if (this.msgPrefix != null && !this.msgPrefix.isEmpty()) {
			this.outStream.print(this.msgPrefix + this.sep);
		}
	}

	protected void _indent(int indentLevel) {
		for (int x = 0; x < indentLevel; ++x) {
			this.outStream.print(this.indentString);
		}
	}
}
