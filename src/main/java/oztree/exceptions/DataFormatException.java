package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when an auxiliary input (token mapping, node ages) does not have the expected shape.
 */
public class DataFormatException extends Exception {

	private static final long serialVersionUID = 1L;
	private String message;
	private String filename;

	// single name constructor
	public DataFormatException(String msg){
		this.message = msg;
		this.filename = null;
	}

	public DataFormatException(String msg, String filename){
		this.message = msg;
		this.filename = filename;
	}

	public void setFilePath(String filename) {
		this.filename = filename;
	}

	@Override
	public String getMessage() {
		return this.message;
	}

	@Override
	public String toString(){
		String msg = "Data Format Error: " + this.message;
		if (this.filename != null) {
			msg += "\nFile \"" + this.filename + "\"";
		}
		return msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
