package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when more specific errors classes do not apply, and a tree
 *  could not be assembled or extracted (e.g. the base file is missing).
 */
public class TreeAssemblyException extends Exception {

    private static final long serialVersionUID = 1L;
    private String msg;

    public TreeAssemblyException(String error_msg){
        super(error_msg);
        this.msg = error_msg;
    }

    public TreeAssemblyException(String error_msg, Throwable cause){
        super(error_msg, cause);
        this.msg = error_msg;
    }

    @Override
    public String toString(){
        return "TreeAssemblyException: " + this.msg;
    }

    public void reportFailedAction(PrintStream out, String failedAction) {
        String m = failedAction + " failed due to " + this.toString();
        out.println(m);
    }

}
