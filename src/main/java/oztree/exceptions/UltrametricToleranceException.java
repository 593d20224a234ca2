package oztree.exceptions;

import java.io.PrintStream;

/**
 * Thrown when making a tree ultrametric would need a leaf adjustment larger than allowed.
 */
public class UltrametricToleranceException extends Exception {

	private static final long serialVersionUID = 1L;
	private String leafName;
	private double age;
	private double expectedAge;
	private double maxAdjustment;

	public UltrametricToleranceException(String leafName, double age, double expectedAge, double maxAdjustment) {
		this.leafName = leafName;
		this.age = age;
		this.expectedAge = expectedAge;
		this.maxAdjustment = maxAdjustment;
	}

	public String getLeafName() {
		return this.leafName;
	}

	public double getDelta() {
		return Math.abs(this.age - this.expectedAge);
	}

	@Override
	public String getMessage() {
		return this.leafName + " has age " + this.age + ", which is " + this.getDelta() + " from "
				+ this.expectedAge + " (max allowed delta is " + this.maxAdjustment + ")";
	}

	@Override
	public String toString() {
		return "UltrametricToleranceException: " + this.getMessage();
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed. " + this.toString());
	}
}
