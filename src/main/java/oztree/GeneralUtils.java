package oztree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

public class GeneralUtils {

	/**
	 * Strips surrounding whitespace, one leading [...] comment block and (optionally) the trailing
	 *	semicolon from a tree string, e.g. "[source: Poulakakis 2010]\n(A,B)C;\n" gives "(A,B)C".
	 *
	 * @param tree the raw file contents
	 * @param stripSemicolon false to keep the terminating semicolon
	 * @return the trimmed tree
	 */
	public static String trimTree(String tree, boolean stripSemicolon) {
		tree = StringUtils.strip(tree);
		if (tree.startsWith("[")) {
			int close = tree.indexOf(']');
			if (close >= 0) {
				tree = StringUtils.stripStart(tree.substring(close + 1), null);
			}
		}
		if (stripSemicolon && tree.endsWith(";")) {
			tree = tree.substring(0, tree.length() - 1);
		}
		return tree;
	}

	/**
	 * Reads a whole tree file as UTF-8.
	 */
	public static String readTreeFile(File file) throws IOException {
		return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
	}

	/**
	 * Reads a tree file and trims it, keeping the semicolon so it can be handed to the NewickScanner.
	 */
	public static String readTrimmedTree(File file) throws IOException {
		return trimTree(readTreeFile(file), false);
	}

	/**
	 * Rounds to a number of decimals, half-even on the decimal representation.
	 */
	public static double round(double value, int decimals) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return value;
		}
		return java.math.BigDecimal.valueOf(value).setScale(decimals, java.math.RoundingMode.HALF_EVEN).doubleValue();
	}

	/**
	 * Formats a length or age the way it is written back into Newick: integral values keep one
	 *	decimal ("7.0"), everything else uses the shortest representation.
	 */
	public static String formatNumber(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return String.valueOf((long) value) + ".0";
		}
		return String.valueOf(value);
	}
}
