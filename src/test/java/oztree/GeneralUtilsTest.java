package oztree;

import static org.junit.Assert.*;

import org.junit.Test;

public class GeneralUtilsTest {

	@Test
	public void testTrimTree() {
		assertEquals("(A,B)C", GeneralUtils.trimTree("[source: Poulakakis 2010]\n(A,B)C;\n", true));
		assertEquals("(A,B)C;", GeneralUtils.trimTree("  (A,B)C;  \n", false));
		assertEquals("(A,B)C", GeneralUtils.trimTree("(A,B)C", true));
	}

	@Test
	public void testRound() {
		assertEquals(0.3, GeneralUtils.round(0.1 + 0.2, 12), 0.0);
		assertEquals(1.000003, GeneralUtils.round(1.0000025000001, 6), 0.0);
	}

	@Test
	public void testFormatNumber() {
		assertEquals("7.0", GeneralUtils.formatNumber(7));
		assertEquals("2.5", GeneralUtils.formatNumber(2.5));
		assertEquals("0.0", GeneralUtils.formatNumber(0));
	}
}
