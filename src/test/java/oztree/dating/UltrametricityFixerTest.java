package oztree.dating;

import static org.junit.Assert.*;

import org.junit.Test;
import oztree.exceptions.UltrametricToleranceException;
import oztree.tree.Tree;
import oztree.tree.TreeReader;

public class UltrametricityFixerTest {

	@Test
	public void testSmallAdjustment() throws Exception {
		Tree tree = new TreeReader().readTree("((A:1.000003,B:1):1,C:2);");
		new UltrametricityFixer(2).fix(tree);
		assertEquals("((A:1.0,B:1.0):1.0,C:2.0);", tree.getNewick(true, false));
		assertTrue(new UltrametricityChecker().check(tree).isUltrametric());
	}

	@Test
	public void testTooLargeAdjustment() {
		Tree tree = new TreeReader().readTree("((A:1.1,B:1):1,C:2);");
		try {
			new UltrametricityFixer(2).fix(tree);
			fail("expected the tolerance to be exceeded");
		} catch (UltrametricToleranceException e) {
			assertEquals("A", e.getLeafName());
			assertEquals(0.1, e.getDelta(), 1e-9);
		}
	}

	@Test
	public void testLargerTolerance() throws Exception {
		Tree tree = new TreeReader().readTree("((A:1.1,B:0.95):1,C:2.05);");
		new UltrametricityFixer(2, 0.2).fix(tree);
		assertEquals("((A:1.0,B:1.0):1.0,C:2.0);", tree.getNewick(true, false));
		assertTrue(new UltrametricityChecker().check(tree).isUltrametric());
	}

	@Test
	public void testEdgesAreRounded() throws Exception {
		Tree tree = new TreeReader().readTree("((A:0.4999999,B:0.5):0.5,C:1);");
		new UltrametricityFixer(1).fix(tree);
		assertEquals("((A:0.5,B:0.5):0.5,C:1.0);", tree.getNewick(true, false));
	}

	@Test
	public void testInclusionsAreLeftAlone() throws Exception {
		Tree tree = new TreeReader().readTree("((A:1,Foo_ott1@:7):1,C:2);");
		new UltrametricityFixer(2).fix(tree);
		assertEquals("((A:1.0,Foo_ott1@:7.0):1.0,C:2.0);", tree.getNewick(true, false));
	}
}
