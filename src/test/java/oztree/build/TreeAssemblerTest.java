package oztree.build;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import oztree.CapturingAppender;
import oztree.MessageLogger;
import oztree.exceptions.NewickSyntaxException;
import oztree.exceptions.TokenNotFoundException;
import oztree.exceptions.TreeAssemblyException;
import oztree.tokens.MappingEntry;
import oztree.tokens.TokenDecoder;
import oztree.tokens.TokenMapping;

public class TreeAssemblerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File ozFolder;
	private File otFolder;
	private TreeAssembler assembler;
	private CapturingAppender appender;

	@Before
	public void setUp() throws IOException {
		this.ozFolder = this.folder.newFolder("oz");
		this.otFolder = this.folder.newFolder("ot");

		Map<String, MappingEntry> entries = new HashMap<String, MappingEntry>();
		entries.put("AMORPHEA", new MappingEntry("Amorphea.PHY", "50", null));
		entries.put("METAZOA", new MappingEntry("Animals.PHY", "150", null));
		entries.put("AMBULACRARIA", new MappingEntry("Ambulacraria.PHY", "20", "Ambulacraria"));
		entries.put("CRUMS", new MappingEntry("CRuMs.PHY", null, null));
		this.assembler = new TreeAssembler(new TokenDecoder(new TokenMapping(entries)));

		this.appender = new CapturingAppender();
		Logger.getLogger(TreeAssembler.class).addAppender(this.appender);
	}

	@After
	public void tearDown() {
		Logger.getLogger(TreeAssembler.class).removeAppender(this.appender);
	}

	private File writeOz(String name, String tree) throws IOException {
		File f = new File(this.ozFolder, name);
		FileUtils.writeStringToFile(f, tree, StandardCharsets.UTF_8);
		return f;
	}

	private void writeOt(String name, String tree) throws IOException {
		FileUtils.writeStringToFile(new File(this.otFolder, name), tree, StandardCharsets.UTF_8);
	}

	private String build(File base) throws Exception {
		return this.assembler.build(base, this.ozFolder, this.otFolder);
	}

	@Test
	public void testMappingEdgeLengthWinsOverTrailer() throws Exception {
		File base = this.writeOz("Base.PHY", "[OneZoom base tree]\n(X:1,AMORPHEA@)Root;\n");
		this.writeOz("Amorphea.PHY", "(A:1,B:1)Amorphea:12;\n");
		assertEquals("(X:1,(A:1,B:1)Amorphea:50)Root;", this.build(base));
	}

	@Test
	public void testMappingTaxonWinsOverTrailer() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,AMBULACRARIA@:20)Root;");
		this.writeOz("Ambulacraria.PHY", "(C,D)Something:5;");
		assertEquals("(X,(C,D)Ambulacraria:20)Root;", this.build(base));
	}

	@Test
	public void testFragmentFallsBackToTrailerThenParentName() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,CRUMS@:3)Root;");
		this.writeOz("CRuMs.PHY", "(E,F):7;");
		// the edge length in the parent is never used
		assertEquals("(X,(E,F)CRUMS:7)Root;", this.build(base));
	}

	@Test
	public void testReferencePartPrefersParentName() throws Exception {
		File base = this.writeOz("Base.PHY", "(Lamp_ott10@:3,Foo_ott20@)Root;");
		this.writeOt("10.phy", "(Lingula_ott1,Discina_ott2)Brachiopoda_ott10;\n");
		this.writeOt("20.nwk", "(G,H)Bar:4;");
		assertEquals("((Lingula_ott1,Discina_ott2)Lamp_ott10,(G,H)Foo_ott20:4)Root;", this.build(base));
	}

	@Test
	public void testReferencePartsAreNotExpanded() throws Exception {
		File base = this.writeOz("Base.PHY", "(Brachiopoda_ott10@,Y)Root;");
		this.writeOt("10.phy", "(Lingula_ott1,AMORPHEA@)Brachiopoda_ott10;");
		assertEquals("((Lingula_ott1,AMORPHEA@)Brachiopoda_ott10,Y)Root;", this.build(base));
	}

	@Test
	public void testNestedFragments() throws Exception {
		File base = this.writeOz("Base.PHY", "(AMORPHEA@,Z)Root;");
		this.writeOz("Amorphea.PHY", "(METAZOA@,Fungi_ott352914@)Amorphea;");
		this.writeOz("Animals.PHY", "(Porifera:10,Ctenophora:10)Animals:40;");
		this.writeOt("352914.phy", "(Yeast,Mushroom)Fungi_ott352914;");
		assertEquals("(((Porifera:10,Ctenophora:10)Animals:150,(Yeast,Mushroom)Fungi_ott352914)Amorphea:50,Z)Root;",
				this.build(base));
	}

	@Test
	public void testMissingFileKeepsTokenAndWarnsOnce() throws Exception {
		File base = this.writeOz("Base.PHY", "(Missing_ott555@:2,W)Root;");
		assertEquals("(Missing_ott555@:2,W)Root;", this.build(base));
		assertEquals(1, this.appender.getWarnings().size());
		assertTrue(this.appender.getWarnings().get(0).contains("555.nwk"));
	}

	@Test
	public void testOutputIsValidNewickWithMissingFiles() throws Exception {
		File base = this.writeOz("Base.PHY", "(AMORPHEA@,Lost_ott1@)Root;");
		String tree = this.build(base);
		assertEquals("(AMORPHEA@,Lost_ott1@)Root;", tree);
		assertEquals(3, oztree.newick.NewickScanner.validate(tree));
		assertEquals(2, this.appender.getWarnings().size());
	}

	@Test(expected = NewickSyntaxException.class)
	public void testMalformedFragmentAborts() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,AMORPHEA@)Root;");
		this.writeOz("Amorphea.PHY", "((A,B)Amorphea;");
		this.build(base);
	}

	@Test
	public void testEdgeLengthTypoAborts() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,AMORPHEA@)Root;");
		this.writeOz("Amorphea.PHY", "(A:1f,B:1)Amorphea;");
		try {
			this.build(base);
			fail("expected a syntax error");
		} catch (NewickSyntaxException e) {
			assertTrue(e.getMessage().contains("'1f' is not a valid edge length"));
		}
	}

	@Test
	public void testUnknownSymbolicTokenAborts() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,AMORPHEA@)Root;");
		File fragment = this.writeOz("Amorphea.PHY", "(A,UNKNOWN@)Amorphea;");
		try {
			this.build(base);
			fail("expected an unknown token");
		} catch (TokenNotFoundException e) {
			assertEquals(fragment.getPath(), e.getSourceFile());
			assertEquals("UNKNOWN", e.getMissingNames().get(0));
		}
	}

	@Test(expected = TreeAssemblyException.class)
	public void testMissingBaseFile() throws Exception {
		this.build(new File(this.ozFolder, "Nope.PHY"));
	}

	@Test
	public void testFragmentsDefaultToTheBaseFolder() throws Exception {
		File base = this.writeOz("Base.PHY", "(X:1,AMORPHEA@)Root;");
		this.writeOz("Amorphea.PHY", "(A,B)Amorphea;");
		StringBuilder sb = new StringBuilder();
		this.assembler.build(base, this.otFolder, sb);
		assertEquals("(X:1,(A,B)Amorphea:50)Root;", sb.toString());
	}

	@Test
	public void testFragmentHoldingOnlyAToken() throws Exception {
		File base = this.writeOz("Base.PHY", "(X,AMORPHEA@)Root;");
		this.writeOz("Amorphea.PHY", "Fungi_ott1@");
		this.writeOt("1.phy", "(Y,M)Fungi_ott1;");
		// the fragment has no trailer of its own, so the name in the parent is written right after
		// the included part's name
		assertEquals("(X,(Y,M)Fungi_ott1AMORPHEA:50)Root;", this.build(base));
	}

	@Test
	public void testFileTreeReport() throws Exception {
		File base = this.writeOz("Base.PHY", "(AMORPHEA@:50,Fungi_ott352914@)Root;");
		this.writeOz("Amorphea.PHY", "(METAZOA@,Fungi)Amorphea;");
		this.writeOz("Animals.PHY", "(P,C)Animals;");

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		MessageLogger logger = new MessageLogger("");
		logger.setPrintStream(new PrintStream(bytes, true, "UTF-8"));
		this.assembler.setFileTreeLogger(logger);
		this.build(base);

		String[] lines = bytes.toString("UTF-8").split("\\r?\\n");
		assertEquals(3, lines.length);
		assertEquals("Base.PHY: null 0", lines[0]);
		assertEquals("  AMORPHEA: 50 50", lines[1]);
		assertEquals("    METAZOA: null 150", lines[2]);
	}
}
