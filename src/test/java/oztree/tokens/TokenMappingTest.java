package oztree.tokens;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.TokenNotFoundException;

public class TokenMappingTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testParse() throws Exception {
		TokenMapping mapping = TokenMapping.parse("{\"AMORPHEA\": {\"file\": \"Amorphea.PHY\", \"edge_length\": 50, \"taxon\": null},"
				+ " \"DALATIIDAE\": {\"file\": \"Naylor2012Dalatiidae.PHY\", \"edge_length\": 116.1},"
				+ " \"CRUMS\": {\"file\": \"CRuMs.PHY\", \"edge_length\": null, \"taxon\": \"CRuMs\"}}");
		assertEquals(3, mapping.size());
		assertEquals("50", mapping.getEntry("AMORPHEA").getEdgeLength());
		assertNull(mapping.getEntry("AMORPHEA").getTaxon());
		assertEquals("116.1", mapping.getEntry("DALATIIDAE").getEdgeLength());
		assertNull(mapping.getEntry("CRUMS").getEdgeLength());
		assertEquals("CRuMs", mapping.getEntry("CRUMS").getTaxon());
	}

	@Test(expected = TokenNotFoundException.class)
	public void testMissingEntry() throws Exception {
		TokenMapping.parse("{}").getEntry("AMORPHEA");
	}

	@Test(expected = DataFormatException.class)
	public void testEntryWithoutFile() throws Exception {
		TokenMapping.parse("{\"AMORPHEA\": {\"edge_length\": 50}}");
	}

	@Test(expected = DataFormatException.class)
	public void testNotJson() throws Exception {
		TokenMapping.parse("AMORPHEA = Amorphea.PHY");
	}

	@Test
	public void testLoadReportsTheFile() throws Exception {
		File f = this.folder.newFile("map.json");
		FileUtils.writeStringToFile(f, "[1, 2]", StandardCharsets.UTF_8);
		try {
			TokenMapping.load(f);
			fail("expected a data format error");
		} catch (DataFormatException e) {
			assertTrue(e.toString().contains(f.getPath()));
		}
	}

	@Test
	public void testBundledMapping() throws Exception {
		TokenMapping mapping = TokenMapping.loadDefault();
		assertTrue(mapping.size() > 40);
		assertEquals("Amorphea.PHY", mapping.getEntry("AMORPHEA").getFile());
		assertEquals("50", mapping.getEntry("AMORPHEA").getEdgeLength());
		assertEquals("Animals.PHY", mapping.getEntry("METAZOA").getFile());
		assertEquals("Ambulacraria", mapping.getEntry("AMBULACRARIA").getTaxon());
		assertEquals("Most_Carcharhinicae_", mapping.getEntry("CARCHARHINICAE_MINUS").getTaxon());
	}
}
