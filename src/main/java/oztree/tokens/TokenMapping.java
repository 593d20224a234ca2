package oztree.tokens;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import oztree.constants.GeneralConstants;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.TokenNotFoundException;

/**
 * Read-only registry of symbolic inclusion tokens: upper case name -> MappingEntry.
 *
 * The mapping is read from a JSON object such as
 * <pre>
 * { "AMORPHEA": { "file": "Amorphea.PHY", "edge_length": 50, "taxon": null }, ... }
 * </pre>
 * and is handed explicitly to whoever decodes tokens; there is no shared instance.
 */
public class TokenMapping {
	static Logger _LOG = Logger.getLogger(TokenMapping.class);

	private final Map<String, MappingEntry> entries;

	public TokenMapping(Map<String, MappingEntry> entries) {
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<String, MappingEntry>(entries));
	}

	/**
	 * @return the entry for `name`
	 * @throws TokenNotFoundException if there is none; there is nothing sane to substitute
	 */
	public MappingEntry getEntry(String name) throws TokenNotFoundException {
		MappingEntry e = this.entries.get(name);
		if (e == null) {
			throw new TokenNotFoundException(name);
		}
		return e;
	}

	public boolean contains(String name) {
		return this.entries.containsKey(name);
	}

	public Set<String> getNames() {
		return this.entries.keySet();
	}

	public int size() {
		return this.entries.size();
	}

	public static TokenMapping load(File file) throws IOException, DataFormatException {
		_LOG.debug("Loading token mapping from " + file);
		try {
			return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
		} catch (DataFormatException dfx) {
			dfx.setFilePath(file.getPath());
			throw dfx;
		}
	}

	/**
	 * Loads the OneZoom mapping bundled with this package.
	 */
	public static TokenMapping loadDefault() throws IOException, DataFormatException {
		String resource = GeneralConstants.TOKEN_MAPPING_RESOURCE.stringValue();
		InputStream is = TokenMapping.class.getResourceAsStream(resource);
		if (is == null) {
			throw new IOException("Could not find the token mapping resource " + resource);
		}
		try (Reader r = new InputStreamReader(is, StandardCharsets.UTF_8)) {
			return parse(r);
		}
	}

	public static TokenMapping parse(String json) throws DataFormatException {
		try {
			return fromJSON(new JSONParser().parse(json));
		} catch (ParseException pe) {
			throw new DataFormatException("token mapping is not valid JSON: " + pe);
		}
	}

	private static TokenMapping parse(Reader r) throws IOException, DataFormatException {
		try {
			return fromJSON(new JSONParser().parse(r));
		} catch (ParseException pe) {
			throw new DataFormatException("token mapping is not valid JSON: " + pe);
		}
	}

	private static TokenMapping fromJSON(Object parsed) throws DataFormatException {
		if (!(parsed instanceof JSONObject)) {
			throw new DataFormatException("token mapping must be a JSON object");
		}
		JSONObject root = (JSONObject) parsed;
		Map<String, MappingEntry> entries = new LinkedHashMap<String, MappingEntry>();
		for (Object key : root.keySet()) {
			Object value = root.get(key);
			if (!(value instanceof JSONObject)) {
				throw new DataFormatException("mapping for \"" + key + "\" must be a JSON object");
			}
			JSONObject jo = (JSONObject) value;
			Object file = jo.get("file");
			if (!(file instanceof String)) {
				throw new DataFormatException("mapping for \"" + key + "\" has no file");
			}
			Object edgeLength = jo.get("edge_length");
			if (edgeLength != null && !(edgeLength instanceof Number)) {
				throw new DataFormatException("edge_length for \"" + key + "\" is not a number");
			}
			Object taxon = jo.get("taxon");
			entries.put((String) key, new MappingEntry((String) file,
					edgeLength == null ? null : edgeLength.toString(),
					taxon == null ? null : taxon.toString()));
		}
		_LOG.debug("Loaded " + entries.size() + " token mappings");
		return new TokenMapping(entries);
	}
}
