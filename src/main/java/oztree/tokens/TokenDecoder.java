package oztree.tokens;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;
import oztree.exceptions.TokenNotFoundException;

/**
 * Decodes the OneZoom inclusion syntax found in node labels:
 * <pre>
 *	foobar_ott123@           the Open Tree subtree of ott 123, named foobar_ott123
 *	foobar_ott123~456-789@   the subtree of ott 456 minus the subtree of ott 789, named foobar_ott123
 *	foobar_ott123~-789-111@  shorthand for foobar_ott123~123-789-111@
 *	foobar_ott~456-789-111@  the subtree of ott 456 minus 789 and 111, named foobar (no ott)
 *	AMORPHEA@:50             the OneZoom file registered as AMORPHEA, edge length 50 in the parent
 * </pre>
 * The tilde reads as "equals"; it is used because tree libraries reject '=' in taxon names.
 */
public class TokenDecoder {
	static Logger _LOG = Logger.getLogger(TokenDecoder.class);

	private static final Pattern FULL_TOKEN = Pattern.compile("'?([\\w\\-~]+)@'?(?::([\\d.]+))?",
			Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern OTT_DETAILS = Pattern.compile("(\\w+)_ott(\\d*)~?([-\\d]*)",
			Pattern.UNICODE_CHARACTER_CLASS);

	private final TokenMapping mapping;

	public TokenDecoder(TokenMapping mapping) {
		this.mapping = mapping;
	}

	/**
	 * @return true if `label` is a whole inclusion token, e.g. "Micrarchaeota_ott5248238@"
	 */
	public static boolean isInclusionLabel(String label) {
		if (label == null) {
			return false;
		}
		return FULL_TOKEN.matcher(label).matches();
	}

	/**
	 * Decodes a single label such as "foobar_ott123~-789-111@" or "AMORPHEA@:50".
	 *
	 * @return the token, or null if the label has no inclusion syntax
	 * @throws TokenNotFoundException if it is a symbolic token with no mapping
	 */
	public InclusionToken decode(String label) throws TokenNotFoundException {
		Matcher m = FULL_TOKEN.matcher(label);
		if (!m.matches()) {
			return null;
		}
		return this.toToken(m);
	}

	/**
	 * Finds every inclusion token in a tree string, left to right. A leading [...] comment block
	 *	is skipped.
	 *
	 * @throws TokenNotFoundException on the first symbolic token with no mapping
	 */
	public List<InclusionToken> findTokens(String tree) throws TokenNotFoundException {
		List<InclusionToken> tokens = new ArrayList<InclusionToken>();
		int startIndex = 0;
		if (tree.indexOf('[') >= 0) {
			startIndex = Math.max(tree.indexOf(']'), 0);
		}
		Matcher m = FULL_TOKEN.matcher(tree);
		int from = startIndex;
		while (from <= tree.length() && m.find(from)) {
			tokens.add(this.toToken(m));
			from = m.end() > m.start() ? m.end() : m.end() + 1;
		}
		return tokens;
	}

	private InclusionToken toToken(Matcher m) throws TokenNotFoundException {
		String fullName = m.group(1);
		String edgeLength = m.group(2);
		String baseOtt = null;
		List<String> excludedOtts = new ArrayList<String>();
		String nodeName = fullName;

		Matcher details = OTT_DETAILS.matcher(fullName);
		if (details.matches()) {
			// split by minus signs; the first number after '~' (if any) is the tree to extract
			List<String> numbers = new ArrayList<String>(Arrays.asList(details.group(3).split("-", -1)));
			String firstNumberAfterEqual = numbers.remove(0);
			for (String n : numbers) {
				if (!n.isEmpty()) {
					excludedOtts.add(n);
				}
			}
			baseOtt = firstNumberAfterEqual.isEmpty() ? details.group(2) : firstNumberAfterEqual;
			if (baseOtt.isEmpty()) {
				// "foobar_ott@" carries no usable ott: fall back to a plain symbolic name
				baseOtt = null;
			} else {
				// the ott stays in the name only when it did not come after the '~'
				nodeName = details.group(1);
				if (firstNumberAfterEqual.isEmpty()) {
					nodeName += "_ott" + baseOtt;
				}
			}
		}

		InclusionToken token;
		if (baseOtt != null) {
			token = new ReferenceInclusion(m.start(), m.end(), nodeName, edgeLength, baseOtt, excludedOtts);
		} else {
			token = new FragmentInclusion(m.start(), m.end(), nodeName, edgeLength, this.mapping.getEntry(nodeName));
		}
		_LOG.debug(token);
		return token;
	}
}
