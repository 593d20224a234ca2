package oztree.constants;

/**
 * A general-purpose container for information that does not change but does not necessarily fit into other enums.
 * This enum uses a generic structure to contain any type of information. The data objects themselves are stored
 * in the `value` parameter, and the type is indicated by the type stored in `type`.
 */
public enum GeneralConstants {

	// extracted Open Tree parts are written as <ott>.phy, additional copied parts are <ott>.nwk
	REFERENCE_PART_EXTENSION (String.class, ".phy"),
	REFERENCE_PART_FALLBACK_EXTENSION (String.class, ".nwk"),

	// classpath resource holding the OneZoom token -> file mapping
	TOKEN_MAPPING_RESOURCE (String.class, "/oztree/token_to_file_map.json"),

	// largest leaf age adjustment fixultrametric allows by default
	DEFAULT_MAX_ULTRAMETRIC_ADJUSTMENT (Double.class, 0.000005),
	LEAF_AGE_DECIMALS (Integer.class, 12),
	FIXED_EDGE_DECIMALS (Integer.class, 6),

	// date imputation: share of the longest-path solution, and exponential spacing along the path
	DATE_LONGEST_PATH_WEIGHT (Double.class, 0.25),
	DATE_SPACING_EXPONENT (Double.class, 0.0),

	// interior nodes with a median age below this are treated as undated
	MIN_INTERIOR_AGE (Double.class, 0.000001);

	public final Class<?> type;
	public final Object value;

	GeneralConstants(Class<?> type, Object value) {
		this.type = type;
		this.value = value;
	}

	public String stringValue() {
		return (String) this.value;
	}

	public double doubleValue() {
		return ((Number) this.value).doubleValue();
	}

	public int intValue() {
		return ((Number) this.value).intValue();
	}
}
