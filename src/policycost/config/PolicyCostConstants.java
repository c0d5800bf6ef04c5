package policycost.config;

/**
 * Fixed constants of the policy cost calculation.
 */
public final class PolicyCostConstants {

    private PolicyCostConstants() {}

    /** Aggregate pseudo-region, reported but never summed into costs. */
    public static final String GLOBAL_REGION = "global";

    /** Converts 1975 dollars to 1990 dollars. */
    public static final double CVRT_75_TO_90 = 2.212;

    /** Units label of the tabular output. */
    public static final String COST_UNITS = "(millions)90US$";

    /** Period probed for an active policy market. */
    public static final int POLICY_PROBE_PERIOD = 1;

    // =========================================================================
    // ===========================   Defaults   ================================
    // =========================================================================

    public static final String DEFAULT_GAS = "CO2";
    public static final int DEFAULT_NUM_POINTS = 5;
    public static final double DEFAULT_DISCOUNT_RATE = 0.05;
    public static final int DEFAULT_DISCOUNT_START_YEAR = 2005;
    public static final String DEFAULT_REFERENCE_REGION = "USA";

    // =========================================================================
    // ===========================   Config keys   =============================
    // =========================================================================

    public static final String KEY_GAS = "AbatedGasForCostCurves";
    public static final String KEY_NUM_POINTS = "numPointsForCO2CostCurve";
    public static final String KEY_DISCOUNT_RATE = "discountRate";
    public static final String KEY_DISCOUNT_START_YEAR = "discount-start-year";
    public static final String KEY_REFERENCE_REGION = "policy-reference-region";
    public static final String KEY_OUTPUT_FILE = "costCurvesOutputFileName";
}
