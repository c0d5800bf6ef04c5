package policycost.config;

/**
 * Settings of one abatement cost curve sweep.
 */
public final class CostCurveConfig {

    /** Gas whose policy is analyzed. */
    private final String abatedGas;

    /** Number of intermediate trials N; N+1 points per curve. */
    private final int numPoints;

    /** Rate used for present-value costs. */
    private final double discountRate;

    /** Lower bound of the regional cost integration. */
    private final int discountStartYear;

    /** Region probed for an active policy market. */
    private final String referenceRegion;

    /** XML output file name, null means derived from the scenario name. */
    private final String outputFileName;

    public CostCurveConfig(String abatedGas,
                           int numPoints,
                           double discountRate,
                           int discountStartYear,
                           String referenceRegion,
                           String outputFileName) {
        if (abatedGas == null || abatedGas.isBlank()) {
            throw new IllegalArgumentException("abatedGas must be set");
        }
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got " + numPoints);
        }
        if (referenceRegion == null || referenceRegion.isBlank()) {
            throw new IllegalArgumentException("referenceRegion must be set");
        }
        this.abatedGas = abatedGas;
        this.numPoints = numPoints;
        this.discountRate = discountRate;
        this.discountStartYear = discountStartYear;
        this.referenceRegion = referenceRegion;
        this.outputFileName = outputFileName;
    }

    public static CostCurveConfig defaults() {
        return new CostCurveConfig(
                PolicyCostConstants.DEFAULT_GAS,
                PolicyCostConstants.DEFAULT_NUM_POINTS,
                PolicyCostConstants.DEFAULT_DISCOUNT_RATE,
                PolicyCostConstants.DEFAULT_DISCOUNT_START_YEAR,
                PolicyCostConstants.DEFAULT_REFERENCE_REGION,
                null
        );
    }

    public String getAbatedGas() {
        return abatedGas;
    }

    public int getNumPoints() {
        return numPoints;
    }

    public double getDiscountRate() {
        return discountRate;
    }

    public int getDiscountStartYear() {
        return discountStartYear;
    }

    public String getReferenceRegion() {
        return referenceRegion;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    public String outputFileNameFor(String scenarioName) {
        return outputFileName != null ? outputFileName : "cost_curves_" + scenarioName + ".xml";
    }

    @Override
    public String toString() {
        return String.format("CostCurveConfig[gas=%s, N=%d, rate=%.4f, start=%d, ref=%s]",
                abatedGas, numPoints, discountRate, discountStartYear, referenceRegion);
    }
}
