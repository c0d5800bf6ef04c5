package policycost.config;

/**
 * Builder for CostCurveConfig.
 */
public class CostCurveConfigBuilder {

    private String abatedGas = PolicyCostConstants.DEFAULT_GAS;
    private int numPoints = PolicyCostConstants.DEFAULT_NUM_POINTS;
    private double discountRate = PolicyCostConstants.DEFAULT_DISCOUNT_RATE;
    private int discountStartYear = PolicyCostConstants.DEFAULT_DISCOUNT_START_YEAR;
    private String referenceRegion = PolicyCostConstants.DEFAULT_REFERENCE_REGION;
    private String outputFileName;

    public CostCurveConfigBuilder() {
    }

    /**
     * Start from an existing configuration.
     */
    public static CostCurveConfigBuilder from(CostCurveConfig base) {
        CostCurveConfigBuilder b = new CostCurveConfigBuilder();
        b.abatedGas = base.getAbatedGas();
        b.numPoints = base.getNumPoints();
        b.discountRate = base.getDiscountRate();
        b.discountStartYear = base.getDiscountStartYear();
        b.referenceRegion = base.getReferenceRegion();
        b.outputFileName = base.getOutputFileName();
        return b;
    }

    public CostCurveConfigBuilder setAbatedGas(String abatedGas) {
        this.abatedGas = abatedGas;
        return this;
    }

    public CostCurveConfigBuilder setNumPoints(int numPoints) {
        this.numPoints = numPoints;
        return this;
    }

    public CostCurveConfigBuilder setDiscountRate(double discountRate) {
        this.discountRate = discountRate;
        return this;
    }

    public CostCurveConfigBuilder setDiscountStartYear(int discountStartYear) {
        this.discountStartYear = discountStartYear;
        return this;
    }

    public CostCurveConfigBuilder setReferenceRegion(String referenceRegion) {
        this.referenceRegion = referenceRegion;
        return this;
    }

    public CostCurveConfigBuilder setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
        return this;
    }

    public CostCurveConfig build() {
        return new CostCurveConfig(
                abatedGas,
                numPoints,
                discountRate,
                discountStartYear,
                referenceRegion,
                outputFileName
        );
    }
}
