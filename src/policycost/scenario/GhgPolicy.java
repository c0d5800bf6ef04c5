package policycost.scenario;

/**
 * Fixed per-period tax on a gas in one region.
 */
public final class GhgPolicy {

    private final String gasName;
    private final String region;
    private final double[] taxes;

    public GhgPolicy(String gasName, String region, double[] taxes) {
        this.gasName = gasName;
        this.region = region;
        this.taxes = taxes.clone();
    }

    public String getGasName() {
        return gasName;
    }

    public String getRegion() {
        return region;
    }

    public int periodCount() {
        return taxes.length;
    }

    public double getTax(int period) {
        return taxes[period];
    }

    public double[] getTaxes() {
        return taxes.clone();
    }
}
