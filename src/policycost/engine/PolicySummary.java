package policycost.engine;

import policycost.curve.RegionCurves;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Regional cost curves and the scalar policy costs derived from them.
 */
public final class PolicySummary {

    private final RegionCurves regionalCostCurves;
    private final Map<String, Double> regionalCosts;
    private final Map<String, Double> regionalDiscountedCosts;
    private final double globalCost;
    private final double globalDiscountedCost;

    public PolicySummary(RegionCurves regionalCostCurves,
                         Map<String, Double> regionalCosts,
                         Map<String, Double> regionalDiscountedCosts,
                         double globalCost,
                         double globalDiscountedCost) {
        this.regionalCostCurves = regionalCostCurves;
        this.regionalCosts = Collections.unmodifiableMap(new TreeMap<>(regionalCosts));
        this.regionalDiscountedCosts = Collections.unmodifiableMap(new TreeMap<>(regionalDiscountedCosts));
        this.globalCost = globalCost;
        this.globalDiscountedCost = globalDiscountedCost;
    }

    /** Region to (year, period cost) curves. */
    public RegionCurves getRegionalCostCurves() {
        return regionalCostCurves;
    }

    public Map<String, Double> getRegionalCosts() {
        return regionalCosts;
    }

    public Map<String, Double> getRegionalDiscountedCosts() {
        return regionalDiscountedCosts;
    }

    public double getRegionalCost(String region) {
        return require(regionalCosts, region);
    }

    public double getRegionalDiscountedCost(String region) {
        return require(regionalDiscountedCosts, region);
    }

    public double getGlobalCost() {
        return globalCost;
    }

    public double getGlobalDiscountedCost() {
        return globalDiscountedCost;
    }

    private static double require(Map<String, Double> m, String region) {
        Double v = m.get(region);
        if (v == null) {
            throw new IllegalStateException("No cost for region '" + region + "'");
        }
        return v;
    }

    @Override
    public String toString() {
        return String.format("PolicySummary[regions=%d, global=%.3f, globalDiscounted=%.3f]",
                regionalCosts.size(), globalCost, globalDiscountedCost);
    }
}
