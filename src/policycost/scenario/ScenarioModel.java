package policycost.scenario;

import policycost.curve.RegionCurves;

/**
 * The simulation the cost curve sweep drives.
 * <p>
 * Implementations are not expected to be thread-safe: {@link #setTax(GhgPolicy)}
 * mutates the policy state read by the next {@link #run(boolean, String)}.
 */
public interface ScenarioModel {

    String getName();

    ModelTime getModelTime();

    /**
     * @return market price or {@link Marketplace#NO_MARKET_PRICE}
     */
    double getMarketPrice(String gasName, String region, int period);

    /**
     * Installs a fixed tax schedule, replacing any policy for the same gas and region.
     */
    void setTax(GhgPolicy policy);

    /**
     * Solves the scenario. The tag only distinguishes debug output of repeated runs.
     *
     * @return whether every solved period converged
     */
    boolean run(boolean allPeriods, String outputTag);

    /** Region to (year, emissions) curves from the last run. */
    RegionCurves getEmissionsQuantityCurves(String gasName);

    /** Region to (year, price) curves from the last run. */
    RegionCurves getEmissionsPriceCurves(String gasName);
}
