package policycost.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import policycost.config.PolicyCostConstants;
import policycost.curve.Curve;
import policycost.curve.RegionCurves;
import policycost.scenario.GhgPolicy;
import policycost.scenario.Marketplace;
import policycost.scenario.ModelTime;
import policycost.scenario.ScenarioModel;

import java.util.Map;

/**
 * Re-solves the scenario under scaled copies of the baseline tax.
 * <p>
 * Trials run one after another: each installs its tax on the shared scenario
 * right before solving it.
 */
public final class TrialRunner {

    private static final Logger log = LoggerFactory.getLogger(TrialRunner.class);

    private final ScenarioModel scenario;
    private final String gasName;
    private final int numPoints;

    public TrialRunner(ScenarioModel scenario, String gasName, int numPoints) {
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got " + numPoints);
        }
        this.scenario = scenario;
        this.gasName = gasName;
        this.numPoints = numPoints;
    }

    /**
     * Whether the reference region has a market for the gas in the probe period.
     */
    public boolean isPolicyActive(String referenceRegion) {
        double price = scenario.getMarketPrice(gasName, referenceRegion, PolicyCostConstants.POLICY_PROBE_PERIOD);
        return !Marketplace.isNoMarket(price);
    }

    /**
     * New trial set whose slot N holds the curves of the run already done.
     */
    public TrialSet fromBaseline() {
        TrialSet trials = new TrialSet(numPoints);
        trials.record(numPoints,
                scenario.getEmissionsQuantityCurves(gasName),
                scenario.getEmissionsPriceCurves(gasName),
                true);
        return trials;
    }

    /**
     * Runs trials 0..N-1 at tax fractions k/N of the baseline.
     * A failed trial is recorded and the sweep goes on.
     *
     * @return whether every trial converged
     */
    public boolean runTrials(TrialSet trials) {
        RegionCurves baselinePrices = trials.getBaselinePriceCurves();
        boolean success = true;

        for (int k = 0; k < numPoints; k++) {
            double fraction = (double) k / (double) numPoints;
            installScaledTaxes(baselinePrices, fraction);

            log.info("Starting cost curve point run number {}.", k);
            boolean converged = scenario.run(true, Integer.toString(k));
            if (!converged) {
                log.warn("Cost curve point run {} (tax fraction {}) did not converge; its curves are kept.",
                        k, fraction);
            }
            success &= converged;

            trials.record(k,
                    scenario.getEmissionsQuantityCurves(gasName),
                    scenario.getEmissionsPriceCurves(gasName),
                    converged);
        }
        return success;
    }

    // same fraction for every region
    private void installScaledTaxes(RegionCurves baselinePrices, double fraction) {
        ModelTime time = scenario.getModelTime();
        int maxPeriod = time.getMaxPeriod();

        for (Map.Entry<String, Curve> e : baselinePrices.asMap().entrySet()) {
            double[] taxes = new double[maxPeriod];
            for (int per = 0; per < maxPeriod; per++) {
                taxes[per] = e.getValue().getY(time.getPeriodToYear(per)) * fraction;
            }
            scenario.setTax(new GhgPolicy(gasName, e.getKey(), taxes));
        }
    }

    public int getNumPoints() {
        return numPoints;
    }

    public String getGasName() {
        return gasName;
    }
}
