package policycost.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import policycost.config.CostCurveConfig;
import policycost.scenario.ModelTime;
import policycost.scenario.ScenarioModel;

import java.io.IOException;

/**
 * Computes the total cost of the scenario's carbon policy.
 * <p>
 * The scenario must already have been solved under its policy. The calculator
 * then re-solves it N times at fractions 0, 1/N, ..., (N-1)/N of that tax,
 * builds a marginal abatement cost curve for every period and region from the
 * N+1 runs, and integrates those into regional and global costs.
 * <p>
 * Without a policy market nothing is run and nothing is reported.
 * <p>
 * The baseline tax is not reinstalled after the sweep: the scenario is left
 * holding the tax of trial N-1, (N-1)/N of the baseline. A later baseline run
 * followed by another {@link #calculateAbatementCostCurve()} sweeps from that
 * reduced tax unless the caller sets the policy again.
 */
public class PolicyCostCalculator {

    private static final Logger log = LoggerFactory.getLogger(PolicyCostCalculator.class);

    private final ScenarioModel scenario;
    private final CostCurveConfig config;
    private final TrialRunner trialRunner;
    private final PeriodCostCurveBuilder periodBuilder;
    private final RegionalCostAggregator aggregator;

    private TrialSet trials;
    private PeriodCostCurves periodCostCurves;
    private PolicySummary summary;
    private boolean ranCosts;

    public PolicyCostCalculator(ScenarioModel scenario, CostCurveConfig config) {
        if (scenario == null || config == null) {
            throw new IllegalArgumentException("scenario and config are required");
        }
        this.scenario = scenario;
        this.config = config;
        this.trialRunner = new TrialRunner(scenario, config.getAbatedGas(), config.getNumPoints());
        this.periodBuilder = new PeriodCostCurveBuilder();
        this.aggregator = new RegionalCostAggregator(config.getDiscountRate(), config.getDiscountStartYear());
    }

    /**
     * Runs the trial sweep and derives all cost curves and totals.
     *
     * @return whether every trial converged; true when skipped for lack of a policy
     */
    public boolean calculateAbatementCostCurve() {
        reset();

        if (!trialRunner.isPolicyActive(config.getReferenceRegion())) {
            log.info("Skipping cost curve calculations for non-policy model run.");
            return true;
        }

        trials = trialRunner.fromBaseline();
        boolean success = trialRunner.runTrials(trials);
        if (!success) {
            log.warn("Cost curve trials {} did not converge; costs include their results.", trials.failedTrials());
        }

        ModelTime time = scenario.getModelTime();
        periodCostCurves = periodBuilder.build(trials, time);
        summary = aggregator.aggregate(periodCostCurves, time.getEndYear());

        log.info("Policy cost for {}: global={}, discounted={}",
                scenario.getName(), summary.getGlobalCost(), summary.getGlobalDiscountedCost());

        ranCosts = true;
        return success;
    }

    /**
     * Sends the results to each sink. Does nothing unless a sweep completed.
     */
    public void printOutput(PolicyCostReport... sinks) throws IOException {
        if (!ranCosts) {
            return;
        }
        PolicyCostResults results = getResults();
        for (PolicyCostReport sink : sinks) {
            sink.write(results);
        }
    }

    public boolean hasRun() {
        return ranCosts;
    }

    public PolicyCostResults getResults() {
        if (!ranCosts) {
            throw new IllegalStateException("Cost curves have not been calculated");
        }
        return new PolicyCostResults(scenario.getName(), scenario.getModelTime(), periodCostCurves, summary);
    }

    public TrialSet getTrialSet() {
        return trials;
    }

    public PeriodCostCurves getPeriodCostCurves() {
        return periodCostCurves;
    }

    public PolicySummary getSummary() {
        return summary;
    }

    public CostCurveConfig getConfig() {
        return config;
    }

    private void reset() {
        trials = null;
        periodCostCurves = null;
        summary = null;
        ranCosts = false;
    }
}
