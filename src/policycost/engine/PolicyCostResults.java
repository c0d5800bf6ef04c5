package policycost.engine;

import policycost.scenario.ModelTime;

/**
 * Everything a report sink receives after a completed sweep.
 */
public record PolicyCostResults(String scenarioName,
                                ModelTime modelTime,
                                PeriodCostCurves periodCostCurves,
                                PolicySummary summary) {}
