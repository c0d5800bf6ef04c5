package policycost;

import policycost.scenario.EmissionsDriver;
import policycost.scenario.GhgPolicy;
import policycost.scenario.ModelTime;
import policycost.scenario.RegionEconomy;
import policycost.scenario.StylizedScenario;

import java.util.List;
import java.util.Map;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    public static final String SCENARIO_NAME = "stylized";

    /** Initial tax, 1975$ per tonne carbon. */
    public static final double BASE_TAX = 20.0;

    /** Yearly growth of the tax path. */
    public static final double TAX_GROWTH = 0.05;

    public static ModelTime defaultModelTime() {
        return ModelTime.evenlySpaced(2005, 5, 10);
    }

    public static StylizedScenario defaultScenario(String gasName) {
        ModelTime time = defaultModelTime();
        int n = time.getMaxPeriod();

        List<RegionEconomy> regions = List.of(
                new RegionEconomy("USA",
                        EmissionsDriver.inputDriver("coal"),
                        Map.of("coal", series(n, 560.0, 0.005), "gas", series(n, 480.0, 0.010)),
                        series(n, 1600.0, 0.020),
                        1.0, 0.60, 90.0),
                new RegionEconomy("EUR",
                        EmissionsDriver.outputDriver(),
                        Map.of("coal", series(n, 300.0, -0.010)),
                        series(n, 1100.0, 0.015),
                        0.35, 0.55, 70.0),
                new RegionEconomy("CHN",
                        EmissionsDriver.inputDriver("coal"),
                        Map.of("coal", series(n, 1400.0, 0.030)),
                        series(n, 900.0, 0.060),
                        1.0, 0.70, 60.0),
                new RegionEconomy("IND",
                        EmissionsDriver.outputDriver(),
                        Map.of(),
                        series(n, 350.0, 0.055),
                        0.90, 0.50, 50.0)
        );
        return new StylizedScenario(SCENARIO_NAME, time, gasName, regions);
    }

    /**
     * Same growing tax in every region.
     */
    public static void applyBaselinePolicy(StylizedScenario scenario, String gasName, List<String> regions) {
        ModelTime time = scenario.getModelTime();
        double[] taxes = new double[time.getMaxPeriod()];
        for (int per = 0; per < taxes.length; per++) {
            int years = time.getPeriodToYear(per) - time.getStartYear();
            taxes[per] = BASE_TAX * Math.pow(1.0 + TAX_GROWTH, years);
        }
        for (String region : regions) {
            scenario.setTax(new GhgPolicy(gasName, region, taxes));
        }
    }

    private static double[] series(int periods, double start, double growthPerPeriod) {
        double[] v = new double[periods];
        for (int per = 0; per < periods; per++) {
            v[per] = start * Math.pow(1.0 + growthPerPeriod, per);
        }
        return v;
    }
}
