package policycost.io;

import policycost.config.PolicyCostConstants;
import policycost.curve.Curve;
import policycost.engine.PolicyCostResults;
import policycost.engine.PolicySummary;
import policycost.scenario.ModelTime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Row layout shared by the tabular writers: one row per region and variable,
 * one column per period, values in 1990 dollars.
 */
final class PolicyCostTable {

    static final String VAR_UNDISC = "PolicyCostUndisc";
    static final String VAR_TOTAL_UNDISC = "PolicyCostTotalUndisc";
    static final String VAR_TOTAL_DISC = "PolicyCostTotalDisc";

    private PolicyCostTable() {}

    record Row(String region, String variable, String yearLabel, double[] values) {}

    static int[] years(ModelTime time) {
        int[] years = new int[time.getMaxPeriod()];
        for (int per = 0; per < years.length; per++) {
            years[per] = time.getPeriodToYear(per);
        }
        return years;
    }

    static List<Row> rows(PolicyCostResults results) {
        ModelTime time = results.modelTime();
        PolicySummary summary = results.summary();
        int maxPeriod = time.getMaxPeriod();
        List<Row> rows = new ArrayList<>();

        for (Map.Entry<String, Curve> e : summary.getRegionalCostCurves().asMap().entrySet()) {
            double[] v = new double[maxPeriod];
            for (int per = 0; per < maxPeriod; per++) {
                v[per] = e.getValue().getY(time.getPeriodToYear(per)) * PolicyCostConstants.CVRT_75_TO_90;
            }
            rows.add(new Row(e.getKey(), VAR_UNDISC, "Period", v));
        }

        // totals go in the last period column
        for (Map.Entry<String, Double> e : summary.getRegionalCosts().entrySet()) {
            rows.add(new Row(e.getKey(), VAR_TOTAL_UNDISC, "AllYears", lastOnly(maxPeriod, e.getValue())));
        }
        for (Map.Entry<String, Double> e : summary.getRegionalDiscountedCosts().entrySet()) {
            rows.add(new Row(e.getKey(), VAR_TOTAL_DISC, "AllYears", lastOnly(maxPeriod, e.getValue())));
        }
        return Collections.unmodifiableList(rows);
    }

    private static double[] lastOnly(int maxPeriod, double cost) {
        double[] v = new double[maxPeriod];
        v[maxPeriod - 1] = cost * PolicyCostConstants.CVRT_75_TO_90;
        return v;
    }
}
