package policycost.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import policycost.curve.Curve;
import policycost.curve.RegionCurves;
import policycost.curve.XYPoint;
import policycost.scenario.ModelTime;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds one marginal abatement cost curve per period and region.
 * <p>
 * Point i of a curve is (q_N - q_i, tax_i) at the period year, so trial N sits
 * at zero reduction and trial 0 at zero tax.
 */
public final class PeriodCostCurveBuilder {

    private static final Logger log = LoggerFactory.getLogger(PeriodCostCurveBuilder.class);

    public PeriodCostCurves build(TrialSet trials, ModelTime time) {
        trials.checkRegionConsistency();

        int maxPeriod = time.getMaxPeriod();
        int[] years = new int[maxPeriod];
        List<RegionCurves> byPeriod = new ArrayList<>(maxPeriod);

        RegionCurves baseline = trials.getBaselineQuantityCurves();

        for (int per = 0; per < maxPeriod; per++) {
            int year = time.getPeriodToYear(per);
            years[per] = year;

            RegionCurves periodCurves = new RegionCurves();
            for (String region : baseline.regions()) {
                double baseQ = baseline.require(region).getY(year);

                List<XYPoint> points = new ArrayList<>(trials.size());
                for (int trial = 0; trial < trials.size(); trial++) {
                    double reduction = baseQ - trials.getQuantityCurves(trial).require(region).getY(year);
                    double tax = trials.getPriceCurves(trial).require(region).getY(year);
                    if (!Double.isFinite(reduction) || !Double.isFinite(tax)) {
                        log.warn("Dropping trial {} from the {} curve of {}: reduction={}, tax={}",
                                trial, year, region, reduction, tax);
                        continue;
                    }
                    points.add(new XYPoint(reduction, tax));
                }
                if (points.isEmpty()) {
                    points.add(new XYPoint(0.0, 0.0));
                }
                periodCurves.put(region, new Curve(region + " period cost curve", per, points));
            }
            byPeriod.add(periodCurves);
        }
        return new PeriodCostCurves(years, byPeriod);
    }
}
