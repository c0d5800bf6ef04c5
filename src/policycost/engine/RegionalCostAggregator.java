package policycost.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import policycost.config.PolicyCostConstants;
import policycost.curve.Curve;
import policycost.curve.RegionCurves;
import policycost.curve.XYPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Integrates period abatement curves into regional cost curves and then into
 * undiscounted and discounted regional and global totals.
 * The {@value PolicyCostConstants#GLOBAL_REGION} curve is reporting-only and skipped.
 */
public final class RegionalCostAggregator {

    private static final Logger log = LoggerFactory.getLogger(RegionalCostAggregator.class);

    private final double discountRate;
    private final int startYear;

    public RegionalCostAggregator(double discountRate, int startYear) {
        this.discountRate = discountRate;
        this.startYear = startYear;
    }

    public PolicySummary aggregate(PeriodCostCurves periodCurves, int endYear) {
        RegionCurves regionalCurves = new RegionCurves();
        Map<String, Double> costs = new TreeMap<>();
        Map<String, Double> discounted = new TreeMap<>();
        double globalCost = 0.0;
        double globalDiscountedCost = 0.0;

        if (periodCurves.periodCount() == 0) {
            return new PolicySummary(regionalCurves, costs, discounted, 0.0, 0.0);
        }
        if (endYear < startYear) {
            log.warn("Discount start year {} is after model end year {}; regional costs are zero.",
                    startYear, endYear);
        }

        for (String region : periodCurves.get(0).regions()) {
            if (PolicyCostConstants.GLOBAL_REGION.equals(region)) continue;

            List<XYPoint> costPoints = new ArrayList<>(periodCurves.periodCount());
            for (int per = 0; per < periodCurves.periodCount(); per++) {
                Curve periodCurve = periodCurves.get(per).require(region);
                costPoints.add(new XYPoint(periodCurves.getYear(per), periodCost(periodCurve)));
            }
            Curve regionalCurve = new Curve(region, costPoints);

            double regionalCost = 0.0;
            double discountedRegionalCost = 0.0;
            if (endYear >= startYear) {
                regionalCost = regionalCurve.getIntegral(startYear, endYear);
                discountedRegionalCost = regionalCurve.getDiscountedValue(startYear, endYear, discountRate);
            }

            regionalCurves.put(region, regionalCurve);
            costs.put(region, regionalCost);
            discounted.put(region, discountedRegionalCost);

            globalCost += regionalCost;
            globalDiscountedCost += discountedRegionalCost;
        }
        return new PolicySummary(regionalCurves, costs, discounted, globalCost, globalDiscountedCost);
    }

    /**
     * Area under the marginal cost curve over every observed reduction; the
     * baseline trial pins zero reduction inside that range.
     */
    static double periodCost(Curve abatementCurve) {
        return abatementCurve.getIntegral(abatementCurve.getMinX(), abatementCurve.getMaxX());
    }

    public double getDiscountRate() {
        return discountRate;
    }

    public int getStartYear() {
        return startYear;
    }
}
