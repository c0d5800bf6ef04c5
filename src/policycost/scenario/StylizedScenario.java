package policycost.scenario;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import policycost.config.PolicyCostConstants;
import policycost.curve.Curve;
import policycost.curve.RegionCurves;
import policycost.curve.XYPoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed-form stand-in for the equilibrium model.
 * <p>
 * Every region responds to its own tax independently, so a run has no
 * inter-period state and always solves all periods. Alongside the regions the
 * scenario reports a {@value PolicyCostConstants#GLOBAL_REGION} aggregate.
 */
public class StylizedScenario implements ScenarioModel {

    private static final Logger log = LoggerFactory.getLogger(StylizedScenario.class);

    private final String name;
    private final ModelTime modelTime;
    private final String gasName;
    private final Map<String, RegionEconomy> regions = new LinkedHashMap<>();
    private final Map<String, GhgPolicy> policies = new HashMap<>();

    // [region][period], filled by run()
    private Map<String, double[]> emissions;
    private Map<String, double[]> taxes;

    private int runCount;
    private String lastOutputTag;

    public StylizedScenario(String name,
                            ModelTime modelTime,
                            String gasName,
                            Collection<RegionEconomy> regionEconomies) {
        this.name = name;
        this.modelTime = modelTime;
        this.gasName = gasName;
        for (RegionEconomy r : regionEconomies) {
            if (PolicyCostConstants.GLOBAL_REGION.equals(r.getName())) {
                throw new IllegalArgumentException("Region name is reserved: " + r.getName());
            }
            if (r.periodCount() != modelTime.getMaxPeriod()) {
                throw new IllegalArgumentException("Region " + r.getName() + " has " + r.periodCount()
                        + " periods, model has " + modelTime.getMaxPeriod());
            }
            regions.put(r.getName(), r);
        }
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("Scenario " + name + " has no regions");
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ModelTime getModelTime() {
        return modelTime;
    }

    @Override
    public double getMarketPrice(String gas, String region, int period) {
        if (!gasName.equals(gas)) return Marketplace.NO_MARKET_PRICE;
        GhgPolicy policy = policies.get(region);
        if (policy == null) return Marketplace.NO_MARKET_PRICE;
        return policy.getTax(period);
    }

    /**
     * A tax on the {@value PolicyCostConstants#GLOBAL_REGION} aggregate is
     * accepted and has no effect.
     */
    @Override
    public void setTax(GhgPolicy policy) {
        if (PolicyCostConstants.GLOBAL_REGION.equals(policy.getRegion())) {
            log.debug("Ignoring tax on aggregate region {}", policy.getRegion());
            return;
        }
        if (!gasName.equals(policy.getGasName())) {
            throw new IllegalArgumentException("Scenario models " + gasName + ", not " + policy.getGasName());
        }
        if (!regions.containsKey(policy.getRegion())) {
            throw new IllegalArgumentException("Unknown region: " + policy.getRegion());
        }
        if (policy.periodCount() != modelTime.getMaxPeriod()) {
            throw new IllegalArgumentException("Tax vector has " + policy.periodCount()
                    + " periods, model has " + modelTime.getMaxPeriod());
        }
        policies.put(policy.getRegion(), policy);
    }

    @Override
    public boolean run(boolean allPeriods, String outputTag) {
        int maxPeriod = modelTime.getMaxPeriod();
        Map<String, double[]> q = new LinkedHashMap<>();
        Map<String, double[]> t = new LinkedHashMap<>();
        boolean converged = true;

        for (RegionEconomy r : regions.values()) {
            GhgPolicy policy = policies.get(r.getName());
            double[] rq = new double[maxPeriod];
            double[] rt = new double[maxPeriod];
            for (int per = 0; per < maxPeriod; per++) {
                rt[per] = policy != null ? policy.getTax(per) : 0.0;
                rq[per] = r.emissions(per, rt[per]);
                if (!Double.isFinite(rq[per])) {
                    log.warn("Run '{}': region {} did not solve in period {}", outputTag, r.getName(), per);
                    converged = false;
                }
            }
            q.put(r.getName(), rq);
            t.put(r.getName(), rt);
        }

        this.emissions = q;
        this.taxes = t;
        this.runCount++;
        this.lastOutputTag = outputTag;
        log.debug("Scenario {} run '{}' done, converged={}", name, outputTag, converged);
        return converged;
    }

    @Override
    public RegionCurves getEmissionsQuantityCurves(String gas) {
        RegionCurves out = new RegionCurves();
        if (!gasName.equals(gas)) return out;
        requireRun();

        double[] total = new double[modelTime.getMaxPeriod()];
        for (Map.Entry<String, double[]> e : emissions.entrySet()) {
            double[] v = e.getValue();
            for (int per = 0; per < v.length; per++) {
                total[per] += v[per];
            }
            out.put(e.getKey(), yearCurve(e.getKey(), v));
        }
        out.put(PolicyCostConstants.GLOBAL_REGION, yearCurve(PolicyCostConstants.GLOBAL_REGION, total));
        return out;
    }

    @Override
    public RegionCurves getEmissionsPriceCurves(String gas) {
        RegionCurves out = new RegionCurves();
        if (!gasName.equals(gas)) return out;
        requireRun();

        int maxPeriod = modelTime.getMaxPeriod();
        double[] weighted = new double[maxPeriod];
        double[] plain = new double[maxPeriod];
        double[] totalQ = new double[maxPeriod];
        for (Map.Entry<String, double[]> e : taxes.entrySet()) {
            double[] tax = e.getValue();
            double[] q = emissions.get(e.getKey());
            for (int per = 0; per < maxPeriod; per++) {
                weighted[per] += tax[per] * q[per];
                plain[per] += tax[per];
                totalQ[per] += q[per];
            }
            out.put(e.getKey(), yearCurve(e.getKey(), tax));
        }

        // emissions-weighted mean tax
        double[] global = new double[maxPeriod];
        for (int per = 0; per < maxPeriod; per++) {
            global[per] = totalQ[per] > 0.0 ? weighted[per] / totalQ[per] : plain[per] / taxes.size();
        }
        out.put(PolicyCostConstants.GLOBAL_REGION, yearCurve(PolicyCostConstants.GLOBAL_REGION, global));
        return out;
    }

    public int getRunCount() {
        return runCount;
    }

    public String getLastOutputTag() {
        return lastOutputTag;
    }

    private Curve yearCurve(String region, double[] values) {
        List<XYPoint> pts = new ArrayList<>(values.length);
        for (int per = 0; per < values.length; per++) {
            pts.add(new XYPoint(modelTime.getPeriodToYear(per), values[per]));
        }
        return new Curve(region, pts);
    }

    private void requireRun() {
        if (emissions == null) {
            throw new IllegalStateException("Scenario " + name + " has not been run");
        }
    }
}
