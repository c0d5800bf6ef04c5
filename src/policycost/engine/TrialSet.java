package policycost.engine;

import policycost.curve.RegionCurves;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Emissions quantity and price curves of trials 0..N.
 * Trial N is the baseline run, trial 0 the zero-tax run.
 */
public final class TrialSet {

    private final int numPoints;
    private final RegionCurves[] quantityCurves;
    private final RegionCurves[] priceCurves;
    private final boolean[] converged;

    public TrialSet(int numPoints) {
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got " + numPoints);
        }
        this.numPoints = numPoints;
        this.quantityCurves = new RegionCurves[numPoints + 1];
        this.priceCurves = new RegionCurves[numPoints + 1];
        this.converged = new boolean[numPoints + 1];
    }

    void record(int trial, RegionCurves quantity, RegionCurves price, boolean success) {
        quantityCurves[trial] = quantity;
        priceCurves[trial] = price;
        converged[trial] = success;
    }

    /** N, the number of intermediate trials. */
    public int getNumPoints() {
        return numPoints;
    }

    /** N + 1. */
    public int size() {
        return numPoints + 1;
    }

    public boolean isRecorded(int trial) {
        return quantityCurves[trial] != null && priceCurves[trial] != null;
    }

    public RegionCurves getQuantityCurves(int trial) {
        return require(quantityCurves, trial, "quantity");
    }

    public RegionCurves getPriceCurves(int trial) {
        return require(priceCurves, trial, "price");
    }

    public RegionCurves getBaselineQuantityCurves() {
        return getQuantityCurves(numPoints);
    }

    public RegionCurves getBaselinePriceCurves() {
        return getPriceCurves(numPoints);
    }

    public boolean isConverged(int trial) {
        return converged[trial];
    }

    public List<Integer> failedTrials() {
        List<Integer> out = new ArrayList<>();
        for (int k = 0; k < converged.length; k++) {
            if (isRecorded(k) && !converged[k]) out.add(k);
        }
        return out;
    }

    /**
     * Every trial must report the same regions for quantity and price.
     *
     * @throws IllegalStateException on a missing trial or a region mismatch
     */
    public void checkRegionConsistency() {
        Set<String> expected = getBaselineQuantityCurves().regions();
        for (int k = 0; k < size(); k++) {
            Set<String> q = getQuantityCurves(k).regions();
            Set<String> p = getPriceCurves(k).regions();
            if (!expected.equals(q) || !expected.equals(p)) {
                throw new IllegalStateException("Trial " + k + " regions differ from baseline " + expected
                        + ": quantity=" + q + ", price=" + p);
            }
        }
    }

    private static RegionCurves require(RegionCurves[] arr, int trial, String what) {
        RegionCurves c = arr[trial];
        if (c == null) {
            throw new IllegalStateException("Trial " + trial + " has no " + what + " curves");
        }
        return c;
    }
}
