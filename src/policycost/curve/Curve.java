package policycost.curve;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Piecewise-linear function over a set of 2-D points.
 * <p>
 * Points are stored sorted by x. When two points share the same x the first one
 * added is used for evaluation. Outside the point domain values are extrapolated from the nearest
 * segment, integrals are clipped to the domain.
 */
public final class Curve {

    /** No numerical label attached. */
    public static final int NO_LABEL = Integer.MIN_VALUE;

    private static final int GAUSS_POINTS = 5;
    private static final double RELATIVE_ACCURACY = 1e-12;
    private static final double ABSOLUTE_ACCURACY = 1e-12;
    private static final int MAX_EVAL = 100_000;

    private final String title;
    private final int numericalLabel;

    // every point added, stable-sorted by x
    private final List<XYPoint> points;

    // unique x used for evaluation
    private final double[] xs;
    private final double[] ys;

    // null when fewer than two points
    private final PolynomialSplineFunction spline;

    public Curve(Collection<XYPoint> points) {
        this("", NO_LABEL, points);
    }

    public Curve(String title, Collection<XYPoint> points) {
        this(title, NO_LABEL, points);
    }

    public Curve(String title, int numericalLabel, Collection<XYPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Curve needs at least one point");
        }
        this.title = title == null ? "" : title;
        this.numericalLabel = numericalLabel;

        // stable sort keeps insertion order among equal x
        List<XYPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(XYPoint::x));
        this.points = Collections.unmodifiableList(sorted);

        double[] x = new double[sorted.size()];
        double[] y = new double[sorted.size()];
        int n = 0;
        for (XYPoint p : sorted) {
            if (Double.isNaN(p.x())) {
                throw new IllegalArgumentException("Curve point with NaN x: " + p);
            }
            if (n > 0 && x[n - 1] == p.x()) continue;
            x[n] = p.x();
            y[n] = p.y();
            n++;
        }
        this.xs = Arrays.copyOf(x, n);
        this.ys = Arrays.copyOf(y, n);
        this.spline = n >= 2 ? new LinearInterpolator().interpolate(xs, ys) : null;
    }

    public String getTitle() {
        return title;
    }

    public int getNumericalLabel() {
        return numericalLabel;
    }

    public boolean hasNumericalLabel() {
        return numericalLabel != NO_LABEL;
    }

    /** Number of points added, duplicates included. */
    public int size() {
        return points.size();
    }

    public double getMinX() {
        return xs[0];
    }

    public double getMaxX() {
        return xs[xs.length - 1];
    }

    /** Points in ascending x order, duplicates included. */
    public List<XYPoint> getPoints() {
        return points;
    }

    public double getY(double x) {
        int idx = Arrays.binarySearch(xs, x);
        if (idx >= 0) return ys[idx];
        if (spline == null) return ys[0];

        int last = xs.length - 1;
        if (x < xs[0]) return extrapolate(0, 1, x);
        if (x > xs[last]) return extrapolate(last - 1, last, x);
        return spline.value(x);
    }

    /**
     * Area under the curve between lo and hi, bounds clipped to the point domain.
     * Passing +/-Double.MAX_VALUE integrates over the whole observed range.
     */
    public double getIntegral(double lo, double hi) {
        if (hi < lo) return -getIntegral(hi, lo);
        if (spline == null) return 0.0;

        double a = Math.max(lo, getMinX());
        double b = Math.min(hi, getMaxX());
        if (a >= b) return 0.0;

        double sum = 0.0;
        for (int i = 0; i < xs.length - 1; i++) {
            double s = Math.max(a, xs[i]);
            double e = Math.min(b, xs[i + 1]);
            if (s >= e) continue;
            sum += 0.5 * (getY(s) + getY(e)) * (e - s);
        }
        return sum;
    }

    /**
     * Present value of the curve over [lo, hi] discounted continuously to lo:
     * integral of y(t) * (1 + rate)^-(t - lo). Bounds are clipped like
     * {@link #getIntegral(double, double)}.
     */
    public double getDiscountedValue(double lo, double hi, double rate) {
        if (hi < lo) {
            throw new IllegalArgumentException("hi < lo: " + hi + " < " + lo);
        }
        if (rate == 0.0) return getIntegral(lo, hi);
        if (spline == null) return 0.0;

        double a = Math.max(lo, getMinX());
        double b = Math.min(hi, getMaxX());
        if (a >= b) return 0.0;

        final double growth = 1.0 + rate;
        UnivariateFunction discounted = t -> getY(t) * Math.pow(growth, -(t - lo));

        // integrand is smooth within each linear piece
        double sum = 0.0;
        for (int i = 0; i < xs.length - 1; i++) {
            double s = Math.max(a, xs[i]);
            double e = Math.min(b, xs[i + 1]);
            if (s >= e) continue;
            UnivariateIntegrator integrator = new IterativeLegendreGaussIntegrator(
                    GAUSS_POINTS, RELATIVE_ACCURACY, ABSOLUTE_ACCURACY);
            sum += integrator.integrate(MAX_EVAL, discounted, s, e);
        }
        return sum;
    }

    private double extrapolate(int i0, int i1, double x) {
        double slope = (ys[i1] - ys[i0]) / (xs[i1] - xs[i0]);
        return ys[i0] + slope * (x - xs[i0]);
    }

    @Override
    public String toString() {
        return "Curve[" + title + ", points=" + getPoints() + "]";
    }
}
