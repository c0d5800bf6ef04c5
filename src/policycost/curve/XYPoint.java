package policycost.curve;

/**
 * Single (x, y) sample of a curve.
 */
public record XYPoint(double x, double y) {}
