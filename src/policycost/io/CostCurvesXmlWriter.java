package policycost.io;

import policycost.curve.Curve;
import policycost.curve.RegionCurves;
import policycost.curve.XYPoint;
import policycost.engine.PeriodCostCurves;
import policycost.engine.PolicyCostResults;
import policycost.engine.PolicySummary;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the CostCurvesInfo document: period abatement curves, regional cost
 * curves, regional costs and the global totals.
 */
public final class CostCurvesXmlWriter {

    private static final Locale LOCALE = Locale.ROOT;
    private static final String TAB = "\t";

    private CostCurvesXmlWriter() {}

    public static void write(Path path, PolicyCostResults results) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            w.write(toXmlString(results));
        }
    }

    public static String toXmlString(PolicyCostResults results) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<CostCurvesInfo scenario=\"").append(escape(results.scenarioName())).append("\">\n");

        PeriodCostCurves periods = results.periodCostCurves();
        open(sb, 1, "PeriodCostCurves");
        for (int per = 0; per < periods.periodCount(); per++) {
            indent(sb, 2).append("<CostCurves year=\"").append(periods.getYear(per)).append("\">\n");
            writeCurves(sb, 3, periods.get(per));
            close(sb, 2, "CostCurves");
        }
        close(sb, 1, "PeriodCostCurves");

        PolicySummary summary = results.summary();
        open(sb, 1, "RegionalCostCurvesByPeriod");
        writeCurves(sb, 2, summary.getRegionalCostCurves());
        close(sb, 1, "RegionalCostCurvesByPeriod");

        open(sb, 1, "RegionalUndiscountedCosts");
        for (Map.Entry<String, Double> e : summary.getRegionalCosts().entrySet()) {
            element(sb, 2, "UndiscountedCost", e.getKey(), e.getValue());
        }
        close(sb, 1, "RegionalUndiscountedCosts");

        open(sb, 1, "RegionalDiscountedCosts");
        for (Map.Entry<String, Double> e : summary.getRegionalDiscountedCosts().entrySet()) {
            element(sb, 2, "DiscountedCost", e.getKey(), e.getValue());
        }
        close(sb, 1, "RegionalDiscountedCosts");

        element(sb, 1, "GlobalUndiscountedTotalCost", null, summary.getGlobalCost());
        element(sb, 1, "GlobalDiscountedCost", null, summary.getGlobalDiscountedCost());

        sb.append("</CostCurvesInfo>\n");
        return sb.toString();
    }

    private static void writeCurves(StringBuilder sb, int depth, RegionCurves curves) {
        for (Curve c : curves.asMap().values()) {
            indent(sb, depth).append("<Curve name=\"").append(escape(c.getTitle())).append('"');
            if (c.hasNumericalLabel()) {
                sb.append(" label=\"").append(c.getNumericalLabel()).append('"');
            }
            sb.append(">\n");
            for (XYPoint p : c.getPoints()) {
                indent(sb, depth + 1).append("<DataPoint><x>").append(num(p.x()))
                        .append("</x><y>").append(num(p.y())).append("</y></DataPoint>\n");
            }
            close(sb, depth, "Curve");
        }
    }

    private static void element(StringBuilder sb, int depth, String tag, String name, double value) {
        indent(sb, depth).append('<').append(tag);
        if (name != null) {
            sb.append(" name=\"").append(escape(name)).append('"');
        }
        sb.append('>').append(num(value)).append("</").append(tag).append(">\n");
    }

    private static void open(StringBuilder sb, int depth, String tag) {
        indent(sb, depth).append('<').append(tag).append(">\n");
    }

    private static void close(StringBuilder sb, int depth, String tag) {
        indent(sb, depth).append("</").append(tag).append(">\n");
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append(TAB);
        return sb;
    }

    private static String num(double v) {
        return String.format(LOCALE, "%.6f", v);
    }

    static String escape(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
