package policycost.io;

import policycost.config.PolicyCostConstants;
import policycost.engine.PolicyCostResults;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class PolicyCostCsvWriter {

    private static final Locale LOCALE = Locale.ROOT;

    private PolicyCostCsvWriter() {}

    public static void write(Path path, PolicyCostResults results) throws IOException {
        int[] years = PolicyCostTable.years(results.modelTime());

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            StringBuilder h = new StringBuilder("region;variable;axis;units");
            for (int year : years) {
                h.append(';').append(year);
            }
            w.write(h.toString());
            w.newLine();

            for (PolicyCostTable.Row row : PolicyCostTable.rows(results)) {
                StringBuilder sb = new StringBuilder(128);
                sb.append(row.region()).append(';')
                        .append(row.variable()).append(';')
                        .append(row.yearLabel()).append(';')
                        .append(PolicyCostConstants.COST_UNITS);
                for (double v : row.values()) {
                    sb.append(';').append(fmt3(v));
                }
                w.write(sb.toString());
                w.newLine();
            }
        }
    }

    private static String fmt3(double v) { return String.format(LOCALE, "%.3f", v); }
}
