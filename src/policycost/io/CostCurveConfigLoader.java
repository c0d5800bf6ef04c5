package policycost.io;

import policycost.config.CostCurveConfig;
import policycost.config.CostCurveConfigBuilder;
import policycost.config.PolicyCostConstants;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Reads CostCurveConfig from a properties file. Missing keys keep their defaults.
 */
public class CostCurveConfigLoader {

    public CostCurveConfig load(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(r);
            return fromProperties(props);
        }
    }

    public CostCurveConfig loadResource(String resource) throws IOException {
        try (InputStream is = CostCurveConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resource);
            }
            try (Reader r = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                Properties props = new Properties();
                props.load(r);
                return fromProperties(props);
            }
        }
    }

    public CostCurveConfig fromProperties(Properties props) {
        CostCurveConfigBuilder b = new CostCurveConfigBuilder();

        String gas = trimmed(props, PolicyCostConstants.KEY_GAS);
        if (gas != null) b.setAbatedGas(gas);

        String numPoints = trimmed(props, PolicyCostConstants.KEY_NUM_POINTS);
        if (numPoints != null) {
            int n = parseInt(PolicyCostConstants.KEY_NUM_POINTS, numPoints);
            if (n < 1) {
                throw new IllegalArgumentException(PolicyCostConstants.KEY_NUM_POINTS + " must be >= 1, got " + n);
            }
            b.setNumPoints(n);
        }

        String rate = trimmed(props, PolicyCostConstants.KEY_DISCOUNT_RATE);
        if (rate != null) b.setDiscountRate(parseDouble(PolicyCostConstants.KEY_DISCOUNT_RATE, rate));

        String startYear = trimmed(props, PolicyCostConstants.KEY_DISCOUNT_START_YEAR);
        if (startYear != null) b.setDiscountStartYear(parseInt(PolicyCostConstants.KEY_DISCOUNT_START_YEAR, startYear));

        String region = trimmed(props, PolicyCostConstants.KEY_REFERENCE_REGION);
        if (region != null) b.setReferenceRegion(region);

        String out = trimmed(props, PolicyCostConstants.KEY_OUTPUT_FILE);
        if (out != null) b.setOutputFileName(out);

        return b.build();
    }

    private static String trimmed(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad integer for " + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.replace(",", "."));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad number for " + key + ": " + value, e);
        }
    }
}
