package policycost.scenario;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Activity level that drives a region's emissions.
 * <p>
 * The variant is fixed when the driver is parsed from its configuration tag:
 * an input driver reads the physical demand of one named input, an output
 * driver reads the region's output.
 */
public final class EmissionsDriver {

    private static final Logger log = LoggerFactory.getLogger(EmissionsDriver.class);

    public enum Kind {
        INPUT_DRIVER("input-driver"),
        OUTPUT_DRIVER("output-driver");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }

        public static Kind fromTag(String tag) {
            for (Kind k : values()) {
                if (k.tag.equals(tag)) return k;
            }
            throw new IllegalArgumentException("Unknown emissions driver: " + tag);
        }
    }

    public static final String INPUT_NAME = "input-name";

    private final Kind kind;
    private final String inputName; // INPUT_DRIVER only

    private EmissionsDriver(Kind kind, String inputName) {
        this.kind = kind;
        this.inputName = inputName;
    }

    public static EmissionsDriver inputDriver(String inputName) {
        if (inputName == null || inputName.isBlank()) {
            throw new IllegalArgumentException("input-driver requires " + INPUT_NAME);
        }
        return new EmissionsDriver(Kind.INPUT_DRIVER, inputName);
    }

    public static EmissionsDriver outputDriver() {
        return new EmissionsDriver(Kind.OUTPUT_DRIVER, null);
    }

    /**
     * Parses a driver from its tag and child elements. Unrecognized children
     * are reported and ignored.
     */
    public static EmissionsDriver parse(String tag, Map<String, String> children) {
        Kind kind = Kind.fromTag(tag);
        String name = null;
        for (Map.Entry<String, String> e : children.entrySet()) {
            if (kind == Kind.INPUT_DRIVER && INPUT_NAME.equals(e.getKey())) {
                name = e.getValue();
            } else {
                log.warn("Unrecognized element {} found while parsing {}", e.getKey(), tag);
            }
        }
        return kind == Kind.INPUT_DRIVER ? inputDriver(name) : outputDriver();
    }

    /**
     * @param inputs  physical demand per period, by input name
     * @param outputs output per period
     */
    public double calcEmissionsDriver(Map<String, double[]> inputs, double[] outputs, int period) {
        return switch (kind) {
            case INPUT_DRIVER -> {
                double[] demand = inputs.get(inputName);
                yield demand != null ? demand[period] : 0.0;
            }
            case OUTPUT_DRIVER -> outputs[period];
        };
    }

    public Kind getKind() {
        return kind;
    }

    public String getInputName() {
        return inputName;
    }

    public String getXMLName() {
        return kind.tag();
    }

    @Override
    public String toString() {
        return kind == Kind.INPUT_DRIVER ? kind.tag() + "[" + inputName + "]" : kind.tag();
    }
}
