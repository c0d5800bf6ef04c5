package policycost.engine;

import java.io.IOException;

/**
 * Destination of the cost curve results.
 */
public interface PolicyCostReport {

    void write(PolicyCostResults results) throws IOException;
}
