package policycost;

import policycost.config.CostCurveConfig;
import policycost.engine.PolicyCostCalculator;
import policycost.io.CostCurveConfigLoader;
import policycost.io.CostCurvesXmlWriter;
import policycost.io.PolicyCostCsvWriter;
import policycost.io.PolicyCostExcelWriter;
import policycost.scenario.StylizedScenario;

import java.nio.file.Path;
import java.util.List;

/**
 * Usage: Main [config.properties] [outputDir] [POLICY|REFERENCE]
 */
public class Main {

    public enum RunMode {POLICY, REFERENCE}

    public static final String DEFAULT_CONFIG_RESOURCE = "costcurves.properties";

    public static void main(String[] args) {

        Path outDir = Path.of(args.length > 1 ? args[1] : ".");
        RunMode mode = args.length > 2 ? RunMode.valueOf(args[2]) : RunMode.POLICY;

        try {
            // 1) config
            CostCurveConfigLoader loader = new CostCurveConfigLoader();
            CostCurveConfig cfg = args.length > 0 && !args[0].isEmpty()
                    ? loader.load(Path.of(args[0]))
                    : loader.loadResource(DEFAULT_CONFIG_RESOURCE);

            // 2) baseline run, with or without the tax
            StylizedScenario scenario = ScenarioFactory.defaultScenario(cfg.getAbatedGas());
            if (mode == RunMode.POLICY) {
                ScenarioFactory.applyBaselinePolicy(scenario, cfg.getAbatedGas(),
                        List.of("USA", "EUR", "CHN", "IND"));
            }
            if (!scenario.run(true, "")) {
                System.err.println("Baseline run did not converge");
            }

            // 3) cost curves
            PolicyCostCalculator calculator = new PolicyCostCalculator(scenario, cfg);
            boolean allSolved = calculator.calculateAbatementCostCurve();
            if (!allSolved) {
                System.err.println("Some cost curve trials did not converge");
            }

            // 4) output
            Path xml = outDir.resolve(cfg.outputFileNameFor(scenario.getName()));
            Path csv = outDir.resolve("policy_costs_" + scenario.getName() + ".csv");
            Path xlsx = outDir.resolve("policy_costs_" + scenario.getName() + ".xlsx");

            calculator.printOutput(
                    r -> CostCurvesXmlWriter.write(xml, r),
                    r -> PolicyCostCsvWriter.write(csv, r),
                    r -> PolicyCostExcelWriter.writeXlsx(xlsx, r)
            );

            if (calculator.hasRun()) {
                System.out.println("Saved: " + xml);
                System.out.println("Saved: " + csv);
                System.out.println("Saved: " + xlsx);
                System.out.printf("Global cost: %.3f, discounted: %.3f%n",
                        calculator.getSummary().getGlobalCost(),
                        calculator.getSummary().getGlobalDiscountedCost());
            } else {
                System.out.println("No policy market, nothing written.");
            }

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
