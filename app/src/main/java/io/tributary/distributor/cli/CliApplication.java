package io.tributary.distributor.cli;

import io.tributary.distributor.calc.BeamResult;
import io.tributary.distributor.calc.ConfigurationException;
import io.tributary.distributor.calc.DistributionResult;
import io.tributary.distributor.calc.LoadDistributionCalculator;
import io.tributary.distributor.config.Config;
import io.tributary.distributor.config.ConfigLoader;
import io.tributary.distributor.config.EnvironmentReader;
import io.tributary.distributor.layout.BeamLayout;
import io.tributary.distributor.layout.LoadDefinition;
import io.tributary.distributor.layout.LoadLayout;
import io.tributary.distributor.logging.LoggingConfigurator;
import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import io.tributary.distributor.report.ReportGenerator;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and distribution pass.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;
    static final String MDC_BEAM = "beam";
    static final String MDC_TOTAL = "total";
    static final String EXAMPLE_FIRST_BEAM = "P_L0_S0";
    static final String EXAMPLE_LAST_BEAM = "P_L1_S0";
    static final List<LoadDefinition> EXAMPLE_LOADS = List.of(
            new LoadDefinition("F_0_L", -0.72, 0.2, 2.5, "red"),
            new LoadDefinition("G_0_L", -0.72, 0.8, 2.5, "green"));

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), null, null);
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
        }
        if (err != null) {
            commandLine.setErr(err);
        }

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
            LOGGER.info("Distributing with tolerance={} decimals={}",
                    config.tolerance().epsilon(), config.reportSettings().decimals());

            List<RegionalLoad> loads = resolveLoads(cliArguments);
            List<Beam> beams = resolveBeams(cliArguments, loads);
            LOGGER.info("Distributing {} loads onto {} beams", loads.size(), beams.size());

            DistributionResult result = new LoadDistributionCalculator(config.tolerance()).calculate(loads, beams);
            for (BeamResult beamResult : result.beamResults()) {
                logBeamTotal(beamResult);
            }

            commandLine.getOut().print(new ReportGenerator(config.reportSettings()).render(result));
            commandLine.getOut().flush();
            return 0;
        } catch (ConfigurationException | IllegalArgumentException ex) {
            LOGGER.error("Load distribution failed: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
        }
    }

    private static void logBeamTotal(BeamResult beamResult) {
        try (MDC.MDCCloseable beam = MDC.putCloseable(MDC_BEAM, beamResult.beam().name());
             MDC.MDCCloseable total = MDC.putCloseable(MDC_TOTAL, Double.toString(beamResult.total()))) {
            LOGGER.info("Beam {} carries {} from {} contributions",
                    beamResult.beam().name(), beamResult.total(), beamResult.contributions().size());
        }
    }

    List<RegionalLoad> resolveLoads(CliArguments arguments) {
        if (!arguments.hasGeometry()) {
            LOGGER.info("No loads or beams given; running the built-in two-load example");
            return LoadLayout.stack(0.0, EXAMPLE_LOADS);
        }
        if (!arguments.loads().isEmpty() && !arguments.stackedLoads().isEmpty()) {
            throw new IllegalArgumentException("--load and --stacked-load cannot be combined");
        }
        if (!arguments.stackedLoads().isEmpty()) {
            return LoadLayout.stack(arguments.origin(), arguments.stackedLoads());
        }
        return List.copyOf(arguments.loads());
    }

    List<Beam> resolveBeams(CliArguments arguments, List<RegionalLoad> loads) {
        if (!arguments.hasGeometry()) {
            return BeamLayout.atLoadEdges(loads, EXAMPLE_FIRST_BEAM, EXAMPLE_LAST_BEAM, BeamLayout.spanOf(loads));
        }
        List<Beam> beams = new ArrayList<>(arguments.beams());
        List<String> edgeNames = arguments.edgeBeamNames();
        if (!edgeNames.isEmpty()) {
            if (edgeNames.size() != 2) {
                throw new IllegalArgumentException("--edge-beams expects exactly two names: FIRST,LAST");
            }
            double length = arguments.beamLength() != null ? arguments.beamLength() : BeamLayout.spanOf(loads);
            beams.addAll(BeamLayout.atLoadEdges(loads, edgeNames.get(0), edgeNames.get(1), length));
        }
        return beams;
    }
}
