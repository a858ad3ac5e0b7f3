package io.tributary.distributor.cli;

import io.tributary.distributor.cli.OptionConverters.BeamConverter;
import io.tributary.distributor.cli.OptionConverters.LoadConverter;
import io.tributary.distributor.cli.OptionConverters.LogFormatConverter;
import io.tributary.distributor.cli.OptionConverters.StackedLoadConverter;
import io.tributary.distributor.config.LogFormat;
import io.tributary.distributor.layout.LoadDefinition;
import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "tributary-load-distributor", mixinStandardHelpOptions = true,
        version = "tributary-load-distributor 1.0.0",
        description = "Distributes regional area loads onto parallel beams by tributary width")
public class CliArguments {

    @CommandLine.Option(names = "--load", converter = LoadConverter.class, paramLabel = LoadConverter.FORMAT,
            description = "Regional load placed on [START, END); repeatable")
    private List<RegionalLoad> loads = new ArrayList<>();

    @CommandLine.Option(names = "--stacked-load", converter = StackedLoadConverter.class, paramLabel = StackedLoadConverter.FORMAT,
            description = "Regional load stacked after the previous one, starting at --origin; repeatable")
    private List<LoadDefinition> stackedLoads = new ArrayList<>();

    @CommandLine.Option(names = "--origin", defaultValue = "0", paramLabel = "Y",
            description = "Start coordinate for stacked loads (default: ${DEFAULT-VALUE})")
    private double origin;

    @CommandLine.Option(names = "--beam", converter = BeamConverter.class, paramLabel = BeamConverter.FORMAT,
            description = "Beam at POSITION; repeatable")
    private List<Beam> beams = new ArrayList<>();

    @CommandLine.Option(names = "--edge-beams", split = ",", paramLabel = "FIRST,LAST",
            description = "Adds two beams on the outer edges of the loaded region")
    private List<String> edgeBeamNames = new ArrayList<>();

    @CommandLine.Option(names = "--beam-length", paramLabel = "LENGTH",
            description = "Length of edge beams (default: longest load length)")
    private Double beamLength;

    @CommandLine.Option(names = "--tolerance", paramLabel = "EPSILON", description = "Coordinate comparison tolerance")
    private Double tolerance;

    @CommandLine.Option(names = "--decimals", paramLabel = "COUNT", description = "Decimal places in the report")
    private Integer decimals;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every pipeline stage")
    private boolean verbose;

    public List<RegionalLoad> loads() {
        return loads;
    }

    public List<LoadDefinition> stackedLoads() {
        return stackedLoads;
    }

    public double origin() {
        return origin;
    }

    public List<Beam> beams() {
        return beams;
    }

    public List<String> edgeBeamNames() {
        return edgeBeamNames;
    }

    public Double beamLength() {
        return beamLength;
    }

    public Double tolerance() {
        return tolerance;
    }

    public Integer decimals() {
        return decimals;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    boolean hasGeometry() {
        return !loads.isEmpty() || !stackedLoads.isEmpty() || !beams.isEmpty() || !edgeBeamNames.isEmpty();
    }
}
