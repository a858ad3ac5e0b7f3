package io.tributary.distributor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.tributary.distributor.cli.CliArguments;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--tolerance", "1e-6",
                "--decimals", "5",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.tolerance().epsilon()).isEqualTo(1e-6);
        assertThat(config.reportSettings().decimals()).isEqualTo(5);
        assertThat(config.reportSettings().forceUnit()).isEqualTo("kN");
        assertThat(config.reportSettings().lengthUnit()).isEqualTo("m");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_TOLERANCE, " 1e-4 ");
        envValues.put(ConfigLoader.ENV_REPORT_DECIMALS, "2");
        envValues.put(ConfigLoader.ENV_REPORT_FORCE_UNIT, "kip");
        envValues.put(ConfigLoader.ENV_REPORT_LENGTH_UNIT, "ft");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.tolerance().epsilon()).isEqualTo(1e-4);
        assertThat(config.reportSettings().decimals()).isEqualTo(2);
        assertThat(config.reportSettings().lineLoadUnit()).isEqualTo("kip/ft");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_TOLERANCE, ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TOLERANCE, "1e-4",
                ConfigLoader.ENV_REPORT_DECIMALS, "2"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--decimals", "6");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.reportSettings().decimals()).isEqualTo(6);
        assertThat(config.tolerance().epsilon()).isEqualTo(1e-4);
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_REPORT_DECIMALS);
    }

    @Test
    void usesDefaultsWithoutInput() {
        Config config = new ConfigLoader(key -> Optional.empty()).load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config).isEqualTo(Config.defaults());
    }

    @Test
    void invalidToleranceIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TOLERANCE, "tiny"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_TOLERANCE);
    }

    @Test
    void nonPositiveToleranceIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--tolerance", "0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tolerance");
    }

    @Test
    void invalidDecimalsAreRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_REPORT_DECIMALS, "three"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be an integer");
    }

    @Test
    void unknownLogFormatIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LOG_FORMAT, "xml"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported log format");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
