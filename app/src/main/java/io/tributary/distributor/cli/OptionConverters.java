package io.tributary.distributor.cli;

import io.tributary.distributor.config.LogFormat;
import io.tributary.distributor.layout.LoadDefinition;
import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import picocli.CommandLine;

/**
 * Picocli converters for the colon-separated geometry options, e.g. {@code --load F:-0.72:0:0.2}.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static class LoadConverter implements CommandLine.ITypeConverter<RegionalLoad> {

        static final String FORMAT = "NAME:INTENSITY:START:END[:LENGTH[:COLOR]]";

        @Override
        public RegionalLoad convert(String value) {
            Fields fields = Fields.parse(value, 4, 6, FORMAT);
            return new RegionalLoad(fields.text(0),
                    fields.number(1, "intensity"),
                    fields.number(2, "start"),
                    fields.number(3, "end"),
                    fields.numberOr(4, "length", 0.0),
                    fields.textOr(5, null));
        }
    }

    public static class StackedLoadConverter implements CommandLine.ITypeConverter<LoadDefinition> {

        static final String FORMAT = "NAME:INTENSITY:WIDTH[:LENGTH[:COLOR]]";

        @Override
        public LoadDefinition convert(String value) {
            Fields fields = Fields.parse(value, 3, 5, FORMAT);
            return new LoadDefinition(fields.text(0),
                    fields.number(1, "intensity"),
                    fields.number(2, "width"),
                    fields.numberOr(3, "length", 0.0),
                    fields.textOr(4, null));
        }
    }

    public static class BeamConverter implements CommandLine.ITypeConverter<Beam> {

        static final String FORMAT = "NAME:POSITION[:LENGTH]";

        @Override
        public Beam convert(String value) {
            Fields fields = Fields.parse(value, 2, 3, FORMAT);
            return new Beam(fields.text(0),
                    fields.number(1, "position"),
                    fields.numberOr(2, "length", 0.0));
        }
    }

    public static class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }

    private static final class Fields {

        private final String raw;
        private final String[] values;

        private Fields(String raw, String[] values) {
            this.raw = raw;
            this.values = values;
        }

        static Fields parse(String raw, int required, int max, String format) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Expected " + format + " but value was empty");
            }
            String[] values = raw.trim().split(":", -1);
            if (values.length < required || values.length > max) {
                throw new IllegalArgumentException("Expected " + format + " but got '" + raw + "'");
            }
            return new Fields(raw, values);
        }

        String text(int index) {
            return values[index].trim();
        }

        double number(int index, String field) {
            try {
                return Double.parseDouble(values[index].trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + field + " '" + values[index] + "' in '" + raw + "'", ex);
            }
        }

        double numberOr(int index, String field, double fallback) {
            return has(index) ? number(index, field) : fallback;
        }

        String textOr(int index, String fallback) {
            return has(index) ? text(index) : fallback;
        }

        private boolean has(int index) {
            return index < values.length && !values[index].isBlank();
        }
    }
}
