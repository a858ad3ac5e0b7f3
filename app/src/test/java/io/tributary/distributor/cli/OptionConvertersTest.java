package io.tributary.distributor.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.tributary.distributor.cli.OptionConverters.BeamConverter;
import io.tributary.distributor.cli.OptionConverters.LoadConverter;
import io.tributary.distributor.cli.OptionConverters.StackedLoadConverter;
import io.tributary.distributor.layout.LoadDefinition;
import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import org.junit.jupiter.api.Test;

class OptionConvertersTest {

    @Test
    void parsesLoadWithAllFields() {
        RegionalLoad load = new LoadConverter().convert("F_0_L:-0.72:0:0.2:2.5:red");

        assertThat(load).isEqualTo(new RegionalLoad("F_0_L", -0.72, 0.0, 0.2, 2.5, "red"));
    }

    @Test
    void optionalLoadFieldsFallBackToDefaults() {
        RegionalLoad load = new LoadConverter().convert("G:1:0.2:1");

        assertThat(load.length()).isZero();
        assertThat(load.color()).isEqualTo(RegionalLoad.DEFAULT_COLOR);
    }

    @Test
    void parsesStackedLoadAndBeam() {
        LoadDefinition definition = new StackedLoadConverter().convert("G_0_L:-0.72:0.8:2.5");
        Beam beam = new BeamConverter().convert("P_L1_S0:1.0:2.5");

        assertThat(definition.width()).isEqualTo(0.8);
        assertThat(definition.length()).isEqualTo(2.5);
        assertThat(beam).isEqualTo(new Beam("P_L1_S0", 1.0, 2.5));
    }

    @Test
    void rejectsWrongFieldCount() {
        Throwable thrown = catchThrowable(() -> new BeamConverter().convert("P:1:2:3"));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(BeamConverter.FORMAT);
    }

    @Test
    void rejectsInvalidGeometry() {
        assertThat(catchThrowable(() -> new LoadConverter().convert("F:1:1:0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative width");
        assertThat(catchThrowable(() -> new StackedLoadConverter().convert("F:1:wide")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width");
    }
}
