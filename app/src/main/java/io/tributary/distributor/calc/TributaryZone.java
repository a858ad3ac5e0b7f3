package io.tributary.distributor.calc;

import io.tributary.distributor.model.Beam;
import java.util.Objects;

/**
 * Part of the transverse axis a beam is responsible for.
 */
public record TributaryZone(Beam beam, double lower, double upper) {

    public TributaryZone {
        Objects.requireNonNull(beam, "beam");
        if (upper < lower) {
            throw new IllegalArgumentException("Invalid tributary zone for " + beam.name() + ": " + lower + " > " + upper);
        }
    }

    public double width() {
        return upper - lower;
    }
}
