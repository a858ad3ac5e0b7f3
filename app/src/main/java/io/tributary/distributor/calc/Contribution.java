package io.tributary.distributor.calc;

import java.util.Objects;

/**
 * Share of one load a beam receives over {@code [start, end)}.
 *
 * @param value intensity times effective width, a line load along the beam
 */
public record Contribution(String loadName, double start, double end, double effectiveWidth, double value) {

    public Contribution {
        Objects.requireNonNull(loadName, "loadName");
    }
}
