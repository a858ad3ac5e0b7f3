package io.tributary.distributor.model;

/**
 * Linear support placed at {@code position} on the transverse axis.
 */
public record Beam(String name, double position, double length) {

    public Beam {
        name = RegionalLoad.requireNonBlank(name, "name");
        RegionalLoad.requireFinite(position, "position");
        RegionalLoad.requireFinite(length, "length");
        if (length < 0) {
            throw new IllegalArgumentException("Beam " + name + " must have a non-negative length");
        }
    }
}
