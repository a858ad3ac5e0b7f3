package io.tributary.distributor.layout;

import java.util.Objects;

/**
 * Load described by its width only, before it is placed on the transverse axis.
 */
public record LoadDefinition(String name, double intensity, double width, double length, String color) {

    public LoadDefinition {
        Objects.requireNonNull(name, "name");
        if (!Double.isFinite(width) || width < 0) {
            throw new IllegalArgumentException("Load " + name + " must have a finite, non-negative width");
        }
    }

    public LoadDefinition(String name, double intensity, double width, double length) {
        this(name, intensity, width, length, null);
    }
}
