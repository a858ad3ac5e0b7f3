package io.tributary.distributor.layout;

import io.tributary.distributor.model.RegionalLoad;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Places loads side by side on the transverse axis.
 */
public final class LoadLayout {

    private LoadLayout() {
    }

    /**
     * Lays the definitions out from {@code origin} in order, each load starting where the previous one ends.
     */
    public static List<RegionalLoad> stack(double origin, List<LoadDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        if (!Double.isFinite(origin)) {
            throw new IllegalArgumentException("origin must be a finite number but was " + origin);
        }
        List<RegionalLoad> loads = new ArrayList<>(definitions.size());
        double cursor = origin;
        for (LoadDefinition definition : definitions) {
            double end = cursor + definition.width();
            loads.add(new RegionalLoad(definition.name(), definition.intensity(), cursor, end,
                    definition.length(), definition.color()));
            cursor = end;
        }
        return List.copyOf(loads);
    }
}
