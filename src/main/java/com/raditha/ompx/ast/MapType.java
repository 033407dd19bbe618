package com.raditha.ompx.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * Map-type modifier of a {@code map} clause, in the order of its numeric discriminant.
 */
public enum MapType {
    ALLOC,
    TO,
    FROM,
    TOFROM,
    DELETE,
    RELEASE;

    public int discriminant() {
        return ordinal();
    }

    public static Optional<MapType> fromDiscriminant(int discriminant) {
        MapType[] types = values();
        if (discriminant < 0 || discriminant >= types.length) {
            return Optional.empty();
        }
        return Optional.of(types[discriminant]);
    }

    public static Optional<MapType> fromName(String name) {
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
