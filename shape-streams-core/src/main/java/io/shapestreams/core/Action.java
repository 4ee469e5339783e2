package io.shapestreams.core;

import java.util.Locale;

/**
 * Kind of row change carried by a {@link ChangeEvent}.
 */
public enum Action {
    INSERT,
    UPDATE,
    DELETE;

    /** Lower-case wire name ({@code insert}, {@code update}, {@code delete}). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
