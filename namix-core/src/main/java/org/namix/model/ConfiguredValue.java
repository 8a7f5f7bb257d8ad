package org.namix.model;

import java.util.Objects;

/**
 * A configured name together with the source that set it.
 * The value itself may be {@code null} (e.g. "not mapped to a table").
 */
public record ConfiguredValue(String value, ConfigurationSource source) {
    public ConfiguredValue {
        Objects.requireNonNull(source, "source must not be null");
    }

    public boolean isConventional() {
        return source == ConfigurationSource.CONVENTION;
    }

    public boolean isExplicit() {
        return source == ConfigurationSource.EXPLICIT;
    }

    /**
     * Applies a new value if {@code newSource} overrides the current source.
     *
     * @return the configured value to keep, which is {@code current} when the change was refused
     */
    static ConfiguredValue merge(ConfiguredValue current, String newValue, ConfigurationSource newSource) {
        if (current != null && !newSource.overrides(current.source())) {
            return current;
        }
        return new ConfiguredValue(newValue, newSource);
    }

    static boolean canRemove(ConfiguredValue current, ConfigurationSource source) {
        return current == null || source.overrides(current.source());
    }
}
