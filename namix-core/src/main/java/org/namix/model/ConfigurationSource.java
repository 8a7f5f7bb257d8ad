package org.namix.model;

/**
 * Provenance of a configured name.
 *
 * <p>{@link #EXPLICIT} values were fixed by the user and win over everything.
 * {@link #CONVENTION} values were produced by a convention and may be replaced or
 * removed by any later convention.
 */
public enum ConfigurationSource {
    CONVENTION,
    EXPLICIT;

    /**
     * Whether a value configured from this source may replace one configured from {@code other}.
     * An absent value ({@code null}) can always be replaced.
     */
    public boolean overrides(ConfigurationSource other) {
        if (other == null || this == EXPLICIT) {
            return true;
        }
        return other == CONVENTION;
    }
}
