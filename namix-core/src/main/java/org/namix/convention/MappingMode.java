package org.namix.convention;

import jakarta.persistence.InheritanceType;

/**
 * How an entity type is currently mapped to store objects.
 * Computed by {@link MappingModeClassifier}; never stored.
 */
public enum MappingMode {
    /** Root of its own table with no derived types. */
    STANDALONE_TABLE,
    TPH_ROOT,
    TPH_DERIVED,
    TPT_ROOT,
    TPT_DERIVED,
    /** Owned through a reference navigation, living in the owner's table. */
    OWNED_SPLIT_TABLE,
    /** Owned through a collection navigation or with a table of its own. */
    OWNED_SEPARATE_TABLE,
    MAPPED_TO_VIEW,
    MAPPED_TO_FUNCTION,
    MAPPED_TO_SQL_QUERY;

    public boolean isTablePerType() {
        return this == TPT_ROOT || this == TPT_DERIVED;
    }

    public boolean isTablePerHierarchy() {
        return this == TPH_ROOT || this == TPH_DERIVED;
    }

    public boolean isOwned() {
        return this == OWNED_SPLIT_TABLE || this == OWNED_SEPARATE_TABLE;
    }

    public boolean isMappedToAlternativeStoreObject() {
        return this == MAPPED_TO_VIEW || this == MAPPED_TO_FUNCTION || this == MAPPED_TO_SQL_QUERY;
    }

    /**
     * Whether the entity owns a table name of its own by convention.
     */
    public boolean ownsTableName() {
        return switch (this) {
            case STANDALONE_TABLE, TPH_ROOT, TPT_ROOT, TPT_DERIVED, OWNED_SEPARATE_TABLE -> true;
            case TPH_DERIVED, OWNED_SPLIT_TABLE, MAPPED_TO_VIEW, MAPPED_TO_FUNCTION, MAPPED_TO_SQL_QUERY -> false;
        };
    }

    /**
     * The JPA inheritance strategy matching this mode, {@code null} outside of a hierarchy.
     */
    public InheritanceType inheritanceType() {
        return switch (this) {
            case TPH_ROOT, TPH_DERIVED -> InheritanceType.SINGLE_TABLE;
            case TPT_ROOT, TPT_DERIVED -> InheritanceType.JOINED;
            default -> null;
        };
    }
}
