package org.namix.model;

/**
 * Store-object related annotations an entity type can carry.
 * Conventions react to changes of these through an exhaustive switch.
 */
public enum EntityAnnotation {
    TABLE_NAME,
    SCHEMA,
    VIEW_NAME,
    VIEW_SCHEMA,
    FUNCTION_NAME,
    SQL_QUERY;

    /**
     * View, function and SQL query names map the entity to something other than a table.
     */
    public boolean mapsToAlternativeStoreObject() {
        return switch (this) {
            case VIEW_NAME, FUNCTION_NAME, SQL_QUERY -> true;
            case TABLE_NAME, SCHEMA, VIEW_SCHEMA -> false;
        };
    }
}
