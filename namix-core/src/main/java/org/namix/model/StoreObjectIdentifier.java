package org.namix.model;

import java.util.Objects;

/**
 * Identifies one physical target (table, view, function or SQL query) an entity maps to.
 */
public record StoreObjectIdentifier(StoreObjectType type, String name, String schema) {

    /**
     * Name used for the store object of an entity mapped to a raw SQL query.
     */
    public static final String SQL_QUERY_NAME_SUFFIX = ".MappedSqlQuery";

    public StoreObjectIdentifier {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static StoreObjectIdentifier table(String name, String schema) {
        return new StoreObjectIdentifier(StoreObjectType.TABLE, name, schema);
    }

    public static StoreObjectIdentifier view(String name, String schema) {
        return new StoreObjectIdentifier(StoreObjectType.VIEW, name, schema);
    }

    /**
     * Resolves the store object of the given kind the entity currently maps to.
     *
     * @return the identifier, or {@code null} when the entity is not mapped to that kind of store object
     */
    public static StoreObjectIdentifier create(EntityModel entity, StoreObjectType type) {
        switch (type) {
            case TABLE: {
                String tableName = entity.getTableName();
                return tableName == null ? null : table(tableName, entity.getSchema());
            }
            case VIEW: {
                String viewName = entity.getViewName();
                return viewName == null ? null : view(viewName, entity.getViewSchema());
            }
            case FUNCTION: {
                String functionName = entity.getFunctionName();
                return functionName == null ? null : new StoreObjectIdentifier(type, functionName, null);
            }
            case SQL_QUERY: {
                if (entity.getSqlQuery() == null) {
                    return null;
                }
                return new StoreObjectIdentifier(type, entity.getRootType().getShortName() + SQL_QUERY_NAME_SUFFIX, null);
            }
            default:
                throw new IllegalArgumentException("Unsupported store object type: " + type);
        }
    }

    public String displayName() {
        return (schema == null || schema.isBlank()) ? name : schema + "." + name;
    }

    @Override
    public String toString() {
        return type + ":" + displayName();
    }
}
