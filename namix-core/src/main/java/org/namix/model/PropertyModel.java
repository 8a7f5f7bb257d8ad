package org.namix.model;

import lombok.Getter;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A scalar property and the column names it maps to.
 *
 * <p>The column name has a base override (applies to every store object) and optional overrides per
 * {@link StoreObjectIdentifier}. Each slot keeps its own {@link ConfigurationSource}.
 */
public class PropertyModel {

    @Getter
    private final EntityModel declaringEntity;

    @Getter
    private final String name;

    @Getter
    private final String javaType;

    private ConfiguredValue columnName;

    private final Map<StoreObjectIdentifier, ConfiguredValue> columnNameOverrides = new LinkedHashMap<>();

    PropertyModel(EntityModel declaringEntity, String name, String javaType) {
        this.declaringEntity = declaringEntity;
        this.name = name;
        this.javaType = javaType;
    }

    public boolean isPrimaryKey() {
        KeyModel pk = declaringEntity.findPrimaryKey();
        return pk != null && pk.getProperties().contains(this);
    }

    /**
     * Whether the property is part of the primary key or of an alternate key.
     */
    public boolean isKey() {
        return isPrimaryKey() || !declaringEntity.keysContaining(this).isEmpty();
    }

    // ---------------------------------------------------------------- base column name

    public ConfiguredValue findColumnNameAnnotation() {
        return columnName;
    }

    public ConfigurationSource getColumnNameConfigurationSource() {
        return columnName == null ? null : columnName.source();
    }

    public String getColumnBaseName() {
        return columnName != null ? columnName.value() : getDefaultColumnBaseName();
    }

    public String getDefaultColumnBaseName() {
        return declaringEntity.getModel().getNaming().truncate(name);
    }

    public boolean setColumnName(String newColumnName, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        requireName(newColumnName);
        ConfiguredValue merged = ConfiguredValue.merge(columnName, newColumnName, source);
        if (merged == columnName) {
            return false;
        }
        columnName = merged;
        return true;
    }

    public boolean removeColumnName(ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (!ConfiguredValue.canRemove(columnName, source)) {
            return false;
        }
        columnName = null;
        return true;
    }

    /**
     * Whether the base column name can be changed from {@code source}.
     */
    public boolean canSetColumnName(ConfigurationSource source) {
        return ConfiguredValue.canRemove(columnName, source);
    }

    // ---------------------------------------------------------------- per store object

    public ConfiguredValue findColumnNameOverride(StoreObjectIdentifier storeObject) {
        return columnNameOverrides.get(storeObject);
    }

    public Map<StoreObjectIdentifier, ConfiguredValue> getColumnNameOverrides() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(columnNameOverrides));
    }

    /**
     * Source of the column name in effect at {@code storeObject}: the store-object specific override if
     * any, the base override otherwise, {@code null} when the default applies.
     */
    public ConfigurationSource getColumnNameConfigurationSource(StoreObjectIdentifier storeObject) {
        ConfiguredValue override = columnNameOverrides.get(storeObject);
        return override != null ? override.source() : getColumnNameConfigurationSource();
    }

    public boolean isConventionSourced(StoreObjectIdentifier storeObject) {
        return getColumnNameConfigurationSource(storeObject) == ConfigurationSource.CONVENTION;
    }

    public String getColumnName(StoreObjectIdentifier storeObject) {
        ConfiguredValue override = columnNameOverrides.get(storeObject);
        if (override != null) {
            return override.value();
        }
        if (columnName != null) {
            return columnName.value();
        }
        return getDefaultColumnName(storeObject);
    }

    /**
     * Column name this property gets at {@code storeObject} when nothing is configured.
     *
     * <p>Primary key properties of an entity split into another entity's table share that entity's key
     * column. Other properties of an owned entity living in its owner's store object are prefixed with the
     * ownership navigation names, outermost first ({@code Address_Street}).
     */
    public String getDefaultColumnName(StoreObjectIdentifier storeObject) {
        PropertyModel shared = findSharedTableRootPrimaryKeyProperty(storeObject);
        if (shared != null) {
            return shared.getColumnName(storeObject);
        }

        StringBuilder prefix = new StringBuilder();
        EntityModel entity = declaringEntity;
        Set<EntityModel> visited = new HashSet<>();
        ForeignKeyModel ownership = entity.findOwnership();
        while (ownership != null && visited.add(entity)) {
            EntityModel principal = ownership.getPrincipalEntity();
            if (!storeObject.equals(StoreObjectIdentifier.create(principal, storeObject.type()))) {
                break;
            }
            prefix.insert(0, ownership.getNavigationName() + "_");
            entity = principal;
            ownership = entity.findOwnership();
        }
        return declaringEntity.getModel().getNaming().truncate(prefix + name);
    }

    public boolean setColumnName(String newColumnName, StoreObjectIdentifier storeObject, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        requireName(newColumnName);
        if (storeObject == null) {
            throw new IllegalArgumentException("storeObject must not be null");
        }
        ConfiguredValue current = columnNameOverrides.get(storeObject);
        ConfiguredValue merged = ConfiguredValue.merge(current, newColumnName, source);
        if (merged == current) {
            return false;
        }
        columnNameOverrides.put(storeObject, merged);
        return true;
    }

    public boolean removeColumnName(StoreObjectIdentifier storeObject, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        ConfiguredValue current = columnNameOverrides.get(storeObject);
        if (!ConfiguredValue.canRemove(current, source)) {
            return false;
        }
        columnNameOverrides.remove(storeObject);
        return true;
    }

    // ----------------------------------------------------------------

    /**
     * For a primary key property of an entity split into another entity's table, the principal key
     * property whose column it shares at {@code storeObject}; {@code null} otherwise.
     */
    public PropertyModel findSharedTableRootPrimaryKeyProperty(StoreObjectIdentifier storeObject) {
        if (!isPrimaryKey()) {
            return null;
        }
        PropertyModel root = null;
        PropertyModel current = this;
        Set<EntityModel> visited = new HashSet<>();
        while (visited.add(current.declaringEntity.getRootType())) {
            EntityModel entity = current.declaringEntity;
            ForeignKeyModel link = entity.findRowInternalForeignKey(storeObject);
            if (link == null) {
                break;
            }
            int index = entity.findPrimaryKey().getProperties().indexOf(current);
            current = link.getPrincipalKey().getProperties().get(index);
            root = current;
        }
        return root;
    }

    private static void requireName(String newColumnName) {
        if (newColumnName == null || newColumnName.isBlank()) {
            throw new IllegalArgumentException("column name must not be null/blank");
        }
    }

    @Override
    public String toString() {
        return declaringEntity.getShortName() + "." + name;
    }
}
