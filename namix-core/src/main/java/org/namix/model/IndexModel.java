package org.namix.model;

import lombok.Getter;

import java.util.List;

public class IndexModel {

    @Getter
    private final EntityModel declaringEntity;

    @Getter
    private final List<PropertyModel> properties;

    @Getter
    private final boolean unique;

    private ConfiguredValue databaseName;

    IndexModel(EntityModel declaringEntity, List<PropertyModel> properties, boolean unique) {
        this.declaringEntity = declaringEntity;
        this.properties = List.copyOf(properties);
        this.unique = unique;
    }

    public String getDatabaseName() {
        return databaseName != null ? databaseName.value() : getDefaultDatabaseName();
    }

    /**
     * {@code IX_<table>_<columns>}, or {@code null} while the declaring entity has no table.
     */
    public String getDefaultDatabaseName() {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(declaringEntity, StoreObjectType.TABLE);
        if (table == null) {
            return null;
        }
        return declaringEntity.getModel().getNaming().ixName(
                table.name(),
                properties.stream().map(p -> p.getColumnName(table)).toList());
    }

    public ConfiguredValue findDatabaseNameAnnotation() {
        return databaseName;
    }

    public ConfigurationSource getDatabaseNameConfigurationSource() {
        return databaseName == null ? null : databaseName.source();
    }

    public boolean setDatabaseName(String newName, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("index name must not be null/blank");
        }
        ConfiguredValue merged = ConfiguredValue.merge(databaseName, newName, source);
        if (merged == databaseName) {
            return false;
        }
        databaseName = merged;
        return true;
    }

    public boolean removeDatabaseName(ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (!ConfiguredValue.canRemove(databaseName, source)) {
            return false;
        }
        databaseName = null;
        return true;
    }

    @Override
    public String toString() {
        return "IX " + declaringEntity.getShortName() + properties.stream().map(PropertyModel::getName).toList();
    }
}
