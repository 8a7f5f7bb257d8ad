package org.namix.model;

import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A primary or alternate key.
 *
 * <p>A key declared on a hierarchy root is shared by all derived types. With table-per-type mapping the
 * same key therefore maps to one constraint per table; {@link #getName(StoreObjectIdentifier)} resolves
 * the name for a particular table.
 */
public class KeyModel {

    @Getter
    private final EntityModel declaringEntity;

    @Getter
    private final List<PropertyModel> properties;

    @Getter
    private final boolean primaryKey;

    private ConfiguredValue name;

    KeyModel(EntityModel declaringEntity, List<PropertyModel> properties, boolean primaryKey) {
        this.declaringEntity = declaringEntity;
        this.properties = List.copyOf(properties);
        this.primaryKey = primaryKey;
    }

    public String getName() {
        return name != null ? name.value() : getDefaultName();
    }

    /**
     * Constraint name at {@code storeObject}, or {@code null} when none of the types sharing this key
     * is mapped to it.
     */
    public String getName(StoreObjectIdentifier storeObject) {
        return getName(storeObject, new HashSet<>());
    }

    private String getName(StoreObjectIdentifier storeObject, Set<KeyModel> visited) {
        if (storeObject.type() != StoreObjectType.TABLE || !visited.add(this)) {
            return null;
        }
        for (EntityModel type : declaringEntity.getDerivedTypesInclusive()) {
            if (storeObject.equals(StoreObjectIdentifier.create(type, StoreObjectType.TABLE))) {
                if (name != null) {
                    return name.value();
                }
                // a split entity shares the primary key constraint of the entity it is split into
                ForeignKeyModel link = primaryKey ? type.findRowInternalForeignKey(storeObject) : null;
                return link != null ? link.getPrincipalKey().getName(storeObject, visited) : getDefaultName(storeObject);
            }
        }
        return null;
    }

    /**
     * Default name at the declaring entity's table, {@code null} when it is not mapped to a table.
     */
    public String getDefaultName() {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(declaringEntity, StoreObjectType.TABLE);
        return table == null ? null : getDefaultName(table);
    }

    public String getDefaultName(StoreObjectIdentifier storeObject) {
        if (storeObject.type() != StoreObjectType.TABLE) {
            return null;
        }
        var naming = declaringEntity.getModel().getNaming();
        if (primaryKey) {
            return naming.pkName(storeObject.name());
        }
        return naming.akName(storeObject.name(), properties.stream().map(p -> p.getColumnName(storeObject)).toList());
    }

    public ConfiguredValue findNameAnnotation() {
        return name;
    }

    public ConfigurationSource getNameConfigurationSource() {
        return name == null ? null : name.source();
    }

    public boolean setName(String newName, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("key name must not be null/blank");
        }
        ConfiguredValue merged = ConfiguredValue.merge(name, newName, source);
        if (merged == name) {
            return false;
        }
        name = merged;
        return true;
    }

    public boolean removeName(ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (!ConfiguredValue.canRemove(name, source)) {
            return false;
        }
        name = null;
        return true;
    }

    @Override
    public String toString() {
        return (primaryKey ? "PK " : "AK ") + declaringEntity.getShortName()
                + properties.stream().map(PropertyModel::getName).toList();
    }
}
