package org.namix.model;

import lombok.Getter;

import java.util.List;

/**
 * A relationship from a dependent (declaring) entity to a principal entity's key.
 * An ownership edge is a foreign key with {@link #isOwnership()} set.
 */
public class ForeignKeyModel {

    @Getter
    private final EntityModel declaringEntity;

    @Getter
    private final List<PropertyModel> properties;

    @Getter
    private final EntityModel principalEntity;

    @Getter
    private final KeyModel principalKey;

    @Getter
    private boolean ownership;

    /**
     * Whether the principal reaches the dependent through a collection navigation.
     */
    @Getter
    private boolean principalCollection;

    private String navigationName;

    private ConfiguredValue constraintName;

    ForeignKeyModel(EntityModel declaringEntity, List<PropertyModel> properties,
                    EntityModel principalEntity, KeyModel principalKey) {
        this.declaringEntity = declaringEntity;
        this.properties = List.copyOf(properties);
        this.principalEntity = principalEntity;
        this.principalKey = principalKey;
    }

    /**
     * Configures the navigation from the principal to the dependent.
     */
    public void setPrincipalToDependent(String navigationName, boolean collection) {
        declaringEntity.getModel().checkMutable();
        this.navigationName = navigationName;
        this.principalCollection = collection;
    }

    /**
     * Name of the navigation from the principal; the dependent's short name when none is configured.
     */
    public String getNavigationName() {
        return navigationName != null ? navigationName : declaringEntity.getShortName();
    }

    /**
     * Marks or unmarks this foreign key as an ownership edge.
     *
     * @return {@code true} if the flag changed
     */
    public boolean setOwnership(boolean newOwnership) {
        declaringEntity.getModel().checkMutable();
        if (ownership == newOwnership) {
            return false;
        }
        if (newOwnership) {
            ForeignKeyModel existing = declaringEntity.findOwnership();
            if (existing != null && existing != this) {
                throw new IllegalStateException("Entity " + declaringEntity.getShortName() + " is already owned by "
                        + existing.getPrincipalEntity().getShortName());
            }
        }
        ownership = newOwnership;
        declaringEntity.getModel().dispatcher().foreignKeyOwnershipChanged(this);
        return true;
    }

    public String getConstraintName() {
        return constraintName != null ? constraintName.value() : getDefaultName();
    }

    /**
     * {@code FK_<table>_<principal table>_<columns>}, or {@code null} while either side has no table.
     */
    public String getDefaultName() {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(declaringEntity, StoreObjectType.TABLE);
        StoreObjectIdentifier principalTable = StoreObjectIdentifier.create(principalEntity, StoreObjectType.TABLE);
        if (table == null || principalTable == null) {
            return null;
        }
        return declaringEntity.getModel().getNaming().fkName(
                table.name(),
                principalTable.name(),
                properties.stream().map(p -> p.getColumnName(table)).toList());
    }

    public ConfiguredValue findConstraintNameAnnotation() {
        return constraintName;
    }

    public ConfigurationSource getConstraintNameConfigurationSource() {
        return constraintName == null ? null : constraintName.source();
    }

    public boolean setConstraintName(String newName, ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("constraint name must not be null/blank");
        }
        ConfiguredValue merged = ConfiguredValue.merge(constraintName, newName, source);
        if (merged == constraintName) {
            return false;
        }
        constraintName = merged;
        return true;
    }

    public boolean removeConstraintName(ConfigurationSource source) {
        declaringEntity.getModel().checkMutable();
        if (!ConfiguredValue.canRemove(constraintName, source)) {
            return false;
        }
        constraintName = null;
        return true;
    }

    @Override
    public String toString() {
        return "FK " + declaringEntity.getShortName() + properties.stream().map(PropertyModel::getName).toList()
                + " -> " + principalEntity.getShortName() + (ownership ? " (owned)" : "");
    }
}
