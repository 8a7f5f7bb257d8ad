package org.namix.model;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An entity type of the {@link SchemaModel}.
 *
 * <p>The inheritance tree is kept as a weak back reference to the base type plus the set of directly
 * derived types owned by the base. Store-object names (table, view, function, SQL query) are kept as
 * {@link EntityAnnotation annotations} carrying their {@link ConfigurationSource}; when an annotation is
 * absent the getters fall back to the relational defaults computed from the current structure.
 */
public class EntityModel {

    @Getter
    private final SchemaModel model;

    @Getter
    private final String shortName;

    @Getter
    private EntityModel baseType;

    private final Set<EntityModel> directlyDerivedTypes = new LinkedHashSet<>();

    private final Map<EntityAnnotation, ConfiguredValue> annotations = new EnumMap<>(EntityAnnotation.class);

    private final Map<String, PropertyModel> properties = new LinkedHashMap<>();

    private final List<KeyModel> keys = new ArrayList<>();

    private KeyModel primaryKey;

    private final List<ForeignKeyModel> foreignKeys = new ArrayList<>();

    private final List<IndexModel> indexes = new ArrayList<>();

    EntityModel(SchemaModel model, String shortName) {
        this.model = model;
        this.shortName = shortName;
    }

    // ---------------------------------------------------------------- hierarchy

    /**
     * Moves this entity under {@code newBaseType} ({@code null} removes it from its hierarchy).
     */
    public void setBaseType(EntityModel newBaseType) {
        model.checkMutable();
        if (newBaseType == baseType) {
            return;
        }
        if (newBaseType != null) {
            if (newBaseType.model != model) {
                throw new IllegalArgumentException("Base type " + newBaseType.shortName + " belongs to another model");
            }
            if (isAssignableFrom(newBaseType)) {
                throw new IllegalArgumentException(
                        "Setting " + newBaseType.shortName + " as base type of " + shortName + " would create a cycle");
            }
            if (primaryKey != null) {
                throw new IllegalStateException("Entity " + shortName + " declares a primary key and cannot become a derived type");
            }
        }

        EntityModel oldBaseType = baseType;
        if (oldBaseType != null) {
            oldBaseType.directlyDerivedTypes.remove(this);
        }
        baseType = newBaseType;
        if (newBaseType != null) {
            newBaseType.directlyDerivedTypes.add(this);
        }
        model.dispatcher().baseTypeChanged(this, newBaseType, oldBaseType);
    }

    public EntityModel getRootType() {
        EntityModel root = this;
        while (root.baseType != null) {
            root = root.baseType;
        }
        return root;
    }

    public List<EntityModel> getDirectlyDerivedTypes() {
        return List.copyOf(directlyDerivedTypes);
    }

    /**
     * All descendants, breadth first.
     */
    public List<EntityModel> getDerivedTypes() {
        List<EntityModel> result = new ArrayList<>();
        Deque<EntityModel> queue = new ArrayDeque<>(directlyDerivedTypes);
        while (!queue.isEmpty()) {
            EntityModel next = queue.poll();
            result.add(next);
            queue.addAll(next.directlyDerivedTypes);
        }
        return result;
    }

    public List<EntityModel> getDerivedTypesInclusive() {
        List<EntityModel> result = new ArrayList<>();
        result.add(this);
        result.addAll(getDerivedTypes());
        return result;
    }

    /**
     * Whether {@code other} is this type or one of its descendants.
     */
    public boolean isAssignableFrom(EntityModel other) {
        for (EntityModel current = other; current != null; current = current.baseType) {
            if (current == this) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- annotations

    public ConfiguredValue findAnnotation(EntityAnnotation annotation) {
        return annotations.get(annotation);
    }

    public ConfigurationSource getAnnotationSource(EntityAnnotation annotation) {
        ConfiguredValue value = annotations.get(annotation);
        return value == null ? null : value.source();
    }

    public boolean isConventionSourced(EntityAnnotation annotation) {
        return getAnnotationSource(annotation) == ConfigurationSource.CONVENTION;
    }

    /**
     * Sets an annotation unless a value from a stronger source is already configured.
     *
     * @return {@code true} if the value was applied
     */
    public boolean setAnnotation(EntityAnnotation annotation, String value, ConfigurationSource source) {
        model.checkMutable();
        ConfiguredValue current = annotations.get(annotation);
        ConfiguredValue merged = ConfiguredValue.merge(current, value, source);
        if (merged == current) {
            return false;
        }
        annotations.put(annotation, merged);
        if (current == null || !Objects.equals(current.value(), value)) {
            model.dispatcher().entityAnnotationChanged(this, annotation, value, current == null ? null : current.value());
        }
        return true;
    }

    /**
     * Removes an annotation if {@code source} is allowed to override it.
     *
     * @return {@code true} if the annotation is absent afterwards
     */
    public boolean removeAnnotation(EntityAnnotation annotation, ConfigurationSource source) {
        model.checkMutable();
        ConfiguredValue current = annotations.get(annotation);
        if (current == null) {
            return true;
        }
        if (!ConfiguredValue.canRemove(current, source)) {
            return false;
        }
        annotations.remove(annotation);
        model.dispatcher().entityAnnotationChanged(this, annotation, null, current.value());
        return true;
    }

    public boolean setTableName(String tableName, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.TABLE_NAME, tableName, source);
    }

    public boolean setSchema(String schema, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.SCHEMA, schema, source);
    }

    public boolean setViewName(String viewName, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.VIEW_NAME, viewName, source);
    }

    public boolean setViewSchema(String viewSchema, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.VIEW_SCHEMA, viewSchema, source);
    }

    public boolean setFunctionName(String functionName, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.FUNCTION_NAME, functionName, source);
    }

    public boolean setSqlQuery(String sqlQuery, ConfigurationSource source) {
        return setAnnotation(EntityAnnotation.SQL_QUERY, sqlQuery, source);
    }

    // ---------------------------------------------------------------- store objects

    public String getTableName() {
        ConfiguredValue tableName = annotations.get(EntityAnnotation.TABLE_NAME);
        return tableName != null ? tableName.value() : getDefaultTableName();
    }

    /**
     * Table name this entity gets when no table name is configured.
     * <ul>
     *   <li>{@code null} when the entity is mapped to a view, function or SQL query</li>
     *   <li>the base type's table for derived types</li>
     *   <li>the owner's table for entities owned through a reference navigation</li>
     *   <li>the short name otherwise</li>
     * </ul>
     */
    public String getDefaultTableName() {
        if (isMappedToAlternativeStoreObject()) {
            return null;
        }
        if (baseType != null) {
            return baseType.getTableName();
        }
        ForeignKeyModel ownership = findOwnership();
        if (ownership != null && !ownership.isPrincipalCollection()) {
            return ownership.getPrincipalEntity().getTableName();
        }
        return shortName;
    }

    public String getSchema() {
        ConfiguredValue schema = annotations.get(EntityAnnotation.SCHEMA);
        return schema != null ? schema.value() : getDefaultSchema();
    }

    public String getDefaultSchema() {
        if (baseType != null) {
            return baseType.getSchema();
        }
        ForeignKeyModel ownership = findOwnership();
        if (ownership != null) {
            EntityModel principal = ownership.getPrincipalEntity();
            if (Objects.equals(getTableName(), principal.getTableName())) {
                return principal.getSchema();
            }
        }
        return model.getDefaultSchema();
    }

    public String getViewName() {
        ConfiguredValue viewName = annotations.get(EntityAnnotation.VIEW_NAME);
        if (viewName != null) {
            return viewName.value();
        }
        if (baseType != null) {
            return baseType.getViewName();
        }
        ForeignKeyModel ownership = findOwnership();
        if (ownership != null && !ownership.isPrincipalCollection()) {
            return ownership.getPrincipalEntity().getViewName();
        }
        return null;
    }

    /**
     * Unrewritten view name used when a view mapping is configured by convention.
     */
    public String getDefaultViewName() {
        return shortName;
    }

    public String getViewSchema() {
        ConfiguredValue viewSchema = annotations.get(EntityAnnotation.VIEW_SCHEMA);
        if (viewSchema != null) {
            return viewSchema.value();
        }
        if (baseType != null) {
            return baseType.getViewSchema();
        }
        ForeignKeyModel ownership = findOwnership();
        if (ownership != null && !ownership.isPrincipalCollection()) {
            return ownership.getPrincipalEntity().getViewSchema();
        }
        return model.getDefaultSchema();
    }

    public String getFunctionName() {
        ConfiguredValue functionName = annotations.get(EntityAnnotation.FUNCTION_NAME);
        if (functionName != null) {
            return functionName.value();
        }
        return baseType != null ? baseType.getFunctionName() : null;
    }

    public String getSqlQuery() {
        ConfiguredValue sqlQuery = annotations.get(EntityAnnotation.SQL_QUERY);
        if (sqlQuery != null) {
            return sqlQuery.value();
        }
        return baseType != null ? baseType.getSqlQuery() : null;
    }

    public boolean isMappedToAlternativeStoreObject() {
        return getViewName() != null || getFunctionName() != null || getSqlQuery() != null;
    }

    // ---------------------------------------------------------------- properties

    public PropertyModel addProperty(String name) {
        return addProperty(name, null);
    }

    public PropertyModel addProperty(String name, String javaType) {
        model.checkMutable();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("property name must not be null/blank");
        }
        if (findProperty(name) != null) {
            throw new IllegalArgumentException("Duplicate property " + shortName + "." + name);
        }
        PropertyModel property = new PropertyModel(this, name, javaType);
        properties.put(name, property);
        model.dispatcher().propertyAdded(property);
        return property;
    }

    /**
     * Finds a declared or inherited property.
     */
    public PropertyModel findProperty(String name) {
        PropertyModel property = properties.get(name);
        if (property == null && baseType != null) {
            return baseType.findProperty(name);
        }
        return property;
    }

    public PropertyModel getProperty(String name) {
        PropertyModel property = findProperty(name);
        if (property == null) {
            throw new IllegalArgumentException("Unknown property " + shortName + "." + name);
        }
        return property;
    }

    public List<PropertyModel> getDeclaredProperties() {
        return List.copyOf(properties.values());
    }

    /**
     * Inherited properties first, then the declared ones.
     */
    public List<PropertyModel> getProperties() {
        if (baseType == null) {
            return getDeclaredProperties();
        }
        List<PropertyModel> result = new ArrayList<>(baseType.getProperties());
        result.addAll(properties.values());
        return result;
    }

    // ---------------------------------------------------------------- keys

    public KeyModel setPrimaryKey(String... propertyNames) {
        return setPrimaryKey(resolveProperties(propertyNames));
    }

    public KeyModel setPrimaryKey(List<PropertyModel> keyProperties) {
        model.checkMutable();
        if (baseType != null) {
            throw new IllegalStateException("The primary key of derived type " + shortName + " is defined by " + getRootType().shortName);
        }
        if (primaryKey != null) {
            if (primaryKey.getProperties().equals(keyProperties)) {
                return primaryKey;
            }
            throw new IllegalStateException("Entity " + shortName + " already has primary key " + primaryKey);
        }
        return createKey(keyProperties, true);
    }

    public KeyModel addKey(String... propertyNames) {
        return addKey(resolveProperties(propertyNames));
    }

    public KeyModel addKey(List<PropertyModel> keyProperties) {
        model.checkMutable();
        for (KeyModel existing : keys) {
            if (existing.getProperties().equals(keyProperties)) {
                return existing;
            }
        }
        return createKey(keyProperties, false);
    }

    private KeyModel createKey(List<PropertyModel> keyProperties, boolean primary) {
        checkOwnProperties(keyProperties, "key");
        KeyModel key = new KeyModel(this, keyProperties, primary);
        keys.add(key);
        if (primary) {
            primaryKey = key;
        }
        model.dispatcher().keyAdded(key);
        return key;
    }

    /**
     * The primary key declared here or on the closest base type.
     */
    public KeyModel findPrimaryKey() {
        if (primaryKey != null) {
            return primaryKey;
        }
        return baseType != null ? baseType.findPrimaryKey() : null;
    }

    public List<KeyModel> getDeclaredKeys() {
        return List.copyOf(keys);
    }

    // ---------------------------------------------------------------- foreign keys

    public ForeignKeyModel addForeignKey(List<PropertyModel> dependentProperties, EntityModel principalEntity) {
        model.checkMutable();
        if (principalEntity == null || principalEntity.model != model) {
            throw new IllegalArgumentException("Principal entity must belong to the same model");
        }
        KeyModel principalKey = principalEntity.findPrimaryKey();
        if (principalKey == null) {
            throw new IllegalStateException("Principal entity " + principalEntity.shortName + " has no primary key");
        }
        checkOwnProperties(dependentProperties, "foreign key");
        if (dependentProperties.size() != principalKey.getProperties().size()) {
            throw new IllegalArgumentException("Foreign key on " + shortName + " has " + dependentProperties.size()
                    + " properties but the principal key has " + principalKey.getProperties().size());
        }
        ForeignKeyModel foreignKey = new ForeignKeyModel(this, dependentProperties, principalEntity, principalKey);
        foreignKeys.add(foreignKey);
        model.dispatcher().foreignKeyAdded(foreignKey);
        return foreignKey;
    }

    public List<ForeignKeyModel> getDeclaredForeignKeys() {
        return List.copyOf(foreignKeys);
    }

    /**
     * The ownership edge pointing from this entity to its owner, if any.
     */
    public ForeignKeyModel findOwnership() {
        for (ForeignKeyModel foreignKey : foreignKeys) {
            if (foreignKey.isOwnership()) {
                return foreignKey;
            }
        }
        return baseType != null ? baseType.findOwnership() : null;
    }

    /**
     * Finds the foreign key linking this entity's primary key to the primary key of another entity
     * that is mapped to the same store object (table splitting).
     */
    public ForeignKeyModel findRowInternalForeignKey(StoreObjectIdentifier storeObject) {
        KeyModel pk = findPrimaryKey();
        if (pk == null || storeObject == null) {
            return null;
        }
        for (ForeignKeyModel foreignKey : foreignKeys) {
            EntityModel principal = foreignKey.getPrincipalEntity();
            if (!foreignKey.getProperties().equals(pk.getProperties())
                    || !foreignKey.getPrincipalKey().isPrimaryKey()
                    || principal.getRootType() == getRootType()) {
                continue;
            }
            if (storeObject.equals(StoreObjectIdentifier.create(principal, storeObject.type()))) {
                return foreignKey;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------- indexes

    public IndexModel addIndex(String... propertyNames) {
        return addIndex(resolveProperties(propertyNames), false);
    }

    public IndexModel addIndex(List<PropertyModel> indexProperties, boolean unique) {
        model.checkMutable();
        checkOwnProperties(indexProperties, "index");
        IndexModel index = new IndexModel(this, indexProperties, unique);
        indexes.add(index);
        model.dispatcher().indexAdded(index);
        return index;
    }

    public List<IndexModel> getDeclaredIndexes() {
        return List.copyOf(indexes);
    }

    // ----------------------------------------------------------------

    private List<PropertyModel> resolveProperties(String... propertyNames) {
        return Arrays.stream(propertyNames).map(this::getProperty).toList();
    }

    private void checkOwnProperties(List<PropertyModel> candidates, String what) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException(what + " on " + shortName + " must have at least one property");
        }
        for (PropertyModel property : candidates) {
            if (property == null || findProperty(property.getName()) != property) {
                throw new IllegalArgumentException(
                        what + " on " + shortName + " references a property of another entity: " + property);
            }
        }
        if (new LinkedHashSet<>(candidates).size() != candidates.size()) {
            throw new IllegalArgumentException(what + " on " + shortName + " lists a property twice");
        }
    }

    List<KeyModel> keysContaining(PropertyModel property) {
        List<KeyModel> result = new ArrayList<>();
        for (EntityModel type = this; type != null; type = type.baseType) {
            for (KeyModel key : type.keys) {
                if (key.getProperties().contains(property)) {
                    result.add(key);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "EntityModel{" + shortName + "}";
    }
}
