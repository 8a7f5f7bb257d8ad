package org.namix.convention;

import org.namix.model.ConfigurationSource;
import org.namix.model.EntityAnnotation;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.namix.model.StoreObjectIdentifier;
import org.namix.model.StoreObjectType;
import org.namix.naming.NameRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites table, column, key, foreign key and index names with a {@link NameRewriter} while the model
 * is being built, and keeps them consistent as the structure changes.
 *
 * <p>Every handler follows the same discipline: read the current unrewritten default from the model,
 * rewrite it, and write it back as a {@link ConfigurationSource#CONVENTION convention} value. A name
 * that was rewritten earlier is never fed to the rewriter again; when a structural change invalidates
 * it, the override is removed first so that the default is recomputed. Explicit names are never
 * touched.
 *
 * <p><b>Ordering precondition:</b> {@link #modelFinalizing(SchemaModel)} must run after
 * {@link SharedColumnConvention}, whose disambiguation prefixes are fixed up here. Register this
 * convention last, e.g. through {@link ConventionSet#withNameRewriting(NameRewriter)}.
 */
public class NameRewritingConvention implements ModelConvention {

    private static final Logger log = LoggerFactory.getLogger(NameRewritingConvention.class);

    private final NameRewriter rewriter;
    private final MappingModeClassifier classifier;

    public NameRewritingConvention(NameRewriter rewriter) {
        this(rewriter, new MappingModeClassifier());
    }

    public NameRewritingConvention(NameRewriter rewriter, MappingModeClassifier classifier) {
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public void entityAdded(EntityModel entity) {
        // Base types are wired later through baseTypeChanged.
        if (entity.getBaseType() != null) {
            return;
        }

        String tableName = rewrite(entity.getDefaultTableName());
        if (tableName != null && !isExplicit(entity, EntityAnnotation.TABLE_NAME)) {
            entity.setTableName(tableName, ConfigurationSource.CONVENTION);
            String schema = entity.getSchema();
            if (schema != null && !isExplicit(entity, EntityAnnotation.SCHEMA)) {
                entity.setSchema(schema, ConfigurationSource.CONVENTION);
            }
            log.debug("Table of {} named '{}'", entity.getShortName(), tableName);
        }

        if (entity.isConventionSourced(EntityAnnotation.VIEW_NAME)) {
            String viewName = rewrite(entity.getDefaultViewName());
            entity.setViewName(viewName, ConfigurationSource.CONVENTION);
            log.debug("View of {} named '{}'", entity.getShortName(), viewName);
        }
    }

    @Override
    public void baseTypeChanged(EntityModel entity, EntityModel newBaseType, EntityModel oldBaseType) {
        if (newBaseType == null) {
            // Leaving a hierarchy: the entity owns its table again.
            String tableName = rewrite(entity.getDefaultTableName());
            if (tableName != null && !isExplicit(entity, EntityAnnotation.TABLE_NAME)) {
                entity.setTableName(tableName, ConfigurationSource.CONVENTION);
                log.debug("{} left its hierarchy, table named '{}'", entity.getShortName(), tableName);
            }
            return;
        }

        // Joining a hierarchy: drop what entityAdded configured so the hierarchy default applies.
        // An explicit table name (table-per-type) stays.
        entity.removeAnnotation(EntityAnnotation.TABLE_NAME, ConfigurationSource.CONVENTION);
        entity.removeAnnotation(EntityAnnotation.SCHEMA, ConfigurationSource.CONVENTION);
        EntityModel root = newBaseType.getRootType();
        if (classifier.isTablePerType(root)) {
            // Joined with a table of its own: no table-name event follows, so reset the keys here.
            resetPrimaryKeyNames(root);
        }
        log.debug("{} joined the hierarchy of {}", entity.getShortName(), root.getShortName());
    }

    @Override
    public void propertyAdded(PropertyModel property) {
        rewriteColumnName(property);
    }

    @Override
    public void foreignKeyOwnershipChanged(ForeignKeyModel foreignKey) {
        if (!foreignKey.isOwnership()) {
            return;
        }
        EntityModel owned = foreignKey.getDeclaringEntity();
        if (classifier.classify(owned) != MappingMode.OWNED_SPLIT_TABLE) {
            return;
        }

        // Table splitting: the owned entity lives in its owner's table from now on.
        owned.removeAnnotation(EntityAnnotation.TABLE_NAME, ConfigurationSource.CONVENTION);
        owned.removeAnnotation(EntityAnnotation.SCHEMA, ConfigurationSource.CONVENTION);
        KeyModel primaryKey = owned.findPrimaryKey();
        if (primaryKey != null) {
            primaryKey.removeName(ConfigurationSource.CONVENTION);
        }

        // Columns named before the entity became owned must pick up the owner prefix, and so must the
        // columns of entities already split into it.
        for (EntityModel splitEntity : findSplitEntities(owned)) {
            for (PropertyModel property : splitEntity.getProperties()) {
                rewriteColumnName(property);
            }
            rewriteDependentConstraintNames(splitEntity);
        }
        log.debug("{} is split into the table of {}", owned.getShortName(), foreignKey.getPrincipalEntity().getShortName());
    }

    @Override
    public void entityAnnotationChanged(EntityModel entity, EntityAnnotation annotation,
                                        String newValue, String oldValue) {
        switch (annotation) {
            case VIEW_NAME, FUNCTION_NAME, SQL_QUERY -> {
                // The table name set in entityAdded is ours; the entity maps to the new store object only.
                if (newValue != null && entity.isConventionSourced(EntityAnnotation.TABLE_NAME)) {
                    entity.removeAnnotation(EntityAnnotation.TABLE_NAME, ConfigurationSource.CONVENTION);
                    log.debug("{} mapped to {} '{}', table name cleared", entity.getShortName(), annotation, newValue);
                }
            }
            case TABLE_NAME -> tableNameChanged(entity, newValue);
            case SCHEMA, VIEW_SCHEMA -> {
                // no default name depends on the schema
            }
        }
    }

    @Override
    public void foreignKeyAdded(ForeignKeyModel foreignKey) {
        rewriteConstraintName(foreignKey);
    }

    @Override
    public void keyAdded(KeyModel key) {
        if (key.isPrimaryKey() && !canNamePrimaryKey(key.getDeclaringEntity())) {
            return;
        }
        rewriteKeyName(key);
    }

    @Override
    public void indexAdded(IndexModel index) {
        rewriteDatabaseName(index);
    }

    /**
     * Replaces the raw entity-name prefix that {@link SharedColumnConvention} put on clashing columns by
     * the rewritten entity name: {@code Employee_name} becomes {@code employee_name}.
     */
    @Override
    public void modelFinalizing(SchemaModel model) {
        for (EntityModel entity : model.getEntities()) {
            String shortName = entity.getShortName();
            String prefix = shortName + "_";
            String rewrittenShortName = rewriter.rewriteName(shortName);

            for (PropertyModel property : entity.getDeclaredProperties()) {
                if (property.getColumnNameConfigurationSource() == ConfigurationSource.CONVENTION) {
                    String columnName = property.getColumnBaseName();
                    if (columnName.startsWith(prefix)) {
                        property.setColumnName(rewrittenShortName + columnName.substring(shortName.length()),
                                ConfigurationSource.CONVENTION);
                    }
                }

                for (StoreObjectType type : StoreObjectType.values()) {
                    StoreObjectIdentifier storeObject = StoreObjectIdentifier.create(entity, type);
                    if (storeObject == null
                            || property.findColumnNameOverride(storeObject) == null
                            || !property.isConventionSourced(storeObject)) {
                        continue;
                    }
                    String columnName = property.getColumnName(storeObject);
                    if (columnName.startsWith(prefix)) {
                        property.setColumnName(rewrittenShortName + columnName.substring(shortName.length()),
                                storeObject, ConfigurationSource.CONVENTION);
                    }
                }
            }
        }
    }

    // ----------------------------------------------------------------

    private void tableNameChanged(EntityModel entity, String newValue) {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
        if (table == null) {
            return;
        }

        KeyModel primaryKey = entity.findPrimaryKey();
        if (primaryKey != null) {
            if (canNamePrimaryKey(entity)) {
                rewriteKeyName(primaryKey);
            } else {
                // Table-per-type or table splitting: a key override would be shared by every table of the
                // hierarchy and produce duplicate constraint names. Let each table use its own default.
                resetPrimaryKeyNames(entity.getRootType());
            }
        }

        rewriteConstraintNamesInTable(entity);

        if (newValue != null && classifier.classify(entity) == MappingMode.OWNED_SEPARATE_TABLE) {
            // An owned entity got a table of its own: undo the owner prefixes added for table splitting.
            List<PropertyModel> keyProperties = primaryKey == null ? List.of() : primaryKey.getProperties();
            for (PropertyModel property : entity.getProperties()) {
                if (!keyProperties.contains(property) && property.canSetColumnName(ConfigurationSource.CONVENTION)) {
                    rewriteColumnName(property);
                }
            }
            if (primaryKey != null) {
                rewriteKeyName(primaryKey);
            }
            rewriteDependentConstraintNames(entity);
            log.debug("{} moved from its owner's table to '{}'", entity.getShortName(), newValue);
        }
    }

    private void resetPrimaryKeyNames(EntityModel root) {
        for (EntityModel type : root.getDerivedTypesInclusive()) {
            KeyModel key = type.findPrimaryKey();
            if (key != null) {
                key.removeName(ConfigurationSource.CONVENTION);
            }
        }
        log.debug("Primary key names of the {} hierarchy reset to their defaults", root.getShortName());
    }

    /**
     * {@code owner} followed by every entity whose ownership chain leads to it through table
     * splitting, so that it shares {@code owner}'s table.
     */
    private List<EntityModel> findSplitEntities(EntityModel owner) {
        List<EntityModel> result = new ArrayList<>();
        result.add(owner);
        StoreObjectIdentifier table = StoreObjectIdentifier.create(owner, StoreObjectType.TABLE);
        if (table == null) {
            return result;
        }
        for (EntityModel candidate : owner.getModel().getEntities()) {
            if (candidate != owner
                    && isOwnedThrough(candidate, owner)
                    && table.equals(StoreObjectIdentifier.create(candidate, StoreObjectType.TABLE))) {
                result.add(candidate);
            }
        }
        return result;
    }

    private static boolean isOwnedThrough(EntityModel entity, EntityModel owner) {
        Set<EntityModel> visited = new HashSet<>();
        EntityModel current = entity;
        ForeignKeyModel ownership = current.findOwnership();
        while (ownership != null && visited.add(current)) {
            current = ownership.getPrincipalEntity();
            if (current == owner) {
                return true;
            }
            ownership = current.findOwnership();
        }
        return false;
    }

    private boolean canNamePrimaryKey(EntityModel entity) {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
        return table != null
                && entity.findRowInternalForeignKey(table) == null
                && !classifier.isTablePerType(entity.getRootType());
    }

    /**
     * Clear, recompute the default, rewrite, set: for the base column name and for every store-object
     * specific column name that is convention-sourced.
     */
    private void rewriteColumnName(PropertyModel property) {
        EntityModel entity = property.getDeclaringEntity();

        if (property.canSetColumnName(ConfigurationSource.CONVENTION)) {
            property.removeColumnName(ConfigurationSource.CONVENTION);
            StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
            PropertyModel shared = table != null ? property.findSharedTableRootPrimaryKeyProperty(table) : null;
            String columnName;
            if (shared != null) {
                // the principal's column is already final
                columnName = shared.getColumnName(table);
            } else {
                columnName = rewrite(table != null
                        ? property.getDefaultColumnName(table)
                        : property.getDefaultColumnBaseName());
            }
            if (columnName != null) {
                property.setColumnName(columnName, ConfigurationSource.CONVENTION);
                log.debug("Column of {} named '{}'", property, columnName);
            }
        }

        for (StoreObjectType type : StoreObjectType.values()) {
            if (type == StoreObjectType.TABLE) {
                continue;
            }
            StoreObjectIdentifier storeObject = StoreObjectIdentifier.create(entity, type);
            if (storeObject == null || !property.isConventionSourced(storeObject)) {
                continue;
            }
            property.removeColumnName(storeObject, ConfigurationSource.CONVENTION);
            String columnName = rewrite(property.getDefaultColumnName(storeObject));
            if (columnName != null) {
                property.setColumnName(columnName, storeObject, ConfigurationSource.CONVENTION);
            }
        }
    }

    /**
     * Constraint and index defaults embed table names: refresh those declared by the entity and by the
     * derived types inheriting its table, and the foreign keys pointing into the hierarchy.
     */
    private void rewriteConstraintNamesInTable(EntityModel entity) {
        for (EntityModel type : entity.getDerivedTypesInclusive()) {
            if (type == entity || type.findAnnotation(EntityAnnotation.TABLE_NAME) == null) {
                rewriteDependentConstraintNames(type);
            }
        }
        for (EntityModel other : entity.getModel().getEntities()) {
            for (ForeignKeyModel foreignKey : other.getDeclaredForeignKeys()) {
                if (entity.isAssignableFrom(foreignKey.getPrincipalEntity())) {
                    rewriteConstraintName(foreignKey);
                }
            }
        }
    }

    private void rewriteDependentConstraintNames(EntityModel entity) {
        for (ForeignKeyModel foreignKey : entity.getDeclaredForeignKeys()) {
            rewriteConstraintName(foreignKey);
        }
        for (IndexModel index : entity.getDeclaredIndexes()) {
            rewriteDatabaseName(index);
        }
    }

    private void rewriteKeyName(KeyModel key) {
        if (key.getNameConfigurationSource() == ConfigurationSource.EXPLICIT) {
            return;
        }
        String name = rewrite(key.getDefaultName());
        if (name != null) {
            key.setName(name, ConfigurationSource.CONVENTION);
        }
    }

    private void rewriteConstraintName(ForeignKeyModel foreignKey) {
        if (foreignKey.getConstraintNameConfigurationSource() == ConfigurationSource.EXPLICIT) {
            return;
        }
        String name = rewrite(foreignKey.getDefaultName());
        if (name != null) {
            foreignKey.setConstraintName(name, ConfigurationSource.CONVENTION);
        }
    }

    private void rewriteDatabaseName(IndexModel index) {
        if (index.getDatabaseNameConfigurationSource() == ConfigurationSource.EXPLICIT) {
            return;
        }
        String name = rewrite(index.getDefaultDatabaseName());
        if (name != null) {
            index.setDatabaseName(name, ConfigurationSource.CONVENTION);
        }
    }

    private static boolean isExplicit(EntityModel entity, EntityAnnotation annotation) {
        return entity.getAnnotationSource(annotation) == ConfigurationSource.EXPLICIT;
    }

    // A missing default means there is nothing to rewrite yet.
    private String rewrite(String defaultName) {
        return defaultName == null ? null : rewriter.rewriteName(defaultName);
    }
}
