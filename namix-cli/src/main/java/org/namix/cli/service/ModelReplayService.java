package org.namix.cli.service;

import org.namix.cli.definition.EntityDefinition;
import org.namix.cli.definition.ForeignKeyDefinition;
import org.namix.cli.definition.IndexDefinition;
import org.namix.cli.definition.KeyDefinition;
import org.namix.cli.definition.ModelDefinition;
import org.namix.cli.definition.PropertyDefinition;
import org.namix.config.NamingSettings;
import org.namix.model.ConfigurationSource;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a {@link SchemaModel} from a {@link ModelDefinition} the way a model builder would: entities
 * first, then hierarchy, explicit store-object names, properties, keys and finally relationships, so the
 * naming engine sees the same out-of-order mutations it sees in practice.
 */
public class ModelReplayService {

    private static final Logger log = LoggerFactory.getLogger(ModelReplayService.class);

    /**
     * Replays the definition and finalizes the model.
     *
     * @throws IllegalArgumentException when the definition references unknown entities or properties
     * @throws IllegalStateException when the definition is structurally inconsistent
     */
    public SchemaModel replay(ModelDefinition definition, NamingSettings settings) {
        NamingSettings effective = definition.getDefaultSchema() != null
                ? settings.toBuilder().defaultSchema(definition.getDefaultSchema()).build()
                : settings;
        SchemaModel model = effective.createModel();
        List<EntityDefinition> entities = definition.getEntities();

        for (EntityDefinition entity : entities) {
            model.addEntity(entity.getName());
        }
        for (EntityDefinition entity : entities) {
            if (entity.getBaseType() != null) {
                model.getEntity(entity.getName()).setBaseType(model.getEntity(entity.getBaseType()));
            }
        }
        for (EntityDefinition entity : entities) {
            applyStoreObjectNames(model.getEntity(entity.getName()), entity);
        }
        for (EntityDefinition entity : entities) {
            addProperties(model.getEntity(entity.getName()), entity.getProperties());
        }
        for (EntityDefinition entity : entities) {
            addKeys(model.getEntity(entity.getName()), entity);
        }
        for (EntityDefinition entity : entities) {
            addForeignKeys(model, model.getEntity(entity.getName()), entity.getForeignKeys());
        }
        for (EntityDefinition entity : entities) {
            addIndexes(model.getEntity(entity.getName()), entity.getIndexes());
        }

        log.debug("Replayed {} entities, finalizing", entities.size());
        return model.finalizeModel();
    }

    private void applyStoreObjectNames(EntityModel entity, EntityDefinition definition) {
        if (definition.getTable() != null) {
            entity.setTableName(definition.getTable(), ConfigurationSource.EXPLICIT);
        }
        if (definition.getSchema() != null) {
            entity.setSchema(definition.getSchema(), ConfigurationSource.EXPLICIT);
        }
        if (definition.getView() != null) {
            entity.setViewName(definition.getView(), ConfigurationSource.EXPLICIT);
        }
        if (definition.getViewSchema() != null) {
            entity.setViewSchema(definition.getViewSchema(), ConfigurationSource.EXPLICIT);
        }
        if (definition.getFunction() != null) {
            entity.setFunctionName(definition.getFunction(), ConfigurationSource.EXPLICIT);
        }
        if (definition.getSqlQuery() != null) {
            entity.setSqlQuery(definition.getSqlQuery(), ConfigurationSource.EXPLICIT);
        }
    }

    private void addProperties(EntityModel entity, List<PropertyDefinition> properties) {
        for (PropertyDefinition definition : properties) {
            PropertyModel property = entity.addProperty(definition.getName(), definition.getType());
            if (definition.getColumn() != null) {
                property.setColumnName(definition.getColumn(), ConfigurationSource.EXPLICIT);
            }
        }
    }

    private void addKeys(EntityModel entity, EntityDefinition definition) {
        if (!definition.getPrimaryKey().isEmpty()) {
            entity.setPrimaryKey(definition.getPrimaryKey().toArray(String[]::new));
        }
        for (KeyDefinition keyDefinition : definition.getKeys()) {
            KeyModel key = entity.addKey(keyDefinition.getProperties().toArray(String[]::new));
            if (keyDefinition.getName() != null) {
                key.setName(keyDefinition.getName(), ConfigurationSource.EXPLICIT);
            }
        }
    }

    private void addForeignKeys(SchemaModel model, EntityModel entity, List<ForeignKeyDefinition> foreignKeys) {
        for (ForeignKeyDefinition definition : foreignKeys) {
            List<PropertyModel> properties = definition.getProperties().stream().map(entity::getProperty).toList();
            ForeignKeyModel foreignKey = entity.addForeignKey(properties, model.getEntity(definition.getPrincipal()));
            if (definition.getNavigation() != null || definition.isCollection()) {
                foreignKey.setPrincipalToDependent(definition.getNavigation(), definition.isCollection());
            }
            if (definition.isOwnership()) {
                foreignKey.setOwnership(true);
            }
            if (definition.getName() != null) {
                foreignKey.setConstraintName(definition.getName(), ConfigurationSource.EXPLICIT);
            }
        }
    }

    private void addIndexes(EntityModel entity, List<IndexDefinition> indexes) {
        for (IndexDefinition definition : indexes) {
            List<PropertyModel> properties = definition.getProperties().stream().map(entity::getProperty).toList();
            IndexModel index = entity.addIndex(properties, definition.isUnique());
            if (definition.getName() != null) {
                index.setDatabaseName(definition.getName(), ConfigurationSource.EXPLICIT);
            }
        }
    }
}
