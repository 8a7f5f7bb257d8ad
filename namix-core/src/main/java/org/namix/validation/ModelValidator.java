package org.namix.validation;

import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.namix.model.StoreObjectIdentifier;
import org.namix.model.StoreObjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects physical name conflicts in a finalized model.
 *
 * <p>Key constraint names must be unique across tables, foreign key constraint names must be unique
 * within the whole model. An index name may be shared only by identical definitions (same table, same
 * columns, same uniqueness).
 */
public class ModelValidator {

    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    /**
     * @throws ModelValidationException listing every conflict found
     */
    public void validate(SchemaModel model) {
        List<String> problems = findProblems(model);
        if (!problems.isEmpty()) {
            throw new ModelValidationException(problems);
        }
    }

    public List<String> findProblems(SchemaModel model) {
        List<String> problems = new ArrayList<>();
        Map<String, StoreObjectIdentifier> keyNames = new LinkedHashMap<>();
        Map<String, ForeignKeyModel> foreignKeyNames = new LinkedHashMap<>();
        Map<String, IndexDefinition> indexNames = new LinkedHashMap<>();

        for (EntityModel entity : model.getEntities()) {
            StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
            if (table == null) {
                continue;
            }
            if (table.name().isBlank()) {
                problems.add("Entity " + entity.getShortName() + " is mapped to a blank table name");
                continue;
            }

            KeyModel primaryKey = entity.findPrimaryKey();
            if (primaryKey != null) {
                checkKeyName(primaryKey.getName(table), table, keyNames, problems);
            }
            for (KeyModel key : entity.getDeclaredKeys()) {
                if (!key.isPrimaryKey()) {
                    checkKeyName(key.getName(table), table, keyNames, problems);
                }
            }

            for (ForeignKeyModel foreignKey : entity.getDeclaredForeignKeys()) {
                String name = foreignKey.getConstraintName();
                if (name == null) {
                    continue;
                }
                ForeignKeyModel previous = foreignKeyNames.putIfAbsent(name, foreignKey);
                if (previous != null && previous != foreignKey) {
                    StoreObjectIdentifier previousTable =
                            StoreObjectIdentifier.create(previous.getDeclaringEntity(), StoreObjectType.TABLE);
                    problems.add(table.equals(previousTable)
                            ? "Foreign key name '" + name + "' is used twice on " + table.displayName()
                            : "Foreign key name '" + name + "' is used by " + previousTable.displayName()
                                    + " and " + table.displayName());
                }
            }

            for (IndexModel index : entity.getDeclaredIndexes()) {
                String name = index.getDatabaseName();
                if (name == null) {
                    continue;
                }
                IndexDefinition definition = new IndexDefinition(table,
                        index.getProperties().stream().map(p -> p.getColumnName(table)).toList(),
                        index.isUnique());
                IndexDefinition previous = indexNames.putIfAbsent(name, definition);
                if (previous != null && !previous.equals(definition)) {
                    problems.add("Index name '" + name + "' is used by different indexes on "
                            + previous.table().displayName() + " and " + table.displayName());
                }
            }

            checkColumnNames(entity, table, problems);
        }

        if (!problems.isEmpty()) {
            log.debug("Found {} naming problem(s)", problems.size());
        }
        return problems;
    }

    private static void checkKeyName(String name, StoreObjectIdentifier table,
                                     Map<String, StoreObjectIdentifier> keyNames, List<String> problems) {
        if (name == null) {
            return;
        }
        StoreObjectIdentifier previous = keyNames.putIfAbsent(name, table);
        if (previous != null && !previous.equals(table)) {
            problems.add("Key name '" + name + "' is used by " + previous.displayName() + " and " + table.displayName());
        }
    }

    private static void checkColumnNames(EntityModel entity, StoreObjectIdentifier table, List<String> problems) {
        for (PropertyModel property : entity.getProperties()) {
            String column = property.getColumnName(table);
            if (column == null || column.isBlank()) {
                problems.add("Property " + property + " is mapped to a blank column name in " + table.displayName());
            }
        }
    }

    private record IndexDefinition(StoreObjectIdentifier table, List<String> columns, boolean unique) {
        IndexDefinition {
            Objects.requireNonNull(table);
        }
    }
}
