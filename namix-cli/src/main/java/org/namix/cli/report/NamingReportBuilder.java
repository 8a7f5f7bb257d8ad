package org.namix.cli.report;

import jakarta.persistence.InheritanceType;
import org.namix.convention.MappingMode;
import org.namix.convention.MappingModeClassifier;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.namix.model.StoreObjectIdentifier;
import org.namix.model.StoreObjectType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the names in effect out of a finalized model.
 */
public class NamingReportBuilder {

    private final MappingModeClassifier classifier = new MappingModeClassifier();

    public NamingReport build(SchemaModel model, String convention) {
        List<EntityReport> entities = new ArrayList<>();
        for (EntityModel entity : model.getEntities()) {
            entities.add(buildEntity(entity));
        }
        return NamingReport.builder()
                .convention(convention)
                .entities(entities)
                .build();
    }

    private EntityReport buildEntity(EntityModel entity) {
        StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
        MappingMode mode = classifier.classify(entity);
        InheritanceType inheritance = mode.inheritanceType();

        EntityReport.EntityReportBuilder report = EntityReport.builder()
                .name(entity.getShortName())
                .mappingMode(mode.name())
                .inheritance(inheritance != null ? inheritance.name() : null)
                .table(entity.getTableName())
                .schema(table != null ? entity.getSchema() : null)
                .view(entity.getViewName())
                .function(entity.getFunctionName())
                .sqlQuery(entity.getSqlQuery())
                .columns(buildColumns(entity, table));

        if (table != null) {
            KeyModel primaryKey = entity.findPrimaryKey();
            if (primaryKey != null) {
                report.primaryKey(primaryKey.getName(table));
            }
            report.keys(entity.getDeclaredKeys().stream()
                    .filter(key -> !key.isPrimaryKey())
                    .map(key -> key.getName(table))
                    .toList());
            report.foreignKeys(entity.getDeclaredForeignKeys().stream()
                    .map(ForeignKeyModel::getConstraintName)
                    .toList());
            report.indexes(entity.getDeclaredIndexes().stream()
                    .map(IndexModel::getDatabaseName)
                    .toList());
        }
        return report.build();
    }

    private List<ColumnReport> buildColumns(EntityModel entity, StoreObjectIdentifier table) {
        List<ColumnReport> columns = new ArrayList<>();
        for (PropertyModel property : entity.getDeclaredProperties()) {
            Map<String, String> storeObjectColumns = new LinkedHashMap<>();
            for (StoreObjectType type : StoreObjectType.values()) {
                if (type == StoreObjectType.TABLE) {
                    continue;
                }
                StoreObjectIdentifier storeObject = StoreObjectIdentifier.create(entity, type);
                if (storeObject != null) {
                    storeObjectColumns.put(storeObject.toString(), property.getColumnName(storeObject));
                }
            }
            columns.add(ColumnReport.builder()
                    .property(property.getName())
                    .column(table != null ? property.getColumnName(table) : property.getColumnBaseName())
                    .storeObjectColumns(storeObjectColumns)
                    .build());
        }
        return columns;
    }
}
