package org.namix.convention;

import org.namix.model.ConfigurationSource;
import org.namix.model.EntityModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.namix.model.StoreObjectIdentifier;
import org.namix.model.StoreObjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disambiguates columns of a table shared by several entity types.
 *
 * <p>When properties declared by different entity types resolve to the same column of a shared table,
 * each of them that is neither a key property nor explicitly named is prefixed with its declaring
 * entity's short name: {@code name} becomes {@code Employee_name}.
 */
public class SharedColumnConvention implements ModelConvention {

    private static final Logger log = LoggerFactory.getLogger(SharedColumnConvention.class);

    @Override
    public void modelFinalizing(SchemaModel model) {
        Map<StoreObjectIdentifier, List<EntityModel>> entitiesByTable = new LinkedHashMap<>();
        for (EntityModel entity : model.getEntities()) {
            StoreObjectIdentifier table = StoreObjectIdentifier.create(entity, StoreObjectType.TABLE);
            if (table != null) {
                entitiesByTable.computeIfAbsent(table, t -> new ArrayList<>()).add(entity);
            }
        }

        entitiesByTable.forEach((table, entities) -> {
            if (entities.size() > 1) {
                uniquifyColumns(table, entities);
            }
        });
    }

    private void uniquifyColumns(StoreObjectIdentifier table, List<EntityModel> entities) {
        Map<String, List<PropertyModel>> propertiesByColumn = new LinkedHashMap<>();
        for (EntityModel entity : entities) {
            for (PropertyModel property : entity.getDeclaredProperties()) {
                propertiesByColumn.computeIfAbsent(property.getColumnName(table), c -> new ArrayList<>()).add(property);
            }
        }

        for (Map.Entry<String, List<PropertyModel>> entry : propertiesByColumn.entrySet()) {
            List<PropertyModel> clashing = entry.getValue();
            Set<EntityModel> declaringEntities = new LinkedHashSet<>();
            clashing.forEach(p -> declaringEntities.add(p.getDeclaringEntity()));
            if (declaringEntities.size() < 2) {
                continue;
            }
            for (PropertyModel property : clashing) {
                if (property.isKey() || property.getColumnNameConfigurationSource(table) == ConfigurationSource.EXPLICIT) {
                    continue;
                }
                String uniquified = property.getDeclaringEntity().getShortName() + "_" + entry.getKey();
                if (property.findColumnNameOverride(table) != null) {
                    property.setColumnName(uniquified, table, ConfigurationSource.CONVENTION);
                } else {
                    property.setColumnName(uniquified, ConfigurationSource.CONVENTION);
                }
                log.debug("Column '{}' of {} shared in {}, renamed to '{}'", entry.getKey(), property, table, uniquified);
            }
        }
    }
}
