package org.namix.convention;

import org.namix.model.ConfigurationSource;
import org.namix.model.EntityAnnotation;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;

import java.util.Objects;

/**
 * Classifies the current {@link MappingMode} of an entity from its position in the model graph.
 *
 * <p>Nothing is cached: a table name change on any member of a hierarchy can flip the mode of every
 * other member, so the mode is recomputed on every call.
 */
public class MappingModeClassifier {

    public MappingMode classify(EntityModel entity) {
        // 1. view/function/SQL query mapping wins unless a table name was set explicitly
        if (entity.getAnnotationSource(EntityAnnotation.TABLE_NAME) != ConfigurationSource.EXPLICIT) {
            if (entity.getViewName() != null) {
                return MappingMode.MAPPED_TO_VIEW;
            }
            if (entity.getFunctionName() != null) {
                return MappingMode.MAPPED_TO_FUNCTION;
            }
            if (entity.getSqlQuery() != null) {
                return MappingMode.MAPPED_TO_SQL_QUERY;
            }
        }

        ForeignKeyModel ownership = entity.findOwnership();
        if (ownership != null) {
            return isTableSplit(entity, ownership) ? MappingMode.OWNED_SPLIT_TABLE : MappingMode.OWNED_SEPARATE_TABLE;
        }

        if (entity.getBaseType() != null) {
            return isTablePerType(entity.getRootType()) ? MappingMode.TPT_DERIVED : MappingMode.TPH_DERIVED;
        }
        if (entity.getDirectlyDerivedTypes().isEmpty()) {
            return MappingMode.STANDALONE_TABLE;
        }
        return isTablePerType(entity) ? MappingMode.TPT_ROOT : MappingMode.TPH_ROOT;
    }

    /**
     * A hierarchy is table-per-type as soon as one directly derived type maps to a table other than the
     * root's.
     */
    public boolean isTablePerType(EntityModel root) {
        String rootTable = root.getTableName();
        for (EntityModel derived : root.getDirectlyDerivedTypes()) {
            if (!Objects.equals(derived.getTableName(), rootTable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reference ownership without a table of its own: either no explicit table name, or an explicit one
     * equal to the owner's.
     */
    private boolean isTableSplit(EntityModel entity, ForeignKeyModel ownership) {
        if (ownership.isPrincipalCollection()) {
            return false;
        }
        if (entity.getAnnotationSource(EntityAnnotation.TABLE_NAME) != ConfigurationSource.EXPLICIT) {
            return true;
        }
        return Objects.equals(entity.getTableName(), ownership.getPrincipalEntity().getTableName());
    }
}
