package org.namix.convention;

import org.namix.model.EntityAnnotation;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Delivers model events to a {@link ConventionSet}, in order.
 *
 * <p>Delivery is re-entrant: when a convention mutates the model while handling an event, the nested
 * event is delivered to all conventions before the outer delivery continues.
 */
public class ConventionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConventionDispatcher.class);

    private final List<ModelConvention> conventions;

    private int depth;

    public ConventionDispatcher(ConventionSet conventionSet) {
        this.conventions = conventionSet.getConventions();
    }

    public void entityAdded(EntityModel entity) {
        dispatch("entityAdded " + entity.getShortName(), c -> c.entityAdded(entity));
    }

    public void baseTypeChanged(EntityModel entity, EntityModel newBaseType, EntityModel oldBaseType) {
        dispatch("baseTypeChanged " + entity.getShortName(),
                c -> c.baseTypeChanged(entity, newBaseType, oldBaseType));
    }

    public void propertyAdded(PropertyModel property) {
        dispatch("propertyAdded " + property, c -> c.propertyAdded(property));
    }

    public void foreignKeyOwnershipChanged(ForeignKeyModel foreignKey) {
        dispatch("foreignKeyOwnershipChanged " + foreignKey, c -> c.foreignKeyOwnershipChanged(foreignKey));
    }

    public void entityAnnotationChanged(EntityModel entity, EntityAnnotation annotation,
                                        String newValue, String oldValue) {
        dispatch("entityAnnotationChanged " + entity.getShortName() + " " + annotation,
                c -> c.entityAnnotationChanged(entity, annotation, newValue, oldValue));
    }

    public void foreignKeyAdded(ForeignKeyModel foreignKey) {
        dispatch("foreignKeyAdded " + foreignKey, c -> c.foreignKeyAdded(foreignKey));
    }

    public void keyAdded(KeyModel key) {
        dispatch("keyAdded " + key, c -> c.keyAdded(key));
    }

    public void indexAdded(IndexModel index) {
        dispatch("indexAdded " + index, c -> c.indexAdded(index));
    }

    public void modelFinalizing(SchemaModel model) {
        dispatch("modelFinalizing", c -> c.modelFinalizing(model));
    }

    private void dispatch(String event, Consumer<ModelConvention> delivery) {
        if (log.isTraceEnabled()) {
            log.trace("{}{}", "  ".repeat(depth), event);
        }
        depth++;
        try {
            for (ModelConvention convention : conventions) {
                delivery.accept(convention);
            }
        } finally {
            depth--;
        }
    }
}
