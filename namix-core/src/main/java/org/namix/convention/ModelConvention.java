package org.namix.convention;

import org.namix.model.EntityAnnotation;
import org.namix.model.EntityModel;
import org.namix.model.ForeignKeyModel;
import org.namix.model.IndexModel;
import org.namix.model.KeyModel;
import org.namix.model.PropertyModel;
import org.namix.model.SchemaModel;

/**
 * Callbacks raised by the {@link SchemaModel} while it is being built.
 *
 * <p>Each event is delivered exactly once per occurrence, synchronously, in the order the mutation
 * happens. Implementations override only the events they care about.
 */
public interface ModelConvention {

    default void entityAdded(EntityModel entity) {
    }

    default void baseTypeChanged(EntityModel entity, EntityModel newBaseType, EntityModel oldBaseType) {
    }

    default void propertyAdded(PropertyModel property) {
    }

    default void foreignKeyOwnershipChanged(ForeignKeyModel foreignKey) {
    }

    /**
     * Raised when a store-object annotation is set, changed or removed.
     * {@code newValue} is {@code null} when the annotation was removed.
     */
    default void entityAnnotationChanged(EntityModel entity, EntityAnnotation annotation,
                                         String newValue, String oldValue) {
    }

    default void foreignKeyAdded(ForeignKeyModel foreignKey) {
    }

    default void keyAdded(KeyModel key) {
    }

    default void indexAdded(IndexModel index) {
    }

    /**
     * Raised once, when the model is finalized. Conventions receive it in {@link ConventionSet} order.
     */
    default void modelFinalizing(SchemaModel model) {
    }
}
