package org.namix.model;

import lombok.Getter;
import org.namix.convention.ConventionDispatcher;
import org.namix.convention.ConventionSet;
import org.namix.naming.DefaultNaming;
import org.namix.naming.Naming;
import org.namix.options.NamixOptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory relational schema model.
 *
 * <p>Every structural mutation is reported to the {@link ConventionSet} the model was created with,
 * synchronously and in the order the mutation happens. Conventions may mutate names while handling an
 * event; the events raised by those mutations are delivered immediately.
 */
public class SchemaModel {

    private final Map<String, EntityModel> entities = new LinkedHashMap<>();

    @Getter
    private final Naming naming;

    /**
     * Schema used by table-mapped entities that do not configure one. May be {@code null}.
     */
    @Getter
    private final String defaultSchema;

    private final ConventionDispatcher dispatcher;

    @Getter
    private boolean finalized;

    public SchemaModel(ConventionSet conventions) {
        this(conventions, new DefaultNaming(NamixOptions.Naming.MAX_LENGTH_DEFAULT), null);
    }

    public SchemaModel(ConventionSet conventions, Naming naming, String defaultSchema) {
        if (conventions == null) {
            throw new IllegalArgumentException("conventions must not be null");
        }
        if (naming == null) {
            throw new IllegalArgumentException("naming must not be null");
        }
        this.naming = naming;
        this.defaultSchema = defaultSchema;
        this.dispatcher = new ConventionDispatcher(conventions);
    }

    public EntityModel addEntity(String shortName) {
        checkMutable();
        if (shortName == null || shortName.isBlank()) {
            throw new IllegalArgumentException("entity name must not be null/blank");
        }
        if (entities.containsKey(shortName)) {
            throw new IllegalArgumentException("Duplicate entity type: " + shortName);
        }
        EntityModel entity = new EntityModel(this, shortName);
        entities.put(shortName, entity);
        dispatcher.entityAdded(entity);
        return entity;
    }

    public EntityModel findEntity(String shortName) {
        return entities.get(shortName);
    }

    public EntityModel getEntity(String shortName) {
        EntityModel entity = entities.get(shortName);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown entity type: " + shortName);
        }
        return entity;
    }

    /**
     * Entity types in the order they were added.
     */
    public List<EntityModel> getEntities() {
        return new ArrayList<>(entities.values());
    }

    /**
     * Runs the finalizing conventions and freezes the model.
     */
    public SchemaModel finalizeModel() {
        checkMutable();
        dispatcher.modelFinalizing(this);
        finalized = true;
        return this;
    }

    void checkMutable() {
        if (finalized) {
            throw new IllegalStateException("Schema model is finalized and can no longer be modified");
        }
    }

    ConventionDispatcher dispatcher() {
        return dispatcher;
    }
}
