package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One entity type. Store-object names given here are configured explicitly.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityDefinition {

    private String name;

    private String baseType;

    private String table;

    private String schema;

    private String view;

    private String viewSchema;

    private String function;

    private String sqlQuery;

    private List<PropertyDefinition> properties = new ArrayList<>();

    private List<String> primaryKey = new ArrayList<>();

    private List<KeyDefinition> keys = new ArrayList<>();

    private List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();

    private List<IndexDefinition> indexes = new ArrayList<>();
}
