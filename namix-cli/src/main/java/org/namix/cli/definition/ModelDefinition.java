package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML model definition replayed by the {@code rewrite} command.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDefinition {

    /**
     * Overrides the configured default schema when set.
     */
    private String defaultSchema;

    private List<EntityDefinition> entities = new ArrayList<>();
}
