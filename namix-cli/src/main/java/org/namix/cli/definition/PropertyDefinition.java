package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyDefinition {

    private String name;

    private String type;

    /**
     * Explicit column name.
     */
    private String column;
}
