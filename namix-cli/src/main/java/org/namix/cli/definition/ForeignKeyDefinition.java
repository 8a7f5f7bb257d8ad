package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForeignKeyDefinition {

    private List<String> properties = new ArrayList<>();

    private String principal;

    /**
     * Whether the principal owns the declaring entity.
     */
    private boolean ownership;

    /**
     * Whether the principal navigates to the declaring entity through a collection.
     */
    private boolean collection;

    private String navigation;

    private String name;
}
