package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexDefinition {

    private List<String> properties = new ArrayList<>();

    private boolean unique;

    private String name;
}
