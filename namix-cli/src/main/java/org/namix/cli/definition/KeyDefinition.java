package org.namix.cli.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Alternate key.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyDefinition {

    private List<String> properties = new ArrayList<>();

    private String name;
}
