package org.namix.cli.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor(access = AccessLevel.PUBLIC)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class EntityReport {
    private String name;
    private String mappingMode;
    private String inheritance;
    private String table;
    private String schema;
    private String view;
    private String function;
    private String sqlQuery;
    private List<ColumnReport> columns;
    private String primaryKey;
    private List<String> keys;
    private List<String> foreignKeys;
    private List<String> indexes;
}
