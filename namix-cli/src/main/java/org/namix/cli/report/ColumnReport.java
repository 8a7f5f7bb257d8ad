package org.namix.cli.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor(access = AccessLevel.PUBLIC)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ColumnReport {
    private String property;
    private String column;

    /**
     * Column names at store objects other than the table, keyed by {@code TYPE:name}.
     */
    private Map<String, String> storeObjectColumns;
}
