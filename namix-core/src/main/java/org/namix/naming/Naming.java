package org.namix.naming;

import java.util.List;

/**
 * Default (unrewritten) names of relational schema objects.
 * The values produced here are what a {@link NameRewriter} is applied to.
 */
public interface Naming {

    /**
     * Primary key constraint name, e.g. {@code PK_Orders}.
     */
    String pkName(String tableName);

    /**
     * Alternate key constraint name, e.g. {@code AK_Orders_Number}.
     */
    String akName(String tableName, List<String> columns);

    /**
     * Foreign key constraint name.
     * Only the dependent columns are reflected in the name.
     *
     * @param tableName table the foreign key is created on
     * @param principalTableName referenced table
     * @param columns dependent column names, in key order
     * @return e.g. {@code FK_Orders_Customers_CustomerId}
     */
    String fkName(String tableName, String principalTableName, List<String> columns);

    /**
     * Index name, e.g. {@code IX_Orders_CustomerId}.
     */
    String ixName(String tableName, List<String> columns);

    /**
     * Clamps an identifier to the maximum identifier length.
     */
    String truncate(String name);
}
