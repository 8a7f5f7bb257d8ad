package org.namix.model;

public enum StoreObjectType {
    TABLE,
    VIEW,
    FUNCTION,
    SQL_QUERY
}
