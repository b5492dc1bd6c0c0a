package com.wikisqldump;

import java.util.Collection;

public class UnsupportedTableException extends DumpConversionException {

    private final String tableName;

    public UnsupportedTableException(String tableName, Collection<String> supported) {
        super("Table " + tableName + " is not supported, expected one of " + supported);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
