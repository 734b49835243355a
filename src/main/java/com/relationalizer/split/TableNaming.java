package com.relationalizer.split;

import java.util.List;

/**
 * Names of tables extracted from lists, shared by schema and row traversal.
 */
final class TableNaming {

    private TableNaming() {
        // Utility class
    }

    /**
     * A list becomes a table named after its key. A key equal to the root table name is
     * prefixed with the owning table and the flattened path to the list.
     */
    static String childTableName(String rootTableName, String ownerTable, List<String> pathInOwner) {
        String key = pathInOwner.get(pathInOwner.size() - 1);
        if (!key.equalsIgnoreCase(rootTableName)) {
            return key;
        }
        return ownerTable + ColumnNamer.SEPARATOR + String.join(ColumnNamer.SEPARATOR, pathInOwner);
    }
}
