package com.relationalizer.sql;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import lombok.Value;

/**
 * One observed price of a listing. It is inserted into {@code PriceHistory} only when the listing
 * has no history yet, or when its latest recorded price differs and is older than this
 * observation. Replaying the statement never adds a row.
 */
@Value
public class PriceChange {
    String keyColumn;
    JsonNode key;
    JsonNode price;
    /** ISO date, {@code yyyy-MM-dd}. */
    String date;

    public String toSql() {
        String sql = toParameterizedSql();
        StringBuilder sb = new StringBuilder();
        int next = 0;
        for (JsonNode parameter : getParameters()) {
            int mark = sql.indexOf('?', next);
            sb.append(sql, next, mark).append(SqlLiterals.literal(parameter));
            next = mark + 1;
        }
        return sb.append(sql.substring(next)).append(';').toString();
    }

    /**
     * Conditional insert with {@code ?} placeholders for {@link #getParameters()}.
     */
    public String toParameterizedSql() {
        String table = SqlIdentifiers.quote(PriceHistory.TABLE);
        String keyName = SqlIdentifiers.quote(keyColumn);
        return "INSERT INTO " + table + " (" + keyName + ", Price, Date) SELECT "
                + String.join(", ", Collections.nCopies(3, "?"))
                + " WHERE NOT EXISTS (SELECT 1 FROM " + table + " WHERE " + keyName + " = ?"
                + " AND Date = (SELECT MAX(Date) FROM " + table + " WHERE " + keyName + " = ?)"
                + " AND (Price = ? OR Date >= ?))";
    }

    public List<JsonNode> getParameters() {
        JsonNode dateNode = JsonNodeFactory.instance.textNode(date);
        return List.of(key, price, dateNode, key, key, price, dateNode);
    }
}
