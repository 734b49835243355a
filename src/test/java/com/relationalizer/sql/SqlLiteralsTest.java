package com.relationalizer.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SqlLiterals, SqlIdentifiers and InsertStatement rendering.
 */
class SqlLiteralsTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void testScalarLiterals() {
        assertThat(SqlLiterals.literal(NODES.textNode("O'Brien"))).isEqualTo("'O''Brien'");
        assertThat(SqlLiterals.literal(NODES.numberNode(42L))).isEqualTo("42");
        assertThat(SqlLiterals.literal(NODES.numberNode(new BigDecimal("1.5")))).isEqualTo("1.5");
        assertThat(SqlLiterals.literal(NODES.booleanNode(true))).isEqualTo("1");
        assertThat(SqlLiterals.literal(NODES.booleanNode(false))).isEqualTo("0");
        assertThat(SqlLiterals.literal(NODES.nullNode())).isEqualTo("NULL");
        assertThat(SqlLiterals.literal(null)).isEqualTo("NULL");
    }

    @Test
    void testIdentifierQuoting() {
        assertThat(SqlIdentifiers.quote("Phones")).isEqualTo("Phones");
        assertThat(SqlIdentifiers.quote("Property_Address_City")).isEqualTo("Property_Address_City");
        assertThat(SqlIdentifiers.quote("order")).isEqualTo("\"order\"");
        assertThat(SqlIdentifiers.quote("Sq Ft")).isEqualTo("\"Sq Ft\"");
        assertThat(SqlIdentifiers.quote("1st")).isEqualTo("\"1st\"");
        assertThat(SqlIdentifiers.quote("a\"b")).isEqualTo("\"a\"\"b\"");
        assertThat(SqlIdentifiers.isKeyword("Select")).isTrue();
        assertThat(SqlIdentifiers.isKeyword("Listings")).isFalse();
    }

    @Test
    void testInsertOrIgnoreRendering() {
        List<JsonNode> values = List.of(NODES.textNode("A"), NODES.textNode("[]"));
        InsertStatement insert = new InsertStatement("Listings", List.of("Id", "Phones"), values);

        assertThat(insert.toSql()).isEqualTo("INSERT OR IGNORE INTO Listings (Id, Phones) VALUES ('A', '[]');");
        assertThat(insert.toParameterizedSql()).isEqualTo("INSERT OR IGNORE INTO Listings (Id, Phones) VALUES (?, ?)");
    }

    @Test
    void testInsertQuotesKeywordTable() {
        InsertStatement insert = new InsertStatement("Group", List.of("Order"), List.of(NODES.numberNode(1)));

        assertThat(insert.toSql()).isEqualTo("INSERT OR IGNORE INTO \"Group\" (\"Order\") VALUES (1);");
    }
}
