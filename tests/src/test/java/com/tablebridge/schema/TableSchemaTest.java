package com.tablebridge.schema;

import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.test.TestBase;
import com.tablebridge.test.TestCategories;
import com.tablebridge.test.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TableSchema Tests")
public class TableSchemaTest extends TestBase {

    @Test
    @DisplayName("Column lookup is exact and case-sensitive")
    void testColumnLookup() {
        TableSchema schema = TestSchemas.sample();

        assertThat(schema.column("col1").name()).isEqualTo("col1");
        assertThat(schema.hasColumn("COL1")).isFalse();
        assertThatThrownBy(() -> schema.column("COL1"))
            .isInstanceOf(UnknownColumnException.class)
            .satisfies(e -> {
                UnknownColumnException ex = (UnknownColumnException) e;
                assertThat(ex.getColumnName()).isEqualTo("COL1");
                assertThat(ex.getTableName()).isEqualTo("schema_name.table_name");
            });
    }

    @Test
    @DisplayName("Duplicate column names are rejected")
    void testDuplicateColumns() {
        assertThatThrownBy(() -> new TableSchema("s", "t", List.of(
                new ColumnRef("a", ColumnType.INTEGER, true),
                new ColumnRef("a", ColumnType.VARCHAR, true))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate column: a");
    }

    @Test
    @DisplayName("Table reference quotes reserved and unusual names")
    void testToSQL() {
        assertThat(TestSchemas.sample().toSQL()).isEqualTo("schema_name.table_name");
        assertThat(new TableSchema("sales", "order", List.of(new ColumnRef("id", ColumnType.INTEGER, false)))
            .toSQL()).isEqualTo("sales.\"order\"");
        assertThat(new TableSchema("my schema", "t", List.of(new ColumnRef("id", ColumnType.INTEGER, false)))
            .toSQL()).isEqualTo("\"my schema\".t");
    }

    @Test
    @DisplayName("Schemas with the same columns are equal")
    void testEquality() {
        assertThat(TestSchemas.sample()).isEqualTo(TestSchemas.sample());
        assertThat(TestSchemas.sample().hashCode()).isEqualTo(TestSchemas.sample().hashCode());
        assertThat(TestSchemas.sample()).isNotEqualTo(TestSchemas.twoColumns());
    }
}
