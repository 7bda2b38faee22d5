package com.tablebridge.query;

import com.tablebridge.clause.Filter;
import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.generator.RenderedStatement;
import com.tablebridge.schema.TableSchema;
import com.tablebridge.test.TestBase;
import com.tablebridge.test.TestCategories;
import com.tablebridge.test.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("MutationBuilder Tests")
public class MutationBuilderTest extends TestBase {

    private final MutationBuilder builder = new MutationBuilder();
    private final TableSchema schema = TestSchemas.sample();

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            row.put((String) pairs[i], pairs[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("Insert lists columns in map order with one placeholder each")
    void testInsert() {
        RenderedStatement statement = builder.insert(schema, row("col1", "a", "amount", 3, "col2", null));

        assertThat(statement.sql())
            .isEqualTo("INSERT INTO schema_name.table_name (col1, amount, col2) VALUES (?, ?, NULL)");
        assertThat(statement.parameters()).containsExactly("a", 3);
        assertThat(statement.mode()).isEqualTo(ExecutionMode.PARAMETERIZED);
    }

    @Test
    @DisplayName("Insert of an empty row is rejected")
    void testInsertEmptyRow() {
        assertThatThrownBy(() -> builder.insert(schema, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Insert validates every column")
    void testInsertUnknownColumn() {
        assertThatThrownBy(() -> builder.insert(schema, row("col1", "a", "ghost", 1)))
            .isInstanceOf(UnknownColumnException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("Update sets values and filters with ANDed equality")
    void testUpdate() {
        RenderedStatement statement = builder.update(schema, row("amount", 10, "col2", "z"),
            List.of(Filter.equal("col1", "a"), Filter.equal("col2", null)));

        assertThat(statement.sql()).isEqualTo(
            "UPDATE schema_name.table_name SET amount = ?, col2 = ? WHERE col1 = ? AND col2 IS NULL");
        assertThat(statement.parameters()).containsExactly(10, "z", "a");
    }

    @Test
    @DisplayName("Update without filters affects the whole table")
    void testUpdateWithoutFilters() {
        RenderedStatement statement = builder.update(schema, row("amount", 0), List.of());

        assertThat(statement.sql()).isEqualTo("UPDATE schema_name.table_name SET amount = ?");
    }

    @Test
    @DisplayName("Update with nothing to set is rejected")
    void testUpdateNothingToSet() {
        assertThatThrownBy(() -> builder.update(schema, Map.of(), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unknown filter column fails before any SQL is produced")
    void testUnknownFilterColumn() {
        assertThatThrownBy(() -> builder.update(schema, row("amount", 1), List.of(Filter.equal("ghost", 1))))
            .isInstanceOf(UnknownColumnException.class);
        assertThatThrownBy(() -> builder.delete(schema, List.of(Filter.equal("ghost", 1))))
            .isInstanceOf(UnknownColumnException.class);
    }

    @Test
    @DisplayName("Delete with and without filters")
    void testDelete() {
        RenderedStatement filtered = builder.delete(schema, List.of(Filter.equal("col1", "a")));
        RenderedStatement all = builder.delete(schema, List.of());

        assertThat(filtered.sql()).isEqualTo("DELETE FROM schema_name.table_name WHERE col1 = ?");
        assertThat(filtered.parameters()).containsExactly("a");
        assertThat(all.sql()).isEqualTo("DELETE FROM schema_name.table_name");
        assertThat(all.parameters()).isEmpty();
    }
}
