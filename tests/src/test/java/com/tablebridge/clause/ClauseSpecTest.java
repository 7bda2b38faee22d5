package com.tablebridge.clause;

import com.tablebridge.test.TestBase;
import com.tablebridge.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the clause variants: construction rules and referenced columns.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Clause Model Tests")
public class ClauseSpecTest extends TestBase {

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("Equality operator text is accepted in both spellings")
        void testEqualitySpellings() {
            assertThat(Filter.of("col1", "=", "foo").operator()).isEqualTo(ComparisonOperator.EQUAL);
            assertThat(Filter.of("col1", "==", "foo").operator()).isEqualTo(ComparisonOperator.EQUAL);
            assertThat(Having.of("col1", " = ", 1).operator()).isEqualTo(ComparisonOperator.EQUAL);
        }

        @Test
        @DisplayName("Other operators are rejected, not treated as equality")
        void testUnsupportedOperator() {
            assertThatThrownBy(() -> Filter.of("col1", ">", 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'>'");
            assertThatThrownBy(() -> Having.of("col1", "!=", 3))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ComparisonOperator.fromSymbol(null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Null comparison values are allowed")
        void testNullValue() {
            Filter filter = Filter.equal("col1", null);

            assertThat(filter.value()).isNull();
            assertThat(filter.referencedColumns()).containsExactly("col1");
            assertThat(filter.typeName()).isEqualTo("where");
        }
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("GroupBy keeps key order and copies its input")
        void testGroupByCopies() {
            List<String> keys = new ArrayList<>(List.of("col2", "col1"));
            GroupBy groupBy = new GroupBy(keys);
            keys.add("amount");

            assertThat(groupBy.columns()).containsExactly("col2", "col1");
            assertThat(groupBy.referencedColumns()).containsExactly("col2", "col1");
        }

        @Test
        @DisplayName("Empty GroupBy is rejected")
        void testEmptyGroupBy() {
            assertThatThrownBy(() -> new GroupBy(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Computed columns")
    class ComputedColumns {

        @Test
        @DisplayName("CaseProjection references every condition column")
        void testCaseReferencedColumns() {
            CaseProjection clause = new CaseProjection("flag", List.of(
                new CaseCondition("col1", "foo", "yes"),
                new CaseCondition("col2", "bar", "maybe")), "no");

            assertThat(clause.referencedColumns()).containsExactly("col1", "col2");
            assertThat(clause.typeName()).isEqualTo("case_if");
        }

        @Test
        @DisplayName("CaseProjection needs at least one condition")
        void testCaseWithoutConditions() {
            assertThatThrownBy(() -> new CaseProjection("flag", List.of(), "no"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("WindowProjection references argument, partition and order columns")
        void testWindowReferencedColumns() {
            WindowProjection clause = new WindowProjection("r", "rank", "col1", List.of("col2"), List.of("amount"));

            assertThat(clause.referencedColumns()).containsExactly("col1", "col2", "amount");
        }

        @Test
        @DisplayName("WindowProjection treats missing lists as empty")
        void testWindowNullLists() {
            WindowProjection clause = new WindowProjection("total", "sum", "amount", null, null);

            assertThat(clause.partitionBy()).isEmpty();
            assertThat(clause.orderBy()).isEmpty();
        }

        @Test
        @DisplayName("Window function names must be plain identifiers")
        void testWindowFunctionName() {
            assertThatThrownBy(() -> new WindowProjection("r", "rank() over (); drop table x; --",
                                                          "col1", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Common table expressions")
    class CommonTableExpressions {

        @Test
        @DisplayName("CTE names must be plain identifiers")
        void testCteName() {
            assertThatThrownBy(() -> new CteSpec("bad name", List.of("col1"), "FROM t"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("CTE needs at least one column")
        void testCteColumns() {
            assertThatThrownBy(() -> new CteSpec("recent", List.of(), "FROM t"))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(new CteSpec("recent", List.of("col1"), "").referencedColumns()).containsExactly("col1");
        }
    }
}
