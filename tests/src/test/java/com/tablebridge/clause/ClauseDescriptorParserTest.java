package com.tablebridge.clause;

import com.tablebridge.test.TestBase;
import com.tablebridge.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for parsing JSON clause descriptors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ClauseDescriptorParser Tests")
public class ClauseDescriptorParserTest extends TestBase {

    @Test
    @DisplayName("Every descriptor type parses into its clause, in input order")
    void testParsesAllTypes() {
        String json = "[" +
            "{\"type\": \"where\", \"column\": \"col1\", \"operator\": \"=\", \"value\": \"foo\"}," +
            "{\"type\": \"group_by\", \"columns\": [\"col2\"]}," +
            "{\"type\": \"having\", \"column\": \"col2\", \"operator\": \"==\", \"value\": \"bar\"}," +
            "{\"type\": \"case_if\", \"column\": \"flag\"," +
            " \"conditions\": [{\"column\": \"col1\", \"value\": \"foo\", \"result\": \"yes\"}]," +
            " \"default\": \"no\"}," +
            "{\"type\": \"count\", \"column\": \"amount\"}," +
            "{\"type\": \"window_function\", \"function\": \"rank\", \"column\": \"col1\"," +
            " \"output_name\": \"rank\", \"partition_by\": [\"col2\"], \"order_by\": [\"col1\"]}," +
            "{\"type\": \"cte\", \"name\": \"recent\", \"columns\": [\"col1\"], \"query\": \"FROM s.t\"}" +
            "]";

        List<ClauseSpec> clauses = ClauseDescriptorParser.parse(json);
        logData("Parsed clauses", clauses);

        assertThat(clauses).containsExactly(
            Filter.equal("col1", "foo"),
            GroupBy.of("col2"),
            Having.equal("col2", "bar"),
            new CaseProjection("flag", List.of(new CaseCondition("col1", "foo", "yes")), "no"),
            new CountProjection("amount"),
            new WindowProjection("rank", "rank", "col1", List.of("col2"), List.of("col1")),
            new CteSpec("recent", List.of("col1"), "FROM s.t"));
    }

    @Test
    @DisplayName("Window output name defaults to the argument column")
    void testWindowOutputNameDefault() {
        List<ClauseSpec> clauses = ClauseDescriptorParser.parse(
            "[{\"type\": \"window_function\", \"function\": \"sum\", \"column\": \"amount\"}]");

        assertThat(clauses).containsExactly(new WindowProjection("amount", "sum", "amount", null, null));
    }

    @Test
    @DisplayName("Scalar values keep their JSON types")
    void testValueTypes() {
        List<ClauseSpec> clauses = ClauseDescriptorParser.parse("[" +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": 42}," +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": 9000000000}," +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": true}," +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": null}," +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\"}," +
            "{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": 1.25}" +
            "]");

        assertThat(((Filter) clauses.get(0)).value()).isEqualTo(42);
        assertThat(((Filter) clauses.get(1)).value()).isEqualTo(9000000000L);
        assertThat(((Filter) clauses.get(2)).value()).isEqualTo(true);
        assertThat(((Filter) clauses.get(3)).value()).isNull();
        assertThat(((Filter) clauses.get(4)).value()).isNull();
        assertThat(((Filter) clauses.get(5)).value()).isEqualTo(1.25d);
    }

    @Test
    @DisplayName("Integers beyond the long range become decimals")
    void testOversizedInteger() {
        Filter filter = (Filter) ClauseDescriptorParser.parse(
            "[{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": 99999999999999999999}]").get(0);

        assertThat(filter.value()).isEqualTo(new BigDecimal("99999999999999999999"));
    }

    @Test
    @DisplayName("CASE default may be omitted")
    void testCaseWithoutDefault() {
        CaseProjection clause = (CaseProjection) ClauseDescriptorParser.parse(
            "[{\"type\": \"case_if\", \"column\": \"flag\"," +
            " \"conditions\": [{\"column\": \"col1\", \"value\": null, \"result\": 1}]}]").get(0);

        assertThat(clause.defaultValue()).isNull();
        assertThat(clause.conditions().get(0).value()).isNull();
        assertThat(clause.conditions().get(0).result()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown type is rejected with its position")
    void testUnknownType() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"count\", \"column\": \"a\"}, {\"type\": \"order_by\", \"columns\": [\"a\"]}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 1")
            .hasMessageContaining("order_by");
    }

    @Test
    @DisplayName("Missing fields are rejected")
    void testMissingFields() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[{\"type\": \"count\"}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'column'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[{\"column\": \"a\"}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'type'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"case_if\", \"column\": \"flag\", \"conditions\": [{\"column\": \"a\"}]}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'value'");
    }

    @Test
    @DisplayName("Explicit nulls in required fields are rejected with their position")
    void testNullRequiredFields() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[{\"type\": \"count\", \"column\": null}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 0")
            .hasMessageContaining("'column'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[{\"type\": \"group_by\", \"columns\": null}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing array field 'columns'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"where\", \"column\": \"a\", \"operator\": null, \"value\": 1}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'operator'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"window_function\", \"function\": null, \"column\": \"a\"}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'function'");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[null]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("Unsupported operators are rejected")
    void testUnsupportedOperator() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"where\", \"column\": \"a\", \"operator\": \"<\", \"value\": 1}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 0");
    }

    @Test
    @DisplayName("Malformed JSON and non-array input are rejected")
    void testMalformedInput() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("[{"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClauseDescriptorParser.parse("{\"type\": \"count\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("array");
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Non-scalar values are rejected")
    void testNonScalarValue() {
        assertThatThrownBy(() -> ClauseDescriptorParser.parse(
                "[{\"type\": \"where\", \"column\": \"a\", \"operator\": \"=\", \"value\": [1, 2]}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scalars");
    }

    @Test
    @DisplayName("Empty array yields no clauses")
    void testEmptyArray() {
        assertThat(ClauseDescriptorParser.parse("[]")).isEmpty();
        assertThat(ClauseDescriptorParser.toValue(null)).isNull();
    }
}
