package com.tablebridge.generator;

import com.tablebridge.clause.CteSpec;
import com.tablebridge.expression.Expression;
import com.tablebridge.expression.ParameterBinder;
import com.tablebridge.query.ComposedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.tablebridge.generator.SQLQuoting.quoteIdentifierIfNeeded;

/**
 * Renders a {@link ComposedQuery} into executable SQL.
 *
 * <p>Parameterized queries render as:
 * <pre>
 * SELECT projection FROM schema.table
 * [WHERE term AND term ...]
 * [GROUP BY key, key ...]
 * [HAVING term AND term ...]
 * </pre>
 * with every literal bound as a {@code ?} placeholder in text order. HAVING
 * is only emitted together with GROUP BY; ungrouped having terms are ANDed
 * after the filter terms in WHERE.
 *
 * <p>Raw-text queries render as:
 * <pre>
 * WITH name AS (SELECT columns tail), ... SELECT projection FROM schema.table
 * </pre>
 * with literals inlined. Filter, GroupBy and Having clauses are not part of
 * a raw-text statement.
 *
 * <p>The generator is stateless and may be shared.
 */
public class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    /**
     * Generates the statement for a composed query.
     *
     * @param query the composed query
     * @return the SQL text and its bound parameters
     */
    public RenderedStatement generate(ComposedQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        ParameterBinder binder = query.isRawText() ? ParameterBinder.inline() : ParameterBinder.parameterized();
        StringBuilder sql = new StringBuilder();

        if (query.isRawText() && !query.ctes().isEmpty()) {
            sql.append("WITH ");
            List<String> ctes = new ArrayList<>();
            for (CteSpec cte : query.ctes()) {
                ctes.add(renderCte(cte));
            }
            sql.append(String.join(", ", ctes)).append(" ");
        }

        sql.append("SELECT ");
        sql.append(join(query.projection(), ", ", binder));
        sql.append(" FROM ").append(query.table().toSQL());

        // Without grouping keys, having terms filter rows like WHERE terms
        boolean grouped = !query.groupBy().isEmpty();
        List<Expression> where = new ArrayList<>(query.filter());
        if (!grouped) {
            where.addAll(query.having());
        }

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(join(where, " AND ", binder));
        }

        if (grouped) {
            sql.append(" GROUP BY ").append(join(query.groupBy(), ", ", binder));
            if (!query.having().isEmpty()) {
                sql.append(" HAVING ").append(join(query.having(), " AND ", binder));
            }
        }

        String result = sql.toString();
        logger.debug("Generated {} SQL: {}", query.mode(), result);
        return new RenderedStatement(result, binder.parameters(), query.mode());
    }

    /**
     * Renders one CTE as {@code name AS (SELECT columns tail)}.
     */
    private static String renderCte(CteSpec cte) {
        List<String> columns = new ArrayList<>();
        for (String column : cte.columns()) {
            columns.add(quoteIdentifierIfNeeded(column));
        }

        StringBuilder sql = new StringBuilder();
        sql.append(cte.name()).append(" AS (SELECT ").append(String.join(", ", columns));
        String tail = cte.queryTail().trim();
        if (!tail.isEmpty()) {
            sql.append(" ").append(tail);
        }
        return sql.append(")").toString();
    }

    private static String join(List<? extends Expression> expressions, String separator, ParameterBinder binder) {
        List<String> parts = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            parts.add(expression.toSQL(binder));
        }
        return String.join(separator, parts);
    }
}
