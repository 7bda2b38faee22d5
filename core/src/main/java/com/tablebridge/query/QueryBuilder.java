package com.tablebridge.query;

import com.tablebridge.clause.CaseCondition;
import com.tablebridge.clause.CaseProjection;
import com.tablebridge.clause.ClauseSpec;
import com.tablebridge.clause.CountProjection;
import com.tablebridge.clause.CteSpec;
import com.tablebridge.clause.Filter;
import com.tablebridge.clause.GroupBy;
import com.tablebridge.clause.Having;
import com.tablebridge.clause.WindowProjection;
import com.tablebridge.exception.EmptyProjectionException;
import com.tablebridge.exception.UnknownColumnException;
import com.tablebridge.expression.AliasExpression;
import com.tablebridge.expression.CaseWhenExpression;
import com.tablebridge.expression.ColumnExpression;
import com.tablebridge.expression.ComparisonExpression;
import com.tablebridge.expression.Expression;
import com.tablebridge.expression.FunctionCall;
import com.tablebridge.expression.Literal;
import com.tablebridge.expression.WindowFunction;
import com.tablebridge.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds base columns and an ordered sequence of clauses into one
 * {@link ComposedQuery}.
 *
 * <p>Building happens in three steps:
 * <ol>
 *   <li>every column named by the base columns and by each clause, in that
 *       order, is looked up in the schema; the first unknown one fails the
 *       build with {@link UnknownColumnException}</li>
 *   <li>the base columns become pass-through projection columns</li>
 *   <li>clauses are folded left to right: predicates are ANDed, grouping
 *       keys accumulate, computed columns are appended in clause order</li>
 * </ol>
 *
 * <p>A {@link CteSpec} anywhere in the sequence switches the whole query to
 * {@link ExecutionMode#RAW_TEXT}. In that mode Filter, GroupBy and Having
 * clauses are validated but not merged into the statement; they are reported
 * through {@link ComposedQuery#excludedClauses()}.
 *
 * <p>The builder holds no state; building is deterministic.
 */
public class QueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    /**
     * Builds a composed query.
     *
     * @param schema the resolved table schema
     * @param baseColumns the base projection columns, in output order
     * @param clauses the clauses, in fold order
     * @return the composed query
     * @throws UnknownColumnException if any referenced column is not in the schema
     * @throws EmptyProjectionException if no column would be selected
     */
    public ComposedQuery build(TableSchema schema, List<String> baseColumns, List<? extends ClauseSpec> clauses) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(baseColumns, "baseColumns must not be null");
        Objects.requireNonNull(clauses, "clauses must not be null");

        validateColumns(schema, baseColumns, clauses);

        boolean rawText = false;
        for (ClauseSpec clause : clauses) {
            if (clause instanceof CteSpec) {
                rawText = true;
                break;
            }
        }

        List<AliasExpression> projection = new ArrayList<>();
        for (String name : baseColumns) {
            projection.add(new AliasExpression(column(schema, name), name));
        }

        List<CteSpec> ctes = new ArrayList<>();
        List<Expression> filter = new ArrayList<>();
        List<ColumnExpression> groupBy = new ArrayList<>();
        List<Expression> having = new ArrayList<>();
        List<ClauseSpec> excluded = new ArrayList<>();

        for (ClauseSpec clause : clauses) {
            if (clause instanceof Filter f) {
                if (rawText) {
                    excluded.add(f);
                } else {
                    filter.add(new ComparisonExpression(column(schema, f.column()), f.operator(), Literal.of(f.value())));
                }
            } else if (clause instanceof GroupBy g) {
                if (rawText) {
                    excluded.add(g);
                } else {
                    for (String name : g.columns()) {
                        groupBy.add(column(schema, name));
                    }
                }
            } else if (clause instanceof Having h) {
                if (rawText) {
                    excluded.add(h);
                } else {
                    having.add(new ComparisonExpression(column(schema, h.column()), h.operator(), Literal.of(h.value())));
                }
            } else if (clause instanceof CaseProjection c) {
                projection.add(new AliasExpression(caseExpression(schema, c), c.outputName()));
            } else if (clause instanceof CountProjection c) {
                projection.add(new AliasExpression(FunctionCall.count(column(schema, c.column())), c.column()));
            } else if (clause instanceof WindowProjection w) {
                projection.add(new AliasExpression(windowExpression(schema, w), w.outputName()));
            } else if (clause instanceof CteSpec cte) {
                ctes.add(cte);
            } else {
                throw new IllegalStateException("Unhandled clause type: " + clause.getClass().getName());
            }
        }

        if (projection.isEmpty()) {
            throw new EmptyProjectionException(schema.qualifiedName());
        }

        if (!excluded.isEmpty()) {
            logger.warn("CTE present: {} filter/group/having clause(s) on {} are validated but not applied " +
                        "to the raw-text statement", excluded.size(), schema.qualifiedName());
        }

        ComposedQuery query = new ComposedQuery(
            schema,
            projection,
            ctes,
            filter,
            groupBy,
            having,
            rawText ? ExecutionMode.RAW_TEXT : ExecutionMode.PARAMETERIZED,
            excluded);

        List<String> duplicates = query.duplicateProjectionNames();
        if (!duplicates.isEmpty()) {
            logger.warn("Output column(s) {} on {} appear more than once; result rows keep only the last value",
                        duplicates, schema.qualifiedName());
        }
        return query;
    }

    /**
     * Checks every referenced column before anything is folded.
     */
    private static void validateColumns(TableSchema schema, List<String> baseColumns,
                                        List<? extends ClauseSpec> clauses) {
        for (String name : baseColumns) {
            schema.column(name);
        }
        for (ClauseSpec clause : clauses) {
            Objects.requireNonNull(clause, "clauses must not contain null");
            for (String name : clause.referencedColumns()) {
                schema.column(name);
            }
        }
    }

    private static ColumnExpression column(TableSchema schema, String name) {
        return new ColumnExpression(schema.column(name));
    }

    private static CaseWhenExpression caseExpression(TableSchema schema, CaseProjection clause) {
        List<Expression> conditions = new ArrayList<>();
        List<Expression> results = new ArrayList<>();
        for (CaseCondition condition : clause.conditions()) {
            conditions.add(ComparisonExpression.equal(column(schema, condition.column()), condition.value()));
            results.add(Literal.typed(condition.result()));
        }
        Expression otherwise = clause.defaultValue() == null ? null : Literal.typed(clause.defaultValue());
        return new CaseWhenExpression(conditions, results, otherwise);
    }

    private static WindowFunction windowExpression(TableSchema schema, WindowProjection clause) {
        List<Expression> arguments = WindowFunction.isRankingFunction(clause.functionName())
            ? List.of()
            : List.of(column(schema, clause.column()));

        List<Expression> partitionBy = new ArrayList<>();
        List<Expression> orderBy = new ArrayList<>();

        if (!clause.orderBy().isEmpty()) {
            for (String name : clause.orderBy()) {
                orderBy.add(column(schema, name));
            }
            for (String name : clause.partitionBy()) {
                partitionBy.add(column(schema, name));
            }
        } else if (!clause.partitionBy().isEmpty()) {
            logger.warn("Window {} on {}: partition_by without order_by is not applied, using an empty window",
                        clause.outputName(), schema.qualifiedName());
        }

        return new WindowFunction(clause.functionName(), arguments, partitionBy, orderBy);
    }
}
