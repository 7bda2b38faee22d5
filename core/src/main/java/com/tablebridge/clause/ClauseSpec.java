package com.tablebridge.clause;

import java.util.List;

/**
 * One independently specified fragment of query logic.
 *
 * <p>Clauses are supplied as an ordered sequence; order matters for the
 * projection columns the computed clauses contribute. The variants are:
 * <ul>
 *   <li>{@link Filter} - equality predicate, ANDed into WHERE</li>
 *   <li>{@link GroupBy} - grouping keys, accumulated across clauses</li>
 *   <li>{@link Having} - equality predicate, ANDed into HAVING</li>
 *   <li>{@link CaseProjection} - computed CASE WHEN column</li>
 *   <li>{@link CountProjection} - computed count column</li>
 *   <li>{@link WindowProjection} - computed windowed aggregate column</li>
 *   <li>{@link CteSpec} - named subquery; switches the query to raw-text mode</li>
 * </ul>
 */
public sealed interface ClauseSpec
    permits Filter, GroupBy, Having, CaseProjection, CountProjection, WindowProjection, CteSpec {

    /**
     * Returns every table column this clause refers to, in the order they
     * appear in the clause.
     *
     * @return the referenced column names
     */
    List<String> referencedColumns();

    /**
     * Returns the descriptor type name of this clause, as used in JSON
     * clause descriptors.
     *
     * @return the type name, e.g. "where" or "window_function"
     */
    String typeName();
}
