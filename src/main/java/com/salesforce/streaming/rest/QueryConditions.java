package com.salesforce.streaming.rest;

import java.util.Arrays;
import java.util.Collection;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A SOQL {@code WHERE} clause built from field conditions. Values are
 * rendered as SOQL literals with quotes and backslashes escaped.
 */
public final class QueryConditions {

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final String clause;

    private QueryConditions(String clause) {
        this.clause = clause;
    }

    public static QueryConditions eq(String field, Object value) {
        return new QueryConditions(field(field) + " = " + literal(value));
    }

    public static QueryConditions in(String field, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN condition on " + field + " needs at least one value");
        }
        String list = values.stream().map(QueryConditions::literal).collect(Collectors.joining(", "));
        return new QueryConditions(field(field) + " IN (" + list + ")");
    }

    public static QueryConditions all(QueryConditions... conditions) {
        if (conditions.length == 0) {
            throw new IllegalArgumentException("No conditions given");
        }
        if (conditions.length == 1) {
            return conditions[0];
        }
        return new QueryConditions(Arrays.stream(conditions)
                .map(c -> "(" + c.clause + ")")
                .collect(Collectors.joining(" AND ")));
    }

    public QueryConditions and(QueryConditions other) {
        return all(this, other);
    }

    public String toSoql() {
        return clause;
    }

    @Override
    public String toString() {
        return clause;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        String escaped = value.toString()
                .replace("\\", "\\\\")
                .replace("'", "\\'");
        return "'" + escaped + "'";
    }

    private static String field(String name) {
        if (name == null || !FIELD_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid field name: " + name);
        }
        return name;
    }
}
