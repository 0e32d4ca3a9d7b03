package com.example.retrieval.query;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds SOQL select statements.
 *
 * <p>Example usage:
 * <pre>{@code
 * Query query = SoqlQueryBuilder.select("Name", "pse__Account__r.Name")
 *     .from("pse__Proj__c")
 *     .where("pse__Opportunity__r.OpportunityNumber__c = " + SoqlQueryBuilder.literal("6615218"))
 *     .orderBy("Name")
 *     .build();
 * }</pre>
 *
 * Conditions added through {@link #where} are joined with {@code AND}. Builders are mutable
 * and not thread-safe; the built {@link Query} is immutable.
 */
public final class SoqlQueryBuilder {

    private final List<String> fields;
    private final List<String> conditions = new ArrayList<>();
    private String objectName;
    private String orderBy;

    private SoqlQueryBuilder(List<String> fields) {
        this.fields = fields;
    }

    public static SoqlQueryBuilder select(String... fields) {
        return select(Arrays.asList(fields));
    }

    public static SoqlQueryBuilder select(List<String> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("at least one field must be selected");
        }
        return new SoqlQueryBuilder(List.copyOf(fields));
    }

    public SoqlQueryBuilder from(String objectName) {
        this.objectName = objectName;
        return this;
    }

    public SoqlQueryBuilder where(String condition) {
        conditions.add(condition);
        return this;
    }

    public SoqlQueryBuilder where(List<String> conditions) {
        this.conditions.addAll(conditions);
        return this;
    }

    public SoqlQueryBuilder orderBy(String field) {
        this.orderBy = field;
        return this;
    }

    public Query build() {
        if (objectName == null || objectName.isBlank()) {
            throw new IllegalStateException("from(...) must be set before build()");
        }

        StringBuilder soql = new StringBuilder("SELECT ")
                .append(String.join(",", fields))
                .append(" FROM ")
                .append(objectName);
        if (!conditions.isEmpty()) {
            soql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (orderBy != null) {
            soql.append(" ORDER BY ").append(orderBy);
        }
        return new Query(soql.toString());
    }

    /**
     * Quotes a string literal, escaping backslashes and single quotes.
     */
    public static String literal(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Formats a date literal (unquoted {@code yyyy-MM-dd}).
     */
    public static String literal(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
