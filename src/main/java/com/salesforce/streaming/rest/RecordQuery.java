package com.salesforce.streaming.rest;

import com.salesforce.streaming.model.SaveResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A pending SOQL selection on one sObject type. Nothing is sent until
 * {@link #execute()}, {@link #first()} or one of the delete operations is
 * called.
 */
public class RecordQuery {

    private final SObjectResource resource;
    private final QueryConditions where;
    private final String[] fields;
    private final Integer limit;

    RecordQuery(SObjectResource resource, QueryConditions where, String[] fields, Integer limit) {
        this.resource = resource;
        this.where = where;
        this.fields = fields == null || fields.length == 0 ? new String[]{"Id"} : fields;
        this.limit = limit;
    }

    public String toSoql() {
        return toSoql(fields);
    }

    public List<Map<String, Object>> execute() {
        return resource.query(toSoql());
    }

    public Optional<Map<String, Object>> first() {
        return execute().stream().findFirst();
    }

    /**
     * Deletes every matching record. Returns an empty list when nothing
     * matched.
     */
    public List<SaveResult> destroy() {
        List<String> ids = resource.query(toSoql(new String[]{"Id"})).stream()
                .map(record -> (String) record.get("Id"))
                .collect(Collectors.toList());
        return resource.destroy(ids);
    }

    public List<SaveResult> delete() {
        return destroy();
    }

    private String toSoql(String[] selected) {
        StringBuilder soql = new StringBuilder("SELECT ")
                .append(String.join(", ", selected))
                .append(" FROM ")
                .append(resource.getType());
        if (where != null) {
            soql.append(" WHERE ").append(where.toSoql());
        }
        if (limit != null) {
            soql.append(" LIMIT ").append(limit);
        }
        return soql.toString();
    }
}
