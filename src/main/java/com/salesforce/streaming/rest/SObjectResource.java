package com.salesforce.streaming.rest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.salesforce.streaming.model.SaveResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Record operations on one sObject type.
 */
@Slf4j
public class SObjectResource {

    // sObject collections accept at most 200 ids per request
    static final int MAX_COLLECTION_SIZE = 200;

    private static final TypeReference<SaveResult> SAVE_RESULT = new TypeReference<SaveResult>() {
    };
    private static final TypeReference<List<SaveResult>> SAVE_RESULTS = new TypeReference<List<SaveResult>>() {
    };

    private final Connection connection;
    private final String type;

    SObjectResource(Connection connection, String type) {
        this.connection = connection;
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public SaveResult create(Map<String, Object> fields) {
        RestInvoker rest = connection.rest();
        SaveResult result = rest.post(rest.dataPath("/sobjects/" + type + "/"), fields, SAVE_RESULT);
        log.debug("Created {} {}", type, result.getId());
        return result;
    }

    /**
     * Selects the records matching {@code where}. {@code fields} defaults to
     * {@code Id}.
     */
    public RecordQuery find(QueryConditions where, String... fields) {
        return new RecordQuery(this, where, fields, null);
    }

    public RecordQuery findOne(QueryConditions where, String... fields) {
        return new RecordQuery(this, where, fields, 1);
    }

    public void delete(String id) {
        RestInvoker rest = connection.rest();
        rest.delete(rest.dataPath("/sobjects/" + type + "/" + id), Map.of(), null);
        log.debug("Deleted {} {}", type, id);
    }

    /**
     * Deletes records by id through the sObject collections resource, 200
     * at a time. Failures of single records are reported in the results, not
     * thrown.
     */
    public List<SaveResult> destroy(List<String> ids) {
        List<SaveResult> results = new ArrayList<>();
        if (ids.isEmpty()) {
            return results;
        }
        RestInvoker rest = connection.rest();
        for (int from = 0; from < ids.size(); from += MAX_COLLECTION_SIZE) {
            List<String> chunk = ids.subList(from, Math.min(ids.size(), from + MAX_COLLECTION_SIZE));
            List<SaveResult> chunkResults = rest.delete(rest.dataPath("/composite/sobjects"),
                    Map.of("ids", String.join(",", chunk), "allOrNone", "false"), SAVE_RESULTS);
            if (chunkResults != null) {
                results.addAll(chunkResults);
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed > 0) {
            log.warn("{} of {} {} records could not be deleted", failed, ids.size(), type);
        } else {
            log.debug("Deleted {} {} records", ids.size(), type);
        }
        return results;
    }

    List<Map<String, Object>> query(String soql) {
        return connection.query(soql);
    }
}
