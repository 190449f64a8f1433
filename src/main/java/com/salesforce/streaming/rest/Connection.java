package com.salesforce.streaming.rest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.bayeux.StreamingClient;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.model.QueryResult;
import com.salesforce.streaming.model.SessionInfo;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.client.HttpClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An authenticated session against one org: record operations through
 * {@link #sobject(String)} and the Streaming API through {@link #streaming()}.
 * A connection is created unauthenticated and becomes usable once a session
 * is attached.
 */
@Slf4j
public class Connection implements AutoCloseable {

    private static final TypeReference<QueryResult> QUERY_RESULT = new TypeReference<QueryResult>() {
    };

    private final SalesforceConfig config;
    private final AtomicReference<SessionInfo> session = new AtomicReference<>();
    private final RestInvoker rest;
    private final StreamingClient streaming;
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    public Connection(SalesforceConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.rest = new RestInvoker(httpClient, objectMapper, this::getSessionInfo,
                config.getApi().getVersion(), config.getApi().getRequestTimeout());
        this.streaming = new StreamingClient(this, config.getStreaming(), httpClient, objectMapper);
    }

    public void attach(SessionInfo sessionInfo) {
        SessionInfo previous = session.getAndSet(sessionInfo);
        if (previous == null) {
            log.info("Connection established. Instance: {}, Org ID: {}",
                    sessionInfo.getInstanceUrl(), sessionInfo.getOrganizationId());
        } else {
            log.info("Session refreshed for instance {}", sessionInfo.getInstanceUrl());
        }
    }

    public boolean isEstablished() {
        return session.get() != null;
    }

    public SessionInfo getSessionInfo() {
        SessionInfo current = session.get();
        if (current == null) {
            throw new IllegalStateException("Not authenticated. Call establishConnection() first.");
        }
        return current;
    }

    public String getApiVersion() {
        return config.getApi().getVersion();
    }

    public SObjectResource sobject(String type) {
        return new SObjectResource(this, type);
    }

    public StreamingClient streaming() {
        return streaming;
    }

    public RestInvoker rest() {
        return rest;
    }

    /**
     * Runs a SOQL query and follows {@code nextRecordsUrl} until every batch
     * is read.
     */
    public List<Map<String, Object>> query(String soql) {
        log.debug("Query: {}", soql);
        QueryResult page = rest.get(rest.dataPath("/query"), Map.of("q", soql), QUERY_RESULT);
        List<Map<String, Object>> records = new ArrayList<>(page.getRecords());
        while (!page.isDone() && page.getNextRecordsUrl() != null) {
            page = rest.get(page.getNextRecordsUrl(), Map.of(), QUERY_RESULT);
            records.addAll(page.getRecords());
        }
        return records;
    }

    /**
     * Runs {@code hook} when this connection is closed.
     */
    public void onClose(Runnable hook) {
        closeHooks.add(hook);
    }

    @Override
    public void close() {
        streaming.close();
        for (Runnable hook : closeHooks) {
            hook.run();
        }
        closeHooks.clear();
    }
}
