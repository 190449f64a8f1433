package com.salesforce.streaming.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.model.SessionInfo;
import com.salesforce.streaming.rest.Connection;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Creates connections to the configured org. A connection is created
 * unauthenticated by {@link #createConnection()} and becomes usable after
 * {@link #establishConnection(Connection)}; refreshed sessions are passed on
 * to it from then on, until the connection is closed.
 */
@Service
@Slf4j
public class ConnectionManager {

    @Autowired
    private SalesforceConfig config;

    @Autowired
    private SalesforceAuthService authService;

    @Autowired
    private ObjectMapper objectMapper;

    private HttpClient httpClient;
    private final List<Connection> connections = new CopyOnWriteArrayList<>();

    @PostConstruct
    public void init() throws Exception {
        httpClient = new HttpClient(new SslContextFactory.Client());
        httpClient.start();
    }

    public Connection createConnection() {
        Connection connection = new Connection(config, httpClient, objectMapper);
        connections.add(connection);
        connection.onClose(() -> connections.remove(connection));
        return connection;
    }

    public void establishConnection(Connection connection) throws Exception {
        log.info("Establishing connection via {}", config.getAuth().getLoginUrl());
        connection.attach(authService.authenticate());
        Consumer<SessionInfo> listener = connection::attach;
        authService.addSessionListener(listener);
        connection.onClose(() -> authService.removeSessionListener(listener));
    }

    @PreDestroy
    public void cleanup() {
        for (Connection connection : connections) {
            try {
                connection.close();
            } catch (Exception e) {
                log.error("Error closing connection", e);
            }
        }
        if (httpClient != null) {
            try {
                httpClient.stop();
            } catch (Exception e) {
                log.error("Error stopping HTTP client", e);
            }
        }
    }
}
