package com.salesforce.streaming.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.model.SessionInfo;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.FormContentProvider;
import org.eclipse.jetty.util.Fields;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.springframework.util.StringUtils.hasText;

@Service
@Slf4j
public class SalesforceAuthService {

    private static final String OAUTH_TOKEN_ENDPOINT = "/services/oauth2/token";

    @Autowired
    private SalesforceConfig config;

    @Autowired
    private ObjectMapper objectMapper;

    private HttpClient httpClient;
    private ScheduledExecutorService tokenRefreshScheduler;
    private ScheduledFuture<?> refreshTask;
    private final List<Consumer<SessionInfo>> sessionListeners = new CopyOnWriteArrayList<>();

    @PostConstruct
    public void init() throws Exception {
        httpClient = new HttpClient(new SslContextFactory.Client());
        httpClient.start();

        tokenRefreshScheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @PreDestroy
    public void cleanup() {
        if (tokenRefreshScheduler != null) {
            tokenRefreshScheduler.shutdown();
        }
        if (httpClient != null) {
            try {
                httpClient.stop();
            } catch (Exception e) {
                log.error("Error stopping HTTP client", e);
            }
        }
    }

    /**
     * Obtains a session with the configured credentials and hands it to every
     * registered session listener. OAuth sessions are refreshed on a fixed
     * schedule afterwards.
     */
    public synchronized SessionInfo authenticate() throws Exception {
        SalesforceConfig.Auth auth = config.getAuth();

        // Check if we should use direct access token (for backward compatibility)
        if (hasText(auth.getAccessToken())) {
            SessionInfo session = new SessionInfo();
            session.setSessionId(auth.getAccessToken());
            session.setOrganizationId(auth.getTenantId());
            session.setInstanceUrl(hasText(auth.getInstanceUrl()) ? auth.getInstanceUrl() : auth.getLoginUrl());
            log.info("Authenticated using provided access token");
            return publish(session);
        }

        SessionInfo session;
        // A configured user selects the password flow; the connected app credentials go along with it
        if (hasText(auth.getUsername()) && hasText(auth.getPassword())) {
            session = authenticateWithPassword();
        }
        // Otherwise use OAuth 2.0 Client Credentials flow
        else if (hasText(auth.getClientId()) && hasText(auth.getClientSecret())) {
            session = authenticateWithClientCredentials();
        } else {
            throw new IllegalStateException("No authentication credentials provided. " +
                    "Please configure either an access token, client_id/client_secret or username/password");
        }
        publish(session);
        scheduleRefresh();
        return session;
    }

    /**
     * OAuth 2.0 Client Credentials Flow
     * This is the most secure method for server-to-server integration
     */
    private SessionInfo authenticateWithClientCredentials() throws Exception {
        log.info("Authenticating with OAuth 2.0 Client Credentials flow");

        Fields fields = new Fields();
        fields.put("grant_type", "client_credentials");
        fields.put("client_id", config.getAuth().getClientId());
        fields.put("client_secret", config.getAuth().getClientSecret());

        return requestToken(fields, "Client Credentials");
    }

    /**
     * OAuth 2.0 Username-Password Flow (less secure, use only if client credentials not available)
     */
    private SessionInfo authenticateWithPassword() throws Exception {
        log.info("Authenticating with OAuth 2.0 Username-Password flow");

        Fields fields = new Fields();
        fields.put("grant_type", "password");
        if (hasText(config.getAuth().getClientId())) {
            fields.put("client_id", config.getAuth().getClientId());
        }
        if (hasText(config.getAuth().getClientSecret())) {
            fields.put("client_secret", config.getAuth().getClientSecret());
        }
        fields.put("username", config.getAuth().getUsername());
        fields.put("password", config.getAuth().getPassword());

        return requestToken(fields, "Username-Password");
    }

    private SessionInfo requestToken(Fields fields, String flow) throws Exception {
        String tokenUrl = config.getAuth().getLoginUrl() + OAUTH_TOKEN_ENDPOINT;

        Request request = httpClient.POST(tokenUrl);
        request.content(new FormContentProvider(fields));
        request.header("Accept", "application/json");

        ContentResponse response = request.send();

        if (response.getStatus() != 200) {
            throw new Exception("Authentication failed with status: " + response.getStatus() +
                    ", Response: " + response.getContentAsString());
        }

        JsonNode tokenResponse = objectMapper.readTree(response.getContent());

        String accessToken = tokenResponse.get("access_token").asText();
        String instanceUrl = tokenResponse.get("instance_url").asText();
        String id = tokenResponse.path("id").asText(null);

        // Extract organization ID from the identity URL
        String orgId = id == null ? null : extractOrgIdFromIdentityUrl(id);

        SessionInfo session = new SessionInfo();
        session.setSessionId(accessToken);
        session.setInstanceUrl(instanceUrl);
        session.setOrganizationId(orgId);
        session.setTokenType(tokenResponse.path("token_type").asText("Bearer"));

        log.info("Successfully authenticated with {} flow. Instance: {}, Org ID: {}", flow, instanceUrl, orgId);
        return session;
    }

    /**
     * Extract Organization ID from the identity URL
     * Identity URL format: https://login.salesforce.com/id/00Dxx0000000000/005xx000000000
     */
    String extractOrgIdFromIdentityUrl(String identityUrl) {
        String[] parts = identityUrl.split("/");
        if (parts.length >= 2) {
            // The org ID is the second-to-last segment
            return parts[parts.length - 2];
        }
        log.warn("Could not extract org ID from identity URL: {}", identityUrl);
        return null;
    }

    private void scheduleRefresh() {
        Duration interval = config.getAuth().getRefreshInterval();
        if (refreshTask != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        refreshTask = tokenRefreshScheduler.scheduleAtFixedRate(() -> {
            try {
                log.info("Refreshing Salesforce access token...");
                authenticate();
            } catch (Exception e) {
                log.error("Failed to refresh token", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private SessionInfo publish(SessionInfo session) {
        for (Consumer<SessionInfo> listener : sessionListeners) {
            listener.accept(session);
        }
        return session;
    }

    public void addSessionListener(Consumer<SessionInfo> listener) {
        sessionListeners.add(listener);
    }

    public void removeSessionListener(Consumer<SessionInfo> listener) {
        sessionListeners.remove(listener);
    }
}
