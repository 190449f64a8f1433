package com.salesforce.streaming.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.model.ApiError;
import com.salesforce.streaming.model.SessionInfo;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * JSON over HTTP against the REST API of the connected org. Every request
 * carries the current session's bearer token, so a refreshed session is
 * picked up without rebuilding the invoker.
 */
@Slf4j
public class RestInvoker {

    private static final String JSON = "application/json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Supplier<SessionInfo> session;
    private final String apiVersion;
    private final Duration requestTimeout;

    public RestInvoker(HttpClient httpClient, ObjectMapper objectMapper, Supplier<SessionInfo> session,
                       String apiVersion, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.session = session;
        this.apiVersion = apiVersion;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Path of a versioned data resource, e.g. {@code /sobjects/Account/}
     * becomes {@code /services/data/v54.0/sobjects/Account/}.
     */
    public String dataPath(String resource) {
        return "/services/data/v" + apiVersion + resource;
    }

    public <T> T get(String path, Map<String, String> params, TypeReference<T> type) {
        return exchange(HttpMethod.GET, path, params, null, type);
    }

    public <T> T post(String path, Object body, TypeReference<T> type) {
        return exchange(HttpMethod.POST, path, Map.of(), body, type);
    }

    public <T> T delete(String path, Map<String, String> params, TypeReference<T> type) {
        return exchange(HttpMethod.DELETE, path, params, null, type);
    }

    /**
     * Sends one request and decodes the response body into {@code type}.
     * Returns {@code null} for an empty body (204 No Content).
     */
    public <T> T exchange(HttpMethod method, String path, Map<String, String> params, Object body,
                          TypeReference<T> type) {
        SessionInfo current = session.get();
        String url = current.getInstanceUrl() + path;

        Request request = httpClient.newRequest(url)
                .method(method)
                .timeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .header(HttpHeader.AUTHORIZATION, current.authorizationHeader())
                .header(HttpHeader.ACCEPT, JSON);
        params.forEach(request::param);
        if (body != null) {
            request.content(new StringContentProvider(JSON, writeJson(body), StandardCharsets.UTF_8));
        }

        log.debug("{} {}", method, path);
        ContentResponse response = send(request, method, path);
        String content = response.getContentAsString();

        if (response.getStatus() >= 400) {
            throw toApiException(method, path, response.getStatus(), content);
        }
        if (content == null || content.isEmpty() || type == null) {
            return null;
        }
        try {
            return objectMapper.readValue(content, type);
        } catch (IOException e) {
            throw new SalesforceApiException("Unreadable response from " + method + " " + path, e);
        }
    }

    private ContentResponse send(Request request, HttpMethod method, String path) {
        try {
            return request.send();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SalesforceApiException("Interrupted during " + method + " " + path, e);
        } catch (TimeoutException | ExecutionException e) {
            throw new SalesforceApiException(method + " " + path + " failed", e);
        }
    }

    private String writeJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable: " + body, e);
        }
    }

    private SalesforceApiException toApiException(HttpMethod method, String path, int status, String content) {
        String errorCode = null;
        String message = method + " " + path + " failed with status: " + status;
        try {
            List<ApiError> errors = objectMapper.readValue(content, new TypeReference<List<ApiError>>() {
            });
            if (!errors.isEmpty()) {
                errorCode = errors.get(0).code();
                message = message + ", " + errorCode + ": " + errors.get(0).getMessage();
            }
        } catch (IOException e) {
            log.debug("Error body of {} {} is not an error list", method, path);
            message = message + ", Response: " + content;
        }
        return new SalesforceApiException(status, errorCode, message, content);
    }
}
