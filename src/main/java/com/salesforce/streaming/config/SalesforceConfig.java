package com.salesforce.streaming.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "salesforce")
@Data
public class SalesforceConfig {

    private Auth auth = new Auth();
    private Api api = new Api();
    private Streaming streaming = new Streaming();
    private Event event = new Event();

    @Data
    public static class Auth {
        private String loginUrl = "https://login.salesforce.com";

        // Only used with a direct access token; OAuth flows take it from the token response
        private String instanceUrl;

        // OAuth 2.0 Client Credentials (Recommended)
        private String clientId;
        private String clientSecret;

        // Legacy authentication methods
        private String username;
        private String password;
        private String accessToken;
        private String tenantId;

        private Duration refreshInterval = Duration.ofMinutes(50);
    }

    @Data
    public static class Api {
        private String version = "54.0";
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Streaming {
        private Duration handshakeTimeout = Duration.ofSeconds(30);
        private Duration subscribeTimeout = Duration.ofSeconds(30);

        /**
         * Extra wait after the subscribe acknowledgement. Salesforce confirms
         * /meta/subscribe before live delivery to the new subscriber starts.
         */
        private Duration subscribeSettleDelay = Duration.ofSeconds(5);

        // Salesforce holds a long poll for up to 110 seconds
        private Duration maxNetworkDelay = Duration.ofSeconds(120);
        private int maxMessageSize = 10 * 1024 * 1024;
    }

    @Data
    public static class Event {
        private boolean autoStart;
        private String channel;
        private long replayId = -1L;
    }
}
