package com.salesforce.streaming.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfo {
    private String sessionId;
    private String organizationId;
    private String instanceUrl;
    @Builder.Default
    private String tokenType = "Bearer";

    public String authorizationHeader() {
        return tokenType + " " + sessionId;
    }
}
