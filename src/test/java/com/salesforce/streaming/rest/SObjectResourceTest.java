package com.salesforce.streaming.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.model.SaveResult;
import com.salesforce.streaming.model.SessionInfo;
import com.salesforce.streaming.support.StubSalesforceServer;
import com.salesforce.streaming.support.StubSalesforceServer.RecordedRequest;
import org.eclipse.jetty.client.HttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.salesforce.streaming.rest.QueryConditions.eq;
import static com.salesforce.streaming.rest.QueryConditions.in;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SObjectResourceTest {

    private static final String DATA = "/services/data/v54.0";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubSalesforceServer stub;
    private HttpClient httpClient;
    private Connection connection;

    @BeforeEach
    void setUp() throws Exception {
        stub = StubSalesforceServer.start();
        httpClient = new HttpClient();
        httpClient.start();
        connection = new Connection(new SalesforceConfig(), httpClient, objectMapper);
        connection.attach(SessionInfo.builder()
                .sessionId("token-1")
                .instanceUrl(stub.baseUrl())
                .build());
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
        httpClient.stop();
        stub.close();
    }

    @Test
    void shouldPostFieldsOnCreate() throws Exception {
        stub.on("POST", DATA + "/sobjects/Account/", 201, "{\"id\":\"001A\",\"success\":true,\"errors\":[]}");

        SaveResult result = connection.sobject("Account").create(Map.of("Name", "Acme"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getId()).isEqualTo("001A");
        RecordedRequest request = stub.lastRequest("POST", DATA + "/sobjects/Account/");
        assertThat(request.getAuthorization()).isEqualTo("Bearer token-1");
        JsonNode body = objectMapper.readTree(request.getBody());
        assertThat(body.get("Name").asText()).isEqualTo("Acme");
    }

    @Test
    void shouldQueryWithSoqlBuiltFromConditions() {
        stub.on("GET", DATA + "/query", 200, "{\"totalSize\":2,\"done\":true,\"records\":["
                + "{\"attributes\":{\"type\":\"Account\"},\"Id\":\"001A\"},"
                + "{\"attributes\":{\"type\":\"Account\"},\"Id\":\"001B\"}]}");

        List<Map<String, Object>> records = connection.sobject("Account")
                .find(in("Name", List.of("a", "b")), "Id")
                .execute();

        assertThat(records).extracting(r -> r.get("Id")).containsExactly("001A", "001B");
        assertThat(stub.lastRequest("GET", DATA + "/query").getParameters().get("q"))
                .isEqualTo("SELECT Id FROM Account WHERE Name IN ('a', 'b')");
    }

    @Test
    void shouldLimitFindOneToASingleRecord() {
        RecordQuery query = connection.sobject("PushTopic").findOne(eq("Name", "Topic-1"), "Id", "Name");

        assertThat(query.toSoql()).isEqualTo("SELECT Id, Name FROM PushTopic WHERE Name = 'Topic-1' LIMIT 1");
    }

    @Test
    void shouldFollowNextRecordsUrl() {
        stub.on("GET", DATA + "/query", 200, "{\"totalSize\":2,\"done\":false,"
                + "\"nextRecordsUrl\":\"" + DATA + "/query/01gxx-2000\",\"records\":[{\"Id\":\"001A\"}]}");
        stub.on("GET", DATA + "/query/01gxx-2000", 200, "{\"totalSize\":2,\"done\":true,\"records\":[{\"Id\":\"001B\"}]}");

        List<Map<String, Object>> records = connection.query("SELECT Id FROM Account");

        assertThat(records).extracting(r -> r.get("Id")).containsExactly("001A", "001B");
    }

    @Test
    void shouldDestroyThroughCompositeCollection() {
        stub.on("DELETE", DATA + "/composite/sobjects", 200,
                "[{\"id\":\"001A\",\"success\":true,\"errors\":[]},{\"id\":\"001B\",\"success\":true,\"errors\":[]}]");

        List<SaveResult> results = connection.sobject("Account").destroy(List.of("001A", "001B"));

        assertThat(results).hasSize(2).allMatch(SaveResult::isSuccess);
        RecordedRequest request = stub.lastRequest("DELETE", DATA + "/composite/sobjects");
        assertThat(request.getParameters())
                .containsEntry("ids", "001A,001B")
                .containsEntry("allOrNone", "false");
    }

    @Test
    void shouldSplitLargeDestroysIntoChunks() {
        stub.on("DELETE", DATA + "/composite/sobjects", 200, "[]");
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < SObjectResource.MAX_COLLECTION_SIZE + 1; i++) {
            ids.add(String.format("001%012d", i));
        }

        connection.sobject("Account").destroy(ids);

        List<RecordedRequest> deletes = stub.requests("DELETE", DATA + "/composite/sobjects");
        assertThat(deletes).hasSize(2);
        assertThat(deletes.get(1).getParameters().get("ids")).isEqualTo(ids.get(ids.size() - 1));
    }

    @Test
    void shouldNotCallServerWhenNothingToDestroy() {
        assertThat(connection.sobject("Account").destroy(List.of())).isEmpty();
        assertThat(stub.requests()).isEmpty();
    }

    @Test
    void shouldDeleteWhatFindOneSelected() {
        stub.on("GET", DATA + "/query", 200, "{\"totalSize\":1,\"done\":true,\"records\":[{\"Id\":\"0PTA\"}]}");
        stub.on("DELETE", DATA + "/composite/sobjects", 200, "[{\"id\":\"0PTA\",\"success\":true,\"errors\":[]}]");

        List<SaveResult> deleted = connection.sobject("PushTopic").findOne(eq("Name", "Topic-1")).delete();

        assertThat(deleted).extracting(SaveResult::getId).containsExactly("0PTA");
        assertThat(stub.lastRequest("GET", DATA + "/query").getParameters().get("q"))
                .isEqualTo("SELECT Id FROM PushTopic WHERE Name = 'Topic-1' LIMIT 1");
    }

    @Test
    void shouldDeleteSingleRecordById() {
        stub.on("DELETE", DATA + "/sobjects/Account/001A", 204, "");

        connection.sobject("Account").delete("001A");

        assertThat(stub.requests("DELETE", DATA + "/sobjects/Account/001A")).hasSize(1);
    }

    @Test
    void shouldTurnErrorResponsesIntoApiException() {
        stub.on("POST", DATA + "/sobjects/Account/", 400,
                "[{\"errorCode\":\"REQUIRED_FIELD_MISSING\",\"message\":\"Required fields are missing: [Name]\"}]");

        SalesforceApiException error = catchThrowableOfType(
                () -> connection.sobject("Account").create(Map.of()), SalesforceApiException.class);

        assertThat(error).hasMessageContaining("Required fields are missing");
        assertThat(error.getStatus()).isEqualTo(400);
        assertThat(error.getErrorCode()).isEqualTo("REQUIRED_FIELD_MISSING");
    }

    @Test
    void shouldRefuseCallsBeforeSessionIsAttached() {
        Connection unauthenticated = new Connection(new SalesforceConfig(), httpClient, objectMapper);

        assertThat(unauthenticated.isEstablished()).isFalse();
        assertThatThrownBy(() -> unauthenticated.sobject("Account").create(Map.of("Name", "x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Not authenticated");
    }
}
