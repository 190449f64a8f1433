package com.salesforce.streaming.support;

import com.salesforce.streaming.model.SaveResult;
import com.salesforce.streaming.rest.Connection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.salesforce.streaming.rest.QueryConditions.in;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Creates and removes the Account records whose changes the scenarios
 * observe.
 */
@Slf4j
public final class AccountFixtures {

    private AccountFixtures() {
        // Utility class
    }

    public static List<String> uniqueNames(String prefix, int count) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            names.add(prefix + UUID.randomUUID());
        }
        return names;
    }

    public static List<SaveResult> createAll(Connection connection, Collection<String> names) {
        List<SaveResult> results = new ArrayList<>();
        for (String name : names) {
            SaveResult result = connection.sobject("Account").create(Map.of("Name", name));
            assertThat(result.isSuccess()).as("create Account %s", name).isTrue();
            results.add(result);
        }
        return results;
    }

    /**
     * Deletes the named accounts. With {@code required} set, finding none is
     * reported as leaked or missing test data.
     */
    public static void deleteByNames(Connection connection, Collection<String> names, boolean required) {
        if (names.isEmpty()) {
            return;
        }
        List<String> ids = connection.sobject("Account").find(in("Name", names), "Id").execute().stream()
                .map(record -> (String) record.get("Id"))
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            if (required) {
                throw new IllegalStateException("No accounts found to delete");
            }
            log.warn("No accounts found to delete among {}", names);
            return;
        }
        connection.sobject("Account").destroy(ids);
    }
}
