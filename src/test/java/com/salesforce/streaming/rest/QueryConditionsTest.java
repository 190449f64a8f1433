package com.salesforce.streaming.rest;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.salesforce.streaming.rest.QueryConditions.all;
import static com.salesforce.streaming.rest.QueryConditions.eq;
import static com.salesforce.streaming.rest.QueryConditions.in;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryConditionsTest {

    @Test
    void shouldRenderEqualityWithQuotedString() {
        assertThat(eq("Name", "/u/TestChannel").toSoql()).isEqualTo("Name = '/u/TestChannel'");
    }

    @Test
    void shouldEscapeQuotesAndBackslashes() {
        assertThat(eq("Name", "O'Brien \\ Co").toSoql()).isEqualTo("Name = 'O\\'Brien \\\\ Co'");
    }

    @Test
    void shouldRenderNumbersBooleansAndNullUnquoted() {
        assertThat(eq("NumberOfEmployees", 12).toSoql()).isEqualTo("NumberOfEmployees = 12");
        assertThat(eq("IsActive", true).toSoql()).isEqualTo("IsActive = true");
        assertThat(eq("ParentId", null).toSoql()).isEqualTo("ParentId = null");
    }

    @Test
    void shouldRenderInList() {
        assertThat(in("Name", List.of("a", "b")).toSoql()).isEqualTo("Name IN ('a', 'b')");
    }

    @Test
    void shouldRejectEmptyInList() {
        assertThatThrownBy(() -> in("Name", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldJoinConditionsWithAnd() {
        assertThat(all(eq("Name", "x"), eq("Type", "Customer")).toSoql())
                .isEqualTo("(Name = 'x') AND (Type = 'Customer')");
        assertThat(eq("Name", "x").and(eq("Type", "Customer")).toSoql())
                .isEqualTo("(Name = 'x') AND (Type = 'Customer')");
    }

    @Test
    void shouldRejectFieldNamesThatAreNotIdentifiers() {
        assertThatThrownBy(() -> eq("Name = 'x' OR Id", "y"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid field name");
    }
}
