package com.pseudo.buster.synonym;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IdentifierCanonicalizerTest {

    @ParameterizedTest
    @DisplayName("Should convert delimiter and casing styles to snake_case")
    @CsvSource({
            "accountStatus,account_status",
            "AccountStatus,account_status",
            "account_status,account_status",
            "Account-Status,account_status",
            "'account   status',account_status",
            "item2Count,item2_count",
            "MAX,max"
    })
    void testToSnakeCase(String input, String expected) {
        assertEquals(expected, IdentifierCanonicalizer.toSnakeCase(input));
    }

    @Test
    @DisplayName("Should treat null as empty")
    void testNull() {
        assertEquals("", IdentifierCanonicalizer.toSnakeCase(null));
    }
}
