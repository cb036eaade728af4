package com.expertpanel.common.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void success_carriesValue() {
        Outcome<String> outcome = Outcome.success("ok");
        assertTrue(outcome.isSuccess());
        assertEquals("ok", outcome.value());
        assertNull(outcome.error());
    }

    @Test
    void failure_valueThrows() {
        Outcome<String> outcome = Outcome.failure("missing tests");
        assertFalse(outcome.isSuccess());
        assertEquals("missing tests", outcome.error());
        assertThrows(IllegalStateException.class, outcome::value);
    }

    @Test
    void blankFailure_getsDefaultMessage() {
        assertEquals("unknown error", Outcome.failure(" ").error());
    }

    @Test
    void mapAndFlatMap_propagateFailure() {
        Outcome<Integer> failed = Outcome.<String>failure("boom").map(String::length);
        assertEquals("boom", failed.error());

        Outcome<Integer> chained = Outcome.success("abc").flatMap(s -> Outcome.success(s.length()));
        assertEquals(3, chained.value());
    }

    @Test
    void orElseGet_buildsFallbackFromError() {
        assertEquals("fallback: boom", Outcome.<String>failure("boom").orElseGet(e -> "fallback: " + e));
        assertEquals("ok", Outcome.success("ok").orElseGet(e -> "unused"));
    }
}
