package org.calista.branchgraph.error;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void successCarriesValue() {
        Outcome<String> o = Outcome.of(() -> "done");
        assertTrue(o.isOk());
        assertEquals("done", o.orElseThrow());
        assertNull(o.code);
    }

    @Test
    void engineExceptionKeepsItsCode() {
        Outcome<String> o = Outcome.of(() -> {
            throw NotFoundException.thought("t1");
        });
        assertFalse(o.ok);
        assertEquals(ErrorCode.THOUGHT_NOT_FOUND, o.code);
        assertEquals("Thought not found: t1", o.message);
        assertFalse(o.retryable);
        assertThrows(NoSuchElementException.class, o::orElseThrow);
    }

    @Test
    void providerFailureIsRetryable() {
        Outcome<Object> o = Outcome.of(() -> {
            throw ProviderException.timeout(50, null);
        });
        assertEquals(ErrorCode.PROVIDER_TIMEOUT, o.code);
        assertTrue(o.retryable);
    }

    @Test
    void unexpectedExceptionIsInternal() {
        Outcome<Object> o = Outcome.of(() -> {
            throw new IllegalStateException();
        });
        assertEquals(ErrorCode.INTERNAL_ERROR, o.code);
        assertEquals("IllegalStateException", o.message);
    }
}
