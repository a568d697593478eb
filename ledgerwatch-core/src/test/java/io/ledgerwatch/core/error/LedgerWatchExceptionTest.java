// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ledgerwatch.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class LedgerWatchExceptionTest {

    @Test
    void rpcExceptionCarriesCodeDataAndRequestId() {
        RpcException e = new RpcException(-32602, "Invalid params", "bad digest", 7L);

        assertEquals(-32602, e.code());
        assertEquals("bad digest", e.data());
        assertEquals(7L, e.requestId());
        assertTrue(e.getMessage().contains("[requestId=7]"));
        assertTrue(e.getMessage().contains("Invalid params"));
    }

    @Test
    void nullResultUsesInternalErrorCode() {
        RpcException e = RpcException.fromNullResult("sui_getObject");

        assertEquals(RpcException.NULL_RESULT_CODE, e.code());
        assertNull(e.requestId());
        assertTrue(e.getMessage().contains("sui_getObject"));
    }

    @Test
    void exhaustedTransportExceptionReportsAttempts() {
        IOException cause = new IOException("connection refused");
        TransportException last = new TransportException("Network error", cause);

        TransportException e = TransportException.exhausted("sui_getObject", 3, last);

        assertEquals(3, e.attemptCount());
        assertSame(last, e.getCause());
        assertTrue(e.getMessage().contains("failed after 3 attempts"));
    }

    @Test
    void hierarchyIsRootedAtLedgerWatchException() {
        LedgerWatchException config = new ConfigurationException("Signing key not set");

        assertTrue(config instanceof RuntimeException);
        assertEquals(1, new TransportException("timeout").attemptCount());
    }
}
