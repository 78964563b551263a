package com.agilab.log_collecting.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification of the collection exception hierarchy.
 */
class LogCollectionExceptionTest {

    private final CollectorExceptionHandler exceptionHandler = new CollectorExceptionHandler();

    @Test
    void testPathNotFoundException_CarriesTarget() {
        var exception = new PathNotFoundException("/var/log", "Remote path not found: /var/log");

        assertInstanceOf(LogCollectionException.class, exception);
        assertEquals("/var/log", exception.getTarget());
        assertEquals("Remote path not found: /var/log", exception.getMessage());
    }

    @Test
    void testConnectionSubtypes_AreConnectionExceptions() {
        var auth = new AuthenticationException("controller:22", "Authentication failed");
        var protocol = new SessionProtocolException("controller:22", "Handshake failed");

        assertInstanceOf(ConnectionException.class, auth);
        assertInstanceOf(ConnectionException.class, protocol);
        assertEquals("controller:22", auth.getTarget());
    }

    @Test
    void testTransferException_KeepsCause() {
        var cause = new IOException("disk full");
        var exception = new TransferException("/dst/a.log", "Copy failed", cause);

        assertSame(cause, exception.getCause());
    }

    @Test
    void testErrorType() {
        assertEquals("AUTHENTICATION_ERROR", exceptionHandler.getErrorType(new AuthenticationException("h", "m")));
        assertEquals("PROTOCOL_ERROR", exceptionHandler.getErrorType(new SessionProtocolException("h", "m")));
        assertEquals("CONNECTION_ERROR", exceptionHandler.getErrorType(new ConnectionException("h", "m")));
        assertEquals("NOT_CONNECTED", exceptionHandler.getErrorType(new NotConnectedException("h", "m")));
        assertEquals("NOT_FOUND", exceptionHandler.getErrorType(new PathNotFoundException("p", "m")));
        assertEquals("NOT_A_DIRECTORY", exceptionHandler.getErrorType(new NotADirectoryException("p", "m")));
        assertEquals("PERMISSION_DENIED", exceptionHandler.getErrorType(new PathPermissionException("p", "m")));
        assertEquals("INVALID_PATTERN", exceptionHandler.getErrorType(new InvalidPatternException("[", "m")));
        assertEquals("INVALID_FILTER_VALUE", exceptionHandler.getErrorType(new InvalidFilterValueException("x", "m")));
        assertEquals("UNSUPPORTED_ARCHIVE_KIND", exceptionHandler.getErrorType(new UnsupportedArchiveKindException("a", "m")));
        assertEquals("IO_ERROR", exceptionHandler.getErrorType(new TransferException("p", "m")));
    }

    @Test
    void testErrorSeverity() {
        assertEquals("HIGH", exceptionHandler.getErrorSeverity(new AuthenticationException("h", "m")));
        assertEquals("HIGH", exceptionHandler.getErrorSeverity(new NotConnectedException("h", "m")));
        assertEquals("MEDIUM", exceptionHandler.getErrorSeverity(new InvalidPatternException("[", "m")));
        assertEquals("MEDIUM", exceptionHandler.getErrorSeverity(new TransferException("p", "m")));
        assertEquals("LOW", exceptionHandler.getErrorSeverity(new PathPermissionException("p", "m")));
        assertEquals("LOW", exceptionHandler.getErrorSeverity(new PathNotFoundException("p", "m")));
    }

    @Test
    void testLogException_DoesNotThrow() {
        assertDoesNotThrow(() -> exceptionHandler.logException(new ConnectionException("h", "down")));
        assertDoesNotThrow(() -> exceptionHandler.logException(new TransferException("p", "failed")));
        assertDoesNotThrow(() -> exceptionHandler.logException(new PathNotFoundException("p", "missing")));
    }

    @Test
    void testDescribe_FallsBackToClassName() {
        assertEquals("boom", exceptionHandler.describe(new IllegalStateException("boom")));
        assertEquals("NullPointerException", exceptionHandler.describe(new NullPointerException()));
    }
}
