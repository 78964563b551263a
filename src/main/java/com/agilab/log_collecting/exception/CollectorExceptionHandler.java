package com.agilab.log_collecting.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies collection failures and logs them at a level matching their severity.
 */
@Slf4j
@Component
public class CollectorExceptionHandler {

    public String getErrorType(LogCollectionException exception) {
        if (exception instanceof AuthenticationException) {
            return "AUTHENTICATION_ERROR";
        } else if (exception instanceof SessionProtocolException) {
            return "PROTOCOL_ERROR";
        } else if (exception instanceof ConnectionException) {
            return "CONNECTION_ERROR";
        } else if (exception instanceof NotConnectedException) {
            return "NOT_CONNECTED";
        } else if (exception instanceof PathNotFoundException) {
            return "NOT_FOUND";
        } else if (exception instanceof NotADirectoryException) {
            return "NOT_A_DIRECTORY";
        } else if (exception instanceof PathPermissionException) {
            return "PERMISSION_DENIED";
        } else if (exception instanceof InvalidPatternException) {
            return "INVALID_PATTERN";
        } else if (exception instanceof InvalidFilterValueException) {
            return "INVALID_FILTER_VALUE";
        } else if (exception instanceof UnsupportedArchiveKindException) {
            return "UNSUPPORTED_ARCHIVE_KIND";
        }
        return "IO_ERROR";
    }

    /**
     * Connection problems stop everything, bad filter input stops one listing, a single path problem stops one item.
     */
    public String getErrorSeverity(LogCollectionException exception) {
        if (exception instanceof ConnectionException || exception instanceof NotConnectedException) {
            return "HIGH";
        } else if (exception instanceof InvalidPatternException
                || exception instanceof InvalidFilterValueException
                || exception instanceof UnsupportedArchiveKindException
                || exception instanceof TransferException) {
            return "MEDIUM";
        }
        return "LOW";
    }

    public void logException(LogCollectionException exception) {
        var errorType = getErrorType(exception);
        var severity = getErrorSeverity(exception);
        var target = exception.getTarget();

        switch (severity) {
            case "HIGH" -> log.error("[{}] {} on {}: {}", severity, errorType, target, exception.getMessage());
            case "MEDIUM" -> log.warn("[{}] {} on {}: {}", severity, errorType, target, exception.getMessage());
            default -> log.info("[{}] {} on {}: {}", severity, errorType, target, exception.getMessage());
        }
    }

    /**
     * Human readable message for result objects, falling back to the exception class when there is none.
     */
    public String describe(Throwable throwable) {
        var message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }
}
