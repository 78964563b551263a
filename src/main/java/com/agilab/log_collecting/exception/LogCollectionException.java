package com.agilab.log_collecting.exception;

/**
 * Sealed hierarchy of failures raised by the collection engine.
 * Every implementation is unchecked and names the path or host it concerns.
 */
public sealed interface LogCollectionException
        permits ConnectionException, NotConnectedException, PathNotFoundException, NotADirectoryException,
        PathPermissionException, InvalidPatternException, InvalidFilterValueException,
        UnsupportedArchiveKindException, TransferException {

    String getTarget();
    String getMessage();
    Throwable getCause();
}
