package com.hcltech.fuzz.common.exceptions;

public final class InvalidEdgeException extends FuzzException {
    public InvalidEdgeException(String message, Object offendingValue) { super(ErrorKind.INVALID_EDGE, message, offendingValue); }
}
