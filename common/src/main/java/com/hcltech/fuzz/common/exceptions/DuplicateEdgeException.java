package com.hcltech.fuzz.common.exceptions;

public final class DuplicateEdgeException extends FuzzException {
    public DuplicateEdgeException(String message, Object offendingValue) { super(ErrorKind.DUPLICATE, message, offendingValue); }
}
