package com.hcltech.fuzz.common.exceptions;

public final class InvalidTypeException extends FuzzException {
    public InvalidTypeException(String message, Object offendingValue) { super(ErrorKind.TYPE, message, offendingValue); }
}
