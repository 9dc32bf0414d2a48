package com.hcltech.fuzz.common.exceptions;

public final class NotFoundException extends FuzzException {
    public NotFoundException(String message, Object offendingValue) { super(ErrorKind.NOT_FOUND, message, offendingValue); }
}
