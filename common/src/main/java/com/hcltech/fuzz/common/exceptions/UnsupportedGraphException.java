package com.hcltech.fuzz.common.exceptions;

public final class UnsupportedGraphException extends FuzzException {
    public UnsupportedGraphException(String message, Object offendingValue) { super(ErrorKind.UNSUPPORTED, message, offendingValue); }
}
