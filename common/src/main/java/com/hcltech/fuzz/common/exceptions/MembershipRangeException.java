package com.hcltech.fuzz.common.exceptions;

public final class MembershipRangeException extends FuzzException {
    public MembershipRangeException(String message, Object offendingValue) { super(ErrorKind.RANGE, message, offendingValue); }
}
