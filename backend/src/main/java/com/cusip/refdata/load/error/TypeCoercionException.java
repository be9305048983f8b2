package com.cusip.refdata.load.error;

public class TypeCoercionException extends LoadFailureException {
    public TypeCoercionException(String message, Throwable cause) {
        super(FailureKind.TYPE_COERCION, message, cause);
    }
}
