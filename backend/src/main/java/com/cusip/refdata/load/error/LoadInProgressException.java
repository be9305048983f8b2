package com.cusip.refdata.load.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when another load run already holds the deployment-wide run lock. Not a pipeline failure:
 * it is surfaced to the caller so the request can be retried later.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class LoadInProgressException extends RuntimeException {
    public LoadInProgressException(String message) {
        super(message);
    }
}
