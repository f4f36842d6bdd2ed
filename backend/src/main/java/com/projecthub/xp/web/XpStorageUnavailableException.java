package com.projecthub.xp.web;

/**
 * Raised when a ledger append still fails after the bounded retry. The caller may resubmit the event.
 */
public class XpStorageUnavailableException extends RuntimeException {

    public static final String CODE = "storage_contention";

    public XpStorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
