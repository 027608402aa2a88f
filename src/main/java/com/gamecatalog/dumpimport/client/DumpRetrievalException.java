package com.gamecatalog.dumpimport.client;

/**
 * Raised when the access token or a dump payload cannot be obtained from the catalog provider.
 * The import treats it as recoverable and falls back to the last stored dump.
 */
public class DumpRetrievalException extends RuntimeException {

    public DumpRetrievalException(String message) {
        super(message);
    }

    public DumpRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
