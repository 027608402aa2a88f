package com.gamecatalog.dumpimport.service;

/**
 * Raised when an import is requested while another run still holds the guard.
 */
public class ImportAlreadyRunningException extends RuntimeException {

    public ImportAlreadyRunningException() {
        super("An import run is already in progress");
    }
}
