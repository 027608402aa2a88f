package com.gamecatalog.dumpimport.client;

/**
 * Supplies the bearer credential used for dump API calls.
 */
public interface AccessTokenProvider {

    /**
     * @throws DumpRetrievalException when no token could be obtained
     */
    String fetchAccessToken();
}
