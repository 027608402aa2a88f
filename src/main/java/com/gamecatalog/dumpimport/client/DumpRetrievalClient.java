package com.gamecatalog.dumpimport.client;

/**
 * Retrieves the current delimited dump of one entity.
 */
public interface DumpRetrievalClient {

    /**
     * @throws DumpRetrievalException when the manifest or the payload cannot be fetched
     */
    byte[] fetchDump(String entity, String accessToken);
}
