package com.gamecatalog.dumpimport.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

/**
 * Two-step dump download: the manifest endpoint returns a signed {@code s3_url}, which is then fetched as-is.
 */
@Service
public class IgdbDumpClient implements DumpRetrievalClient {

    private static final Logger logger = LoggerFactory.getLogger(IgdbDumpClient.class);

    private final RestClient restClient;
    private final RateLimiter dumpApiRateLimiter;
    private final String dumpsBaseUrl;
    private final String clientId;

    public IgdbDumpClient(RestClient.Builder restClientBuilder,
                          @Qualifier("dumpApiRateLimiter") RateLimiter dumpApiRateLimiter,
                          @Value("${app.igdb.dumps-base-url}") String dumpsBaseUrl,
                          @Value("${app.igdb.client-id:}") String clientId) {
        this.restClient = restClientBuilder.build();
        this.dumpApiRateLimiter = dumpApiRateLimiter;
        this.dumpsBaseUrl = dumpsBaseUrl.endsWith("/") ? dumpsBaseUrl : dumpsBaseUrl + "/";
        this.clientId = clientId;
    }

    @Override
    public byte[] fetchDump(String entity, String accessToken) {
        String downloadUrl = fetchDownloadUrl(entity, accessToken);
        try {
            // signed URL: must not be re-encoded
            byte[] payload = restClient.get()
                    .uri(URI.create(downloadUrl))
                    .retrieve()
                    .body(byte[].class);
            if (payload == null || payload.length == 0) {
                throw new DumpRetrievalException("Empty dump payload downloaded for " + entity);
            }
            logger.info("Downloaded {} dump ({} bytes)", entity, payload.length);
            return payload;
        } catch (RestClientException | IllegalArgumentException e) {
            throw new DumpRetrievalException("Failed to download dump for " + entity + ": " + e.getMessage(), e);
        }
    }

    private String fetchDownloadUrl(String entity, String accessToken) {
        dumpApiRateLimiter.acquire();
        JsonNode manifest;
        try {
            manifest = restClient.get()
                    .uri(dumpsBaseUrl + entity)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .header("Client-ID", clientId)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new DumpRetrievalException("Request to dump endpoint " + entity + " failed: " + e.getMessage(), e);
        }
        String url = manifest != null ? manifest.path("s3_url").asText("") : "";
        if (url.isEmpty()) {
            throw new DumpRetrievalException("Dump manifest for " + entity + " has no s3_url");
        }
        logger.info("Connected to dump endpoint: {}", entity);
        return url;
    }
}
