package com.gamecatalog.dumpimport.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client-credentials grant against the provider's OAuth token endpoint.
 */
@Service
public class TwitchAccessTokenProvider implements AccessTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(TwitchAccessTokenProvider.class);

    private final RestClient restClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;

    public TwitchAccessTokenProvider(RestClient.Builder restClientBuilder,
                                     @Value("${app.igdb.token-url}") String tokenUrl,
                                     @Value("${app.igdb.client-id:}") String clientId,
                                     @Value("${app.igdb.client-secret:}") String clientSecret) {
        this.restClient = restClientBuilder.build();
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public String fetchAccessToken() {
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            throw new DumpRetrievalException("Client credentials are not configured (app.igdb.client-id / app.igdb.client-secret)");
        }
        JsonNode body;
        try {
            body = restClient.post()
                    .uri(tokenUrl + "?client_id={clientId}&client_secret={clientSecret}&grant_type=client_credentials",
                            clientId, clientSecret)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new DumpRetrievalException("Request to get access token failed: " + e.getMessage(), e);
        }
        String token = body != null ? body.path("access_token").asText("") : "";
        if (token.isEmpty()) {
            throw new DumpRetrievalException("Token response did not contain an access_token");
        }
        logger.info("Access token retrieved from {}", tokenUrl);
        return token;
    }
}
