package com.gamecatalog.dumpimport.client;

import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class IgdbDumpClientTest {

    private MockRestServiceServer server;

    private IgdbDumpClient client;

    private TwitchAccessTokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new IgdbDumpClient(builder, RateLimiter.create(100.0), "https://api.example.com/v4/dumps", "abc");
        tokenProvider = new TwitchAccessTokenProvider(builder, "https://id.example.com/oauth2/token", "abc", "shh");
    }

    @Test
    void downloadsPayloadFromSignedUrlInManifest() {
        server.expect(requestTo("https://api.example.com/v4/dumps/games"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer token"))
                .andExpect(header("Client-ID", "abc"))
                .andRespond(withSuccess("{\"s3_url\":\"https://files.example.com/games.csv?sig=a%2Fb\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://files.example.com/games.csv?sig=a%2Fb"))
                .andRespond(withSuccess("id,name\n1,x\n", MediaType.TEXT_PLAIN));

        byte[] payload = client.fetchDump("games", "token");

        assertThat(new String(payload, StandardCharsets.UTF_8)).isEqualTo("id,name\n1,x\n");
        server.verify();
    }

    @Test
    void manifestWithoutUrlIsRetrievalFailure() {
        server.expect(requestTo("https://api.example.com/v4/dumps/covers"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchDump("covers", "token"))
                .isInstanceOf(DumpRetrievalException.class)
                .hasMessageContaining("s3_url");
    }

    @Test
    void endpointErrorIsRetrievalFailure() {
        server.expect(requestTo("https://api.example.com/v4/dumps/covers"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.fetchDump("covers", "token"))
                .isInstanceOf(DumpRetrievalException.class)
                .hasCauseInstanceOf(RestClientException.class);
    }

    @Test
    void exchangesClientCredentialsForAccessToken() {
        server.expect(requestTo("https://id.example.com/oauth2/token?client_id=abc&client_secret=shh&grant_type=client_credentials"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"access_token\":\"t0k3n\",\"expires_in\":5000}", MediaType.APPLICATION_JSON));

        assertThat(tokenProvider.fetchAccessToken()).isEqualTo("t0k3n");
    }

    @Test
    void missingCredentialsFailWithoutCallingOut() {
        TwitchAccessTokenProvider unconfigured = new TwitchAccessTokenProvider(RestClient.builder(),
                "https://id.example.com/oauth2/token", "", "");

        assertThatThrownBy(unconfigured::fetchAccessToken).isInstanceOf(DumpRetrievalException.class);
    }
}
