package com.z2api.upstream.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.z2api.common.exception.UpstreamException;
import com.z2api.upstream.config.UpstreamModuleConfig;
import com.z2api.upstream.config.UpstreamProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Z.AI upstream client")
class ZaiUpstreamClientTest {

    private WireMockServer upstream;
    private ZaiUpstreamClient client;

    @BeforeEach
    void setUp() {
        upstream = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        upstream.start();

        UpstreamProperties properties = new UpstreamProperties();
        properties.setBaseUrl("http://localhost:" + upstream.port());
        properties.setHealthCheckTimeoutSeconds(1);
        properties.setRefreshTimeoutSeconds(2);
        properties.setRequestTimeoutSeconds(5);

        client = new ZaiUpstreamClient(new UpstreamModuleConfig().upstreamHttpClient(properties), properties);
    }

    @AfterEach
    void tearDown() {
        upstream.stop();
    }

    @Nested
    @DisplayName("probe")
    class Probe {

        @Test
        void reportsHealthyOnSuccessStatusAndSendsBearerToken() {
            upstream.stubFor(post(urlEqualTo("/api/chat/completions"))
                    .willReturn(aResponse().withStatus(200).withBody("data: {}\n\n")));

            assertThat(client.probe("tok-healthy")).isTrue();

            upstream.verify(postRequestedFor(urlEqualTo("/api/chat/completions"))
                    .withHeader("Authorization", equalTo("Bearer tok-healthy"))
                    .withRequestBody(containing("\"model\":\"0727-360B-API\""))
                    .withRequestBody(containing("\"content\":\"hi\"")));
        }

        @Test
        void reportsUnhealthyOnRejectedToken() {
            upstream.stubFor(post(urlEqualTo("/api/chat/completions"))
                    .willReturn(aResponse().withStatus(401)));

            assertThat(client.probe("tok-revoked")).isFalse();
        }

        @Test
        void reportsUnhealthyWhenUpstreamIsSlowerThanTimeout() {
            upstream.stubFor(post(urlEqualTo("/api/chat/completions"))
                    .willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

            assertThat(client.probe("tok-slow")).isFalse();
        }

        @Test
        void reportsUnhealthyWhenUpstreamIsDown() {
            upstream.stop();

            assertThat(client.probe("tok-any")).isFalse();
        }

        @Test
        void blankTokenIsNeverHealthy() {
            assertThat(client.probe("")).isFalse();
            assertThat(upstream.getAllServeEvents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("signIn")
    class SignIn {

        @Test
        void returnsTokenFromSuccessfulSignIn() {
            upstream.stubFor(post(urlEqualTo("/api/v1/auths/signin"))
                    .withRequestBody(equalToJson("{\"email\":\"u@e.com\",\"password\":\"pw\"}"))
                    .willReturn(aResponse().withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"id\":\"1\",\"token\":\"fresh-token\"}")));

            assertThat(client.signIn("u@e.com", "pw")).contains("fresh-token");
        }

        @Test
        void returnsEmptyWhenResponseHasNoToken() {
            upstream.stubFor(post(urlEqualTo("/api/v1/auths/signin"))
                    .willReturn(aResponse().withStatus(200).withBody("{\"id\":\"1\"}")));

            assertThat(client.signIn("u@e.com", "pw")).isEmpty();
        }

        @Test
        void returnsEmptyOnBadCredentials() {
            upstream.stubFor(post(urlEqualTo("/api/v1/auths/signin"))
                    .willReturn(aResponse().withStatus(400).withBody("{\"detail\":\"bad\"}")));

            assertThat(client.signIn("u@e.com", "wrong")).isEmpty();
        }

        @Test
        void returnsEmptyOnMalformedBody() {
            upstream.stubFor(post(urlEqualTo("/api/v1/auths/signin"))
                    .willReturn(aResponse().withStatus(200).withBody("<html>")));

            Optional<String> token = client.signIn("u@e.com", "pw");

            assertThat(token).isEmpty();
        }
    }

    @Nested
    @DisplayName("chatCompletion")
    class ChatCompletion {

        @Test
        void forwardsBodyAndReturnsUpstreamResponseUnchanged() {
            upstream.stubFor(post(urlEqualTo("/api/chat/completions"))
                    .willReturn(aResponse().withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"choices\":[]}")));

            UpstreamResponse response = client.chatCompletion("{\"messages\":[]}", "tok-chat");

            assertThat(response.isSuccessful()).isTrue();
            assertThat(response.getBody()).isEqualTo("{\"choices\":[]}");
            assertThat(response.getContentType()).startsWith("application/json");
            upstream.verify(postRequestedFor(urlEqualTo("/api/chat/completions"))
                    .withHeader("Authorization", equalTo("Bearer tok-chat"))
                    .withRequestBody(equalToJson("{\"messages\":[]}")));
        }

        @Test
        void keepsErrorStatusForCaller() {
            upstream.stubFor(post(urlEqualTo("/api/chat/completions"))
                    .willReturn(aResponse().withStatus(429).withBody("slow down")));

            UpstreamResponse response = client.chatCompletion("{}", "tok-limited");

            assertThat(response.getStatusCode()).isEqualTo(429);
            assertThat(response.isCredentialFailure()).isTrue();
        }

        @Test
        void wrapsNetworkErrors() {
            upstream.stop();

            assertThatThrownBy(() -> client.chatCompletion("{}", "tok-any"))
                    .isInstanceOf(UpstreamException.class);
        }
    }
}
