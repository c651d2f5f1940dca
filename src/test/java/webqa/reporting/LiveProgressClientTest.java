package webqa.reporting;

import webqa.model.JobCodec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LiveProgressClient} using WireMock.
 */
public class LiveProgressClientTest {

    private WireMockServer wireMock;
    private LiveProgressClient client;

    @BeforeClass
    public void setup() {
        wireMock = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMock.start();
    }

    @AfterClass
    public void teardown() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeMethod
    public void reset() {
        wireMock.resetAll();
        client = new LiveProgressClient("http://localhost:" + wireMock.port(), 2);
    }

    private static ObjectNode message(String type) {
        return JobCodec.getMapper().createObjectNode().put("type", type).put("status", "RUNNING");
    }

    @Test
    public void sendUpdate_postsToRunChannel() {
        wireMock.stubFor(post(urlEqualTo("/update/314")).willReturn(aResponse().withStatus(200)));

        assertThat(client.sendUpdate("314", message("run_start"))).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/update/314"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(matchingJsonPath("$.type", equalTo("run_start"))));
    }

    @Test
    public void broadcast_postsToNotifyEndpoint() {
        wireMock.stubFor(post(urlEqualTo("/notify/broadcast")).willReturn(aResponse().withStatus(202)));

        assertThat(client.broadcast(message("final_status"))).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/notify/broadcast")));
    }

    @Test
    public void rejectedUpdate_returnsFalse() {
        wireMock.stubFor(post(urlEqualTo("/update/1")).willReturn(aResponse().withStatus(404)));

        assertThat(client.sendUpdate("1", message("step_result"))).isFalse();
    }

    @Test
    public void networkError_returnsFalse() {
        LiveProgressClient unreachable = new LiveProgressClient("http://localhost:1", 1);

        assertThat(unreachable.broadcast(message("final_status"))).isFalse();
    }

    @Test
    public void malformedBaseUrl_returnsFalse() {
        LiveProgressClient broken = new LiveProgressClient("ws-bridge:8003", 1);

        assertThat(broken.sendUpdate("314", message("run_start"))).isFalse();
        assertThat(broken.broadcast(message("final_status"))).isFalse();
    }

    @Test
    public void sendUpdate_runIdIsEncodedAsSingleSegment() {
        wireMock.stubFor(post(urlEqualTo("/update/7%3Fx")).willReturn(aResponse().withStatus(200)));

        assertThat(client.sendUpdate("7?x", message("step_result"))).isTrue();
        wireMock.verify(1, postRequestedFor(urlEqualTo("/update/7%3Fx")));
    }
}
