package com.elssolution.ammeterlab;

import com.elssolution.ammeterlab.archive.ResultArchive;
import com.elssolution.ammeterlab.integration.emulator.EmulatorHost;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                // Emulators on free ports, nothing written to disk
                "lab.devices.greenlee.port=0",
                "lab.devices.entes.port=0",
                "lab.devices.circutor.port=0",
                "lab.emulators.seed=1234",
                "lab.archive.type=memory",

                // Keep background jobs quiet in tests
                "lab.status.summaryEverySec=0",

                // Bind UI to random port only
                "server.port=0"
        }
)
class SmokeTest {

    @LocalServerPort int port;

    @Autowired TestRestTemplate http;
    @Autowired EmulatorHost emulators;
    @Autowired ResultArchive archive;

    // Blocking campaigns only; nothing should be scheduled
    @MockitoBean ScheduledExecutorService scheduler;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void status_endpoint_returns_200() {
        var resp = http.getForEntity(url("/status"), String.class);
        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("GREENLEE").contains("emulatorsRunning");
        assertThat(emulators.running()).hasSize(3);
    }

    @Test
    void blocking_campaign_runs_and_lands_in_archive() {
        Map<String, Object> body = Map.of(
                "devices", new String[]{"greenlee", "entes", "circutor"},
                "numSamples", 3,
                "frequencyHz", 20.0,
                "wait", true);

        var resp = http.postForEntity(url("/campaigns"), body, JsonNode.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode runs = resp.getBody().get("runs");
        assertThat(runs).hasSize(3);
        for (JsonNode r : runs) {
            assertThat(r.get("status").asText()).isEqualTo("COMPLETED");
            assertThat(r.get("stats").get("count").asInt()).isEqualTo(3);
        }
        assertThat(resp.getBody().get("ranking").get("entries")).hasSize(3);

        String runId = runs.get(0).get("runId").asText();
        assertThat(http.getForEntity(url("/runs/" + runId), JsonNode.class).getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(http.getForEntity(url("/runs/" + runId + "/analysis"), JsonNode.class).getBody().get("count").asInt())
                .isEqualTo(3);
        assertThat(archive.summary().totalRuns()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void incomplete_sampling_config_is_400() {
        var resp = http.postForEntity(url("/campaigns"), Map.of("numSamples", 3), JsonNode.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("code").asText()).isEqualTo("CONFIG");
    }

    @Test
    void unknown_run_is_404() {
        var resp = http.getForEntity(url("/runs/does-not-exist"), JsonNode.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void health_reports_emulators() {
        var resp = http.getForEntity(url("/actuator/health"), String.class);
        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("\"status\":\"UP\"").contains("emulator");
    }
}
