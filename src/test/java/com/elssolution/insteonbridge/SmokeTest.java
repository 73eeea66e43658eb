package com.elssolution.insteonbridge;

import com.elssolution.insteonbridge.service.InsteonBridgeService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                // Mock PLM only; nothing touches a serial port
                "insteon.mock.forced=true",
                "insteon.mock.cycleSeconds=0",
                "insteon.cache.path=target/smoke-cache/devices.json",
                "insteon.auth.token=s3cret",

                // Keep background jobs quiet in tests
                "insteon.status.summarySeconds=0",

                "server.port=0"
        }
)
class SmokeTest {

    @LocalServerPort int port;

    @Autowired TestRestTemplate http;
    @Autowired InsteonBridgeService bridge;

    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void connected() {
        assertThat(bridge.waitUntilConnected(5)).isTrue();
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private ResponseEntity<String> call(HttpMethod method, String path, String token, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) headers.set(HttpHeaders.AUTHORIZATION, token);
        return http.exchange(url(path), method, new HttpEntity<>(body, headers), String.class);
    }

    @Test
    void status_endpoint_needs_no_token() throws Exception {
        var resp = http.getForEntity(url("/status"), String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        JsonNode json = mapper.readTree(resp.getBody());
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.path("status").path("mockMode").asBoolean()).isTrue();
    }

    @Test
    void everything_else_requires_the_token() {
        assertThat(call(HttpMethod.GET, "/devices", null, null).getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(call(HttpMethod.GET, "/devices", "Bearer wrong", null).getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(call(HttpMethod.GET, "/devices", "Bearer s3cret", null).getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(call(HttpMethod.GET, "/devices", "s3cret", null).getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void discovery_and_command_round_trip() throws Exception {
        var discovery = call(HttpMethod.POST, "/discovery", "Bearer s3cret", "{\"refresh\":false}");
        assertThat(discovery.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode d = mapper.readTree(discovery.getBody());
        assertThat(d.get("mode").asText()).isEqualTo("mock");
        assertThat(d.get("count").asInt()).isEqualTo(3);

        var command = call(HttpMethod.POST, "/devices/11.11.11/command", "Bearer s3cret",
                "{\"command\":\"on\",\"level\":50}");
        assertThat(command.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode ack = mapper.readTree(command.getBody()).get("result");
        assertThat(ack.get("type").asText()).isEqualTo("command_ack");
        assertThat(ack.get("level").asInt()).isEqualTo(50);

        var device = call(HttpMethod.GET, "/devices/111111", "Bearer s3cret", null);
        JsonNode snap = mapper.readTree(device.getBody()).get("device");
        assertThat(snap.path("state").path("level").asInt()).isEqualTo(128);
    }

    @Test
    void errors_map_to_status_codes() throws Exception {
        var missing = call(HttpMethod.GET, "/devices/abcdef", "Bearer s3cret", null);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(mapper.readTree(missing.getBody()).get("success").asBoolean()).isFalse();

        var unsupported = call(HttpMethod.POST, "/devices/111111/command", "Bearer s3cret", "{\"command\":\"teleport\"}");
        assertThat(unsupported.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

        var noCommand = call(HttpMethod.POST, "/devices/111111/command", "Bearer s3cret", "{}");
        assertThat(noCommand.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void health_is_up_while_mock_connected() {
        var resp = call(HttpMethod.GET, "/actuator/health", "Bearer s3cret", null);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).contains("\"UP\"");
    }

    @Test
    void websocket_greets_with_ws_connected() throws Exception {
        BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(HttpHeaders.AUTHORIZATION, "Bearer s3cret");

        WebSocketSession session = new StandardWebSocketClient().execute(new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                messages.add(message.getPayload());
            }
        }, headers, URI.create("ws://localhost:" + port + "/ws")).get(5, TimeUnit.SECONDS);
        try {
            String first = messages.poll(5, TimeUnit.SECONDS);
            assertThat(first).isNotNull();
            JsonNode greeting = mapper.readTree(first);
            assertThat(greeting.get("type").asText()).isEqualTo("ws_connected");
            assertThat(greeting.path("status").path("connected").asBoolean()).isTrue();
        } finally {
            session.close();
        }
    }
}
