package io.syncrelay.dispatcher;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "syncrelay.channel.type=in-memory",
        "syncrelay.queues.push=",
        "syncrelay.queues.receive=relay-receive"
    })
class UnconfiguredQueuesTest {

    @Autowired
    TestRestTemplate rest;

    @Test
    void missingPushQueueIsAConfigurationError() {
        ResponseEntity<JsonNode> response = rest.postForEntity("/api/dispatch", null, JsonNode.class);

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().path("status").asText()).isEqualTo("ERROR");
        assertThat(response.getBody().path("error").asText()).isEqualTo("missing env PUSH_QUEUE_URL");
    }
}
