package io.syncrelay.relay.envelope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class EnvelopeCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final EnvelopeCodec codec = new EnvelopeCodec(mapper);

  @Test
  void requestUsesWireFieldNames() throws Exception {
    String json = codec.encode(new RequestEnvelope("abc", "run-1", 10L, 11L, null));

    JsonNode node = mapper.readTree(json);
    assertThat(node.get("id").asText()).isEqualTo("abc");
    assertThat(node.get("runId").asText()).isEqualTo("run-1");
    assertThat(node.get("sendUnixNano").asLong()).isEqualTo(10L);
    assertThat(node.get("sendStartUnixNano").asLong()).isEqualTo(11L);
    assertThat(node.has("padding")).isFalse();
  }

  @Test
  void paddingInflatesRequestBody() {
    String plain = codec.encode(new RequestEnvelope("abc", "run-1", 1L, 1L, null));
    String padded = codec.encode(new RequestEnvelope("abc", "run-1", 1L, 1L, RequestEnvelope.padding(256)));

    assertThat(padded.length()).isGreaterThanOrEqualTo(plain.length() + 256);
    assertThat(RequestEnvelope.padding(0)).isNull();
    assertThat(RequestEnvelope.padding(-4)).isNull();
  }

  @Test
  void decodesRequestAndIgnoresUnknownFields() {
    RequestEnvelope request = codec.decodeRequest(
        "{\"id\":\"abc\",\"runId\":\"run-1\",\"sendUnixNano\":5,\"extra\":{\"nested\":true}}");

    assertThat(request.id()).isEqualTo("abc");
    assertThat(request.runId()).isEqualTo("run-1");
    assertThat(request.sendUnixNano()).isEqualTo(5L);
    assertThat(request.sendStartUnixNano()).isZero();
  }

  @Test
  void requestWithoutRunIdIsRejected() {
    assertThatThrownBy(() -> codec.decodeRequest("{\"id\":\"abc\"}"))
        .isInstanceOf(EnvelopeDecodingException.class)
        .hasMessage("missing runId in message body");
    assertThatThrownBy(() -> codec.decodeRequest("{\"id\":\"  \",\"runId\":\"r\"}"))
        .isInstanceOf(EnvelopeDecodingException.class)
        .hasMessage("missing id in message body");
  }

  @Test
  void responseCarriesAllStageTimestamps() {
    ResponseEnvelope response = new ResponseEnvelope("abc", "run-1", "eu-west-1", "push", "receive",
        1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L);

    ResponseEnvelope decoded = codec.decodeResponse(codec.encode(response));

    assertThat(decoded).isEqualTo(response);
  }

  @Test
  void responseWithoutRunIdDecodesToEmptyRunId() {
    ResponseEnvelope decoded = codec.decodeResponse("{\"id\":\"abc\"}");

    assertThat(decoded.runId()).isEmpty();
    assertThat(decoded.matches("abc", "run-1")).isFalse();
  }

  @Test
  void matchingTrimsEnvelopeValues() {
    ResponseEnvelope decoded = codec.decodeResponse("{\"id\":\" abc \",\"runId\":\"run-1 \"}");

    assertThat(decoded.matches("abc", "run-1")).isTrue();
    assertThat(decoded.matches("abc", "run-2")).isFalse();
    assertThat(decoded.matches("abd", "run-1")).isFalse();
  }

  @Test
  void malformedBodiesAreRejected() {
    assertThatThrownBy(() -> codec.decodeResponse("")).isInstanceOf(EnvelopeDecodingException.class);
    assertThatThrownBy(() -> codec.decodeResponse("not json")).isInstanceOf(EnvelopeDecodingException.class);
    assertThatThrownBy(() -> codec.decodeResponse("[1,2]")).isInstanceOf(EnvelopeDecodingException.class);
    assertThatThrownBy(() -> codec.decodeResponse("{\"id\":42}")).isInstanceOf(EnvelopeDecodingException.class);
    assertThatThrownBy(() -> codec.decodeResponse("{\"id\":\"abc\",\"sendUnixNano\":\"soon\"}"))
        .isInstanceOf(EnvelopeDecodingException.class)
        .hasMessageContaining("sendUnixNano");
  }
}
