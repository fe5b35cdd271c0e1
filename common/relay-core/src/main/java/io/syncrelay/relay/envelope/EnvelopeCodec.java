package io.syncrelay.relay.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Serialises/deserialises relay envelopes to the JSON wire shape shared by the dispatcher and
 * the worker. Unknown fields are ignored on decode.
 */
public final class EnvelopeCodec {

  private final ObjectMapper mapper;

  public EnvelopeCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String encode(RequestEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    ObjectNode node = mapper.createObjectNode();
    node.put("id", envelope.id());
    node.put("sendUnixNano", envelope.sendUnixNano());
    node.put("sendStartUnixNano", envelope.sendStartUnixNano());
    node.put("runId", envelope.runId());
    if (envelope.padding() != null) {
      node.put("padding", envelope.padding());
    }
    return write(node);
  }

  public String encode(ResponseEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    ObjectNode node = mapper.createObjectNode();
    node.put("id", envelope.id());
    node.put("runId", envelope.runId());
    node.put("region", nullToEmpty(envelope.region()));
    node.put("pushQueueName", nullToEmpty(envelope.pushQueueName()));
    node.put("receiveQueueName", nullToEmpty(envelope.receiveQueueName()));
    node.put("sendUnixNano", envelope.sendUnixNano());
    node.put("sendStartUnixNano", envelope.sendStartUnixNano());
    node.put("workerReceiveUnixNano", envelope.workerReceiveUnixNano());
    node.put("workerDoneUnixNano", envelope.workerDoneUnixNano());
    node.put("callbackSendStartUnixNano", envelope.callbackSendStartUnixNano());
    node.put("sqsSentTimestampMs", envelope.sqsSentTimestampMs());
    node.put("sqsFirstReceiveTimestampMs", envelope.sqsFirstReceiveTimestampMs());
    node.put("sqsApproxReceiveCount", envelope.sqsApproxReceiveCount());
    return write(node);
  }

  /**
   * Decodes a request body published by the dispatcher.
   *
   * @throws EnvelopeDecodingException when the body is not a JSON object, a numeric field has the
   *                                   wrong type, or {@code id}/{@code runId} is missing
   */
  public RequestEnvelope decodeRequest(String body) {
    ObjectNode node = readObject(body);
    return new RequestEnvelope(
        requireText(node, "id"),
        requireText(node, "runId"),
        longOrZero(node, "sendUnixNano"),
        longOrZero(node, "sendStartUnixNano"),
        textOrNull(node.get("padding")));
  }

  /**
   * Decodes a response body read from the outbound channel.
   *
   * @throws EnvelopeDecodingException when the body cannot be matched to any request
   */
  public ResponseEnvelope decodeResponse(String body) {
    ObjectNode node = readObject(body);
    return new ResponseEnvelope(
        requireText(node, "id"),
        nullToEmpty(textOrNull(node.get("runId"))),
        textOrNull(node.get("region")),
        textOrNull(node.get("pushQueueName")),
        textOrNull(node.get("receiveQueueName")),
        longOrZero(node, "sendUnixNano"),
        longOrZero(node, "sendStartUnixNano"),
        longOrZero(node, "workerReceiveUnixNano"),
        longOrZero(node, "workerDoneUnixNano"),
        longOrZero(node, "callbackSendStartUnixNano"),
        longOrZero(node, "sqsSentTimestampMs"),
        longOrZero(node, "sqsFirstReceiveTimestampMs"),
        longOrZero(node, "sqsApproxReceiveCount"));
  }

  private ObjectNode readObject(String body) {
    if (body == null || body.isBlank()) {
      throw new EnvelopeDecodingException("message body is empty");
    }
    JsonNode node;
    try {
      node = mapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new EnvelopeDecodingException("message body is not valid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw new EnvelopeDecodingException("message body must be a JSON object");
    }
    return (ObjectNode) node;
  }

  private String write(ObjectNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialise envelope", ex);
    }
  }

  private static String requireText(ObjectNode node, String field) {
    String value = textOrNull(node.get(field));
    if (value == null || value.isBlank()) {
      throw new EnvelopeDecodingException("missing " + field + " in message body");
    }
    return value;
  }

  private static long longOrZero(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return 0L;
    }
    if (!value.isIntegralNumber() || !value.canConvertToLong()) {
      throw new EnvelopeDecodingException(field + " must be an integer");
    }
    return value.longValue();
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isTextual()) {
      throw new EnvelopeDecodingException("expected a string but found " + node.getNodeType());
    }
    return node.textValue();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
