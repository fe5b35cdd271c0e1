package io.syncrelay.dispatcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.dispatch.DispatchRequest;
import io.syncrelay.relay.dispatch.DispatchResult;
import io.syncrelay.relay.dispatch.Dispatcher;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous entry point: one POST, one correlated response or a classified failure.
 * <p>
 * The body is read as raw text so that an empty body selects all defaults and an unparsable one is
 * answered in the same result shape as every other failure.
 */
@RestController
@RequestMapping("/api")
public class DispatchController {
    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    /**
     * Milliseconds the caller is still willing to wait, when it knows.
     */
    static final String DEADLINE_HEADER = "X-Request-Deadline-Ms";

    private final Dispatcher dispatcher;
    private final ObjectMapper mapper;

    public DispatchController(Dispatcher dispatcher, ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
    }

    @PostMapping(value = "/dispatch", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DispatchResult> dispatch(@RequestBody(required = false) String body,
                                                   @RequestHeader(value = DEADLINE_HEADER, required = false) Long deadlineMs) {
        log.info("[REST] POST /api/dispatch deadlineMs={} body={}", deadlineMs, body);
        DispatchRequest request;
        try {
            request = parse(body);
        } catch (JsonProcessingException e) {
            DispatchResult rejected = DispatchResult.failed(RelayFailure.INVALID_INPUT, 0L,
                    "invalid json body: " + e.getOriginalMessage());
            log.info("[REST] POST /api/dispatch -> status={} error={}", rejected.httpStatus(), rejected.error());
            return respond(rejected);
        }
        Optional<Duration> externalRemaining = deadlineMs == null
                ? Optional.empty()
                : Optional.of(Duration.ofMillis(Math.max(0L, deadlineMs)));
        DispatchResult result = dispatcher.dispatch(request, externalRemaining);
        log.info("[REST] POST /api/dispatch -> status={} result={} totalMs={}",
                result.httpStatus(), result.status(), result.totalMs());
        return respond(result);
    }

    private DispatchRequest parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return DispatchRequest.empty();
        }
        DispatchRequest request = mapper.readValue(body, DispatchRequest.class);
        return request == null ? DispatchRequest.empty() : request;
    }

    private static ResponseEntity<DispatchResult> respond(DispatchResult result) {
        return ResponseEntity.status(result.httpStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .body(result);
    }
}
