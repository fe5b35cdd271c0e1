package io.syncrelay.dispatcher;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncrelay.relay.RelayFailure;
import io.syncrelay.relay.dispatch.DispatchRequest;
import io.syncrelay.relay.dispatch.DispatchResult;
import io.syncrelay.relay.dispatch.Dispatcher;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DispatchControllerTest {

    private Dispatcher dispatcher;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        dispatcher = mock(Dispatcher.class);
        mvc = MockMvcBuilders.standaloneSetup(new DispatchController(dispatcher, new ObjectMapper())).build();
    }

    @Test
    void emptyBodySelectsDefaults() throws Exception {
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(DispatchResult.failed(RelayFailure.TIMEOUT, 25_000L, "timeout waiting for response"));

        mvc.perform(post("/api/dispatch"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.status").value("TIMEOUT"))
                .andExpect(jsonPath("$.totalMs").value(25_000))
                .andExpect(jsonPath("$.error").value("timeout waiting for response"))
                .andExpect(jsonPath("$.httpStatus").doesNotExist())
                .andExpect(jsonPath("$.output").doesNotExist());

        verify(dispatcher).dispatch(DispatchRequest.empty(), Optional.empty());
    }

    @Test
    void bodyOptionsAndDeadlineHeaderArePassedThrough() throws Exception {
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(DispatchResult.failed(RelayFailure.PUBLISH_FAILURE, 12L, "send message: denied"));

        mvc.perform(post("/api/dispatch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(DispatchController.DEADLINE_HEADER, "1500")
                        .content("{\"runId\":\"run-7\",\"delaySeconds\":2,\"messageBodyBytes\":128,\"maxWaitMs\":900,\"extra\":true}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.error").value("send message: denied"));

        verify(dispatcher).dispatch(new DispatchRequest("run-7", 2, 128, 900), Optional.of(Duration.ofMillis(1500)));
    }

    @Test
    void unparsableBodyIsRejectedWithoutDispatching() throws Exception {
        mvc.perform(post("/api/dispatch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.totalMs").value(0))
                .andExpect(jsonPath("$.error").value(startsWith("invalid json body: ")));

        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void negativeDeadlineHeaderMeansNoTimeLeft() throws Exception {
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(DispatchResult.failed(RelayFailure.DEADLINE_TOO_CLOSE, 0L, "deadline too close"));

        mvc.perform(post("/api/dispatch").header(DispatchController.DEADLINE_HEADER, "-5"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("deadline too close"));

        verify(dispatcher).dispatch(eq(DispatchRequest.empty()), eq(Optional.of(Duration.ZERO)));
    }
}
