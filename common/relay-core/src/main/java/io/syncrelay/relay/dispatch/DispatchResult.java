package io.syncrelay.relay.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.syncrelay.relay.RelayFailure;
import java.util.Objects;

/**
 * Outcome of one synchronous dispatch as returned to the caller.
 *
 * @param status     {@code OK}, {@code TIMEOUT} or {@code ERROR}
 * @param totalMs    elapsed time since dispatch start
 * @param output     result envelope, present for {@code OK}
 * @param error      failure description, present otherwise
 * @param httpStatus status code for HTTP surfaces
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(DispatchStatus status,
                             long totalMs,
                             DispatchOutput output,
                             String error,
                             @JsonIgnore int httpStatus) {

  public DispatchResult {
    Objects.requireNonNull(status, "status");
  }

  public static DispatchResult ok(long totalMs, DispatchOutput output) {
    return new DispatchResult(DispatchStatus.OK, totalMs, Objects.requireNonNull(output, "output"), null, 200);
  }

  public static DispatchResult failed(RelayFailure failure, long totalMs, String error) {
    Objects.requireNonNull(failure, "failure");
    return new DispatchResult(DispatchStatus.valueOf(failure.status()), totalMs, null, error, failure.httpStatus());
  }

  @JsonIgnore
  public boolean isOk() {
    return status == DispatchStatus.OK;
  }
}
