package io.syncrelay.relay.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DispatchRequestTest {

  @Test
  void blankRunIdIsGenerated() {
    DispatchRequest normalised = new DispatchRequest("  ", null, null, null).normalise("run-42", 900);

    assertThat(normalised.runId()).isEqualTo("run-42");
    assertThat(normalised.delaySeconds()).isZero();
    assertThat(normalised.messageBodyBytes()).isZero();
    assertThat(normalised.maxWaitMs()).isNull();
  }

  @Test
  void delayIsClampedToChannelMaximum() {
    assertThat(new DispatchRequest("r", 5_000, null, null).normalise("x", 900).delaySeconds()).isEqualTo(900);
    assertThat(new DispatchRequest("r", 30, null, null).normalise("x", 10).delaySeconds()).isEqualTo(10);
    assertThat(new DispatchRequest("r", -3, null, null).normalise("x", 900).delaySeconds()).isZero();
  }

  @Test
  void negativePaddingBecomesZero() {
    assertThat(new DispatchRequest("r", null, -1, 100).normalise("x", 900).messageBodyBytes()).isZero();
  }

  @Test
  void correlationIdsAreThirtyTwoHexCharacters() {
    CorrelationIds ids = new CorrelationIds();

    String first = ids.next();
    String second = ids.next();

    assertThat(first).hasSize(32).matches("[0-9a-f]{32}");
    assertThat(second).isNotEqualTo(first);
  }
}
