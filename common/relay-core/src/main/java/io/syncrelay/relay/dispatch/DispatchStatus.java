package io.syncrelay.relay.dispatch;

public enum DispatchStatus {
  OK,
  TIMEOUT,
  ERROR
}
