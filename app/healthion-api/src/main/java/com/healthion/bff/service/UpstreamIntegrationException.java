package com.healthion.bff.service;

/** wearables platform 呼び出しの失敗。{@link #code()} が API エラーコードとメトリクスタグになる。 */
public class UpstreamIntegrationException extends RuntimeException {

  private static final String CODE_PREFIX = "UPSTREAM_";

  public enum Reason {
    NOT_CONFIGURED,
    UNAUTHORIZED,
    NOT_FOUND,
    BAD_REQUEST,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public UpstreamIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UpstreamIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public String code() {
    return CODE_PREFIX + reason.name();
  }
}
