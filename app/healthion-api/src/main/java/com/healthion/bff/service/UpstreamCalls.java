/*
 * どこで: Healthion サービス層
 * 何を: wearables platform 呼び出しの例外を UpstreamIntegrationException へ揃える
 * なぜ: クライアントごとに HTTP ステータスと reason の対応がずれないようにするため
 */
package com.healthion.bff.service;

import com.healthion.bff.config.UpstreamClientProperties;
import java.net.SocketTimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class UpstreamCalls {

  private static final Logger logger = LoggerFactory.getLogger(UpstreamCalls.class);

  private UpstreamCalls() {}

  static void requireConfigured(UpstreamClientProperties properties) {
    if (!properties.isConfigured()) {
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.NOT_CONFIGURED,
          "wearables platform api key is not configured");
    }
  }

  static <T> T execute(String operation, Supplier<T> call) {
    try {
      final T response = call.get();
      if (response == null) {
        logger.warn("upstream {} returned empty body", operation);
        throw new UpstreamIntegrationException(
            UpstreamIntegrationException.Reason.INVALID_RESPONSE,
            "upstream " + operation + " response is empty");
      }
      return response;
    } catch (RestClientResponseException ex) {
      throw fromResponse(operation, ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("upstream {} timed out", operation);
        throw new UpstreamIntegrationException(
            UpstreamIntegrationException.Reason.TIMEOUT,
            "upstream " + operation + " timeout",
            ex);
      }
      logger.warn("upstream {} connection failed", operation, ex);
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.BAD_GATEWAY,
          "upstream " + operation + " connection failed",
          ex);
    } catch (UpstreamIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("upstream {} response parse failed", operation, ex);
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.INVALID_RESPONSE,
          "upstream " + operation + " response parse failed",
          ex);
    }
  }

  static UpstreamIntegrationException fromResponse(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "upstream {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    final UpstreamIntegrationException.Reason reason =
        switch (status) {
          case 400, 422 -> UpstreamIntegrationException.Reason.BAD_REQUEST;
          case 401, 403 -> UpstreamIntegrationException.Reason.UNAUTHORIZED;
          case 404 -> UpstreamIntegrationException.Reason.NOT_FOUND;
          case 504 -> UpstreamIntegrationException.Reason.TIMEOUT;
          default -> UpstreamIntegrationException.Reason.BAD_GATEWAY;
        };
    return new UpstreamIntegrationException(
        reason, "upstream " + operation + " failed with status " + status, ex);
  }

  static boolean isTimeout(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
