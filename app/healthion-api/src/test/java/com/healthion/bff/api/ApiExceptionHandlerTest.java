package com.healthion.bff.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.healthion.bff.service.HealthionMetrics;
import com.healthion.bff.service.IdentityConflictException;
import com.healthion.bff.service.UpstreamIntegrationException;
import com.healthion.bff.service.UpstreamIntegrationException.Reason;
import com.healthion.bff.service.UpstreamNotLinkedException;
import com.healthion.bff.service.UserPersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ApiExceptionHandlerTest {

  private final HealthionMetrics metrics = mock(HealthionMetrics.class);
  private final ApiExceptionHandler handler = new ApiExceptionHandler(metrics);

  @Test
  void handleBadRequestReturns400() {
    final var response = handler.handleBadRequest(new IllegalArgumentException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("BAD_REQUEST", "bad"));
  }

  @Test
  void handleNotLinkedReturns400() {
    final var response = handler.handleNotLinked(new UpstreamNotLinkedException("user-1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("UPSTREAM_NOT_LINKED");
    verifyNoInteractions(metrics);
  }

  @Test
  void handleIdentityConflictReturns409() {
    final var response =
        handler.handleIdentityConflict(new IdentityConflictException("email taken", null));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().code()).isEqualTo("IDENTITY_CONFLICT");
  }

  @Test
  void upstreamReasonsMapToStatusAndCode() {
    assertUpstream(Reason.NOT_CONFIGURED, HttpStatus.SERVICE_UNAVAILABLE);
    assertUpstream(Reason.TIMEOUT, HttpStatus.GATEWAY_TIMEOUT);
    assertUpstream(Reason.NOT_FOUND, HttpStatus.NOT_FOUND);
    assertUpstream(Reason.UNAUTHORIZED, HttpStatus.BAD_GATEWAY);
    assertUpstream(Reason.BAD_REQUEST, HttpStatus.BAD_GATEWAY);
    assertUpstream(Reason.BAD_GATEWAY, HttpStatus.BAD_GATEWAY);
    assertUpstream(Reason.INVALID_RESPONSE, HttpStatus.BAD_GATEWAY);
  }

  @Test
  void handlePersistenceReturns503() {
    final var response =
        handler.handlePersistence(
            new UserPersistenceException("user-1", "link upstream user", "db down"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().code()).isEqualTo("PERSISTENCE_FAILURE");
  }

  private void assertUpstream(Reason reason, HttpStatus expected) {
    final var response =
        handler.handleUpstreamIntegration(new UpstreamIntegrationException(reason, "failed"));

    assertThat(response.getStatusCode()).isEqualTo(expected);
    assertThat(response.getBody().code()).isEqualTo("UPSTREAM_" + reason.name());
    verify(metrics).recordUpstreamError("UPSTREAM_" + reason.name());
  }
}
