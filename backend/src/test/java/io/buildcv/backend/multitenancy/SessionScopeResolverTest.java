package io.buildcv.backend.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildcv.backend.exception.InvalidStateException;
import io.buildcv.backend.exception.NotAuthenticatedException;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class SessionScopeResolverTest {

  private final SessionScopeResolver resolver = new SessionScopeResolver();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void requestWithoutTokenIsAnonymous() {
    var request = new MockHttpServletRequest();
    request.addHeader(SessionScopeResolver.DEVICE_ID_HEADER, "device-0001");

    var scope = resolver.resolve(request);

    assertThat(scope.mode()).isEqualTo(StoreMode.ANONYMOUS);
    assertThat(scope.isAuthenticated()).isFalse();
    assertThat(scope.requireDeviceId()).isEqualTo("device-0001");
    assertThatThrownBy(scope::requirePrincipalId).isInstanceOf(NotAuthenticatedException.class);
  }

  @Test
  void requestWithJwtIsAuthenticatedAsSubject() {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject("user_42")
            .issuedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .expiresAt(Instant.parse("2099-01-01T00:00:00Z"))
            .build();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
    var request = new MockHttpServletRequest();

    var scope = resolver.resolve(request);

    assertThat(scope.mode()).isEqualTo(StoreMode.AUTHENTICATED);
    assertThat(scope.requirePrincipalId()).isEqualTo("user_42");
    assertThat(scope.deviceId()).isNull();
  }

  @Test
  void missingDeviceIdIsRejectedOnlyWhenRequired() {
    var scope = resolver.resolve(new MockHttpServletRequest());

    assertThat(scope.deviceId()).isNull();
    assertThatThrownBy(scope::requireDeviceId).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void malformedDeviceIdIsRejected() {
    var request = new MockHttpServletRequest();
    request.addHeader(SessionScopeResolver.DEVICE_ID_HEADER, "../secret");

    assertThatThrownBy(() -> resolver.resolve(request))
        .isInstanceOf(InvalidStateException.class);
  }
}
