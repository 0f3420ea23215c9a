package io.buildcv.backend.multitenancy;

import io.buildcv.backend.exception.InvalidStateException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.regex.Pattern;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Derives the {@link SessionScope} of a request from its bearer token and device header. */
@Component
public class SessionScopeResolver {

  public static final String DEVICE_ID_HEADER = "X-Device-Id";

  private static final Pattern DEVICE_ID = Pattern.compile("[A-Za-z0-9_-]{8,64}");

  public SessionScope resolve(HttpServletRequest request) {
    String deviceId = deviceId(request);
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof JwtAuthenticationToken jwtAuth) {
      return SessionScope.authenticated(jwtAuth.getToken().getSubject(), deviceId);
    }
    return SessionScope.anonymous(deviceId);
  }

  static String deviceId(HttpServletRequest request) {
    String header = request.getHeader(DEVICE_ID_HEADER);
    if (header == null || header.isBlank()) {
      return null;
    }
    if (!DEVICE_ID.matcher(header).matches()) {
      throw new InvalidStateException(
          "Invalid device id",
          DEVICE_ID_HEADER + " must be 8 to 64 letters, digits, '-' or '_'");
    }
    return header;
  }
}
