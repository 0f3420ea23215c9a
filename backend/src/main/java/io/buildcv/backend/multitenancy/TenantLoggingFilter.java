package io.buildcv.backend.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_PRINCIPAL_ID = "principalId";
  private static final String MDC_DEVICE_ID = "deviceId";

  private static final Pattern LOGGABLE_DEVICE_ID = Pattern.compile("[A-Za-z0-9_-]{8,64}");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_PRINCIPAL_ID, jwtAuth.getToken().getSubject());
      }

      // Raw header values never reach the log unless they are well-formed.
      String deviceId = request.getHeader(SessionScopeResolver.DEVICE_ID_HEADER);
      if (deviceId != null && LOGGABLE_DEVICE_ID.matcher(deviceId).matches()) {
        MDC.put(MDC_DEVICE_ID, deviceId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_DEVICE_ID);
      MDC.remove(MDC_PRINCIPAL_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
