package io.buildcv.backend.multitenancy;

import io.buildcv.backend.exception.InvalidStateException;
import io.buildcv.backend.exception.NotAuthenticatedException;

/**
 * Who the current request acts for. Anonymous sessions are identified by their device id only;
 * authenticated sessions by the token subject, optionally still carrying the device id of the
 * anonymous session they came from.
 */
public record SessionScope(StoreMode mode, String principalId, String deviceId) {

  public static SessionScope anonymous(String deviceId) {
    return new SessionScope(StoreMode.ANONYMOUS, null, deviceId);
  }

  public static SessionScope authenticated(String principalId, String deviceId) {
    return new SessionScope(StoreMode.AUTHENTICATED, principalId, deviceId);
  }

  public boolean isAuthenticated() {
    return mode == StoreMode.AUTHENTICATED;
  }

  public String requirePrincipalId() {
    if (principalId == null) {
      throw new NotAuthenticatedException();
    }
    return principalId;
  }

  public String requireDeviceId() {
    if (deviceId == null) {
      throw new InvalidStateException(
          "Missing device id", "Header " + SessionScopeResolver.DEVICE_ID_HEADER + " is required");
    }
    return deviceId;
  }
}
