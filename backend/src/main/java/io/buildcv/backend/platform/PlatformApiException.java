package io.buildcv.backend.platform;

public class PlatformApiException extends RuntimeException {

  public PlatformApiException(String message) {
    super(message);
  }

  public PlatformApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
