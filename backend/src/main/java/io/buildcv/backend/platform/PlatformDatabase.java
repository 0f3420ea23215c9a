package io.buildcv.backend.platform;

/** A database instance as reported by the platform API. */
public record PlatformDatabase(String name, String hostname) {}
