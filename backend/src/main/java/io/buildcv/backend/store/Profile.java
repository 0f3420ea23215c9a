package io.buildcv.backend.store;

import java.time.Instant;

public record Profile(String fullName, Instant updatedAt) {}
