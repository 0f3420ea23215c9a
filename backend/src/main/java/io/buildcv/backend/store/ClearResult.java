package io.buildcv.backend.store;

public record ClearResult(int jobsDeleted, int highlightsDeleted) {}
