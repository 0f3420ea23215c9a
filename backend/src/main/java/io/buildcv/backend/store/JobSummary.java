package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/** A job with the number of highlights attached to it, hidden ones included. */
public record JobSummary(@JsonUnwrapped Job job, long highlightCount) {}
