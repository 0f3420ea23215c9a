package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

public record HighlightWithJob(@JsonUnwrapped Highlight highlight, Job job) {}
