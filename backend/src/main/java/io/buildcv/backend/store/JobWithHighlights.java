package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.List;

public record JobWithHighlights(@JsonUnwrapped Job job, List<Highlight> highlights) {}
