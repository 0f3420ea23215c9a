package io.buildcv.backend.store;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.List;

/**
 * A job with the visible highlights that passed a search, plus the number of visible highlights
 * the job has in total.
 */
public record JobWithFilteredHighlights(
    @JsonUnwrapped Job job, List<Highlight> highlights, int allHighlightsCount) {}
