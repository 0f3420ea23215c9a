package io.buildcv.backend.store;

import java.math.BigDecimal;

/** A quantified outcome attached to a highlight, e.g. prefix "$", value 2, unit "M". */
public record Metric(
    String label, BigDecimal value, String unit, String prefix, String description) {}
