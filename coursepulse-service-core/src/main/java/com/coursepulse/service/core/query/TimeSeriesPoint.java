package com.coursepulse.service.core.query;

import java.time.Instant;
import java.util.Map;

public record TimeSeriesPoint(Instant timestamp, double value, String metric, Map<String, String> dimensions) {}
