package com.coursepulse.service.core.query;

public record EndpointStats(String path, long count, double avgMs) {}
