package com.example.ajml.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/samples: bundled sample project names.
 */
public record SampleListResponse(List<String> samples) {}
