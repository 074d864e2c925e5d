package com.fincube.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured summary handed to the reasoning oracle.
 */
@Value
@Builder
public class ReasoningRequest {
    String address;
    NeighborAnalysis neighborAnalysis;
    Map<String, Double> features;
    PatternReport patternReport;
    ValidationReport validation;
    List<String> edgeCases;
}
