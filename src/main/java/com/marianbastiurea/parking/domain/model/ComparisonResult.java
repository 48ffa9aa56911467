package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.PolicyKind;

import java.util.Map;

/** Per-strategy results; a strategy whose run failed appears in {@code errors} instead. */
public record ComparisonResult(Map<PolicyKind, SimulationResult> results, Map<PolicyKind, String> errors) {}
