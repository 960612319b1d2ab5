package com.gentoro.toolbroker.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** A tool as advertised by a provider, annotated with the id of the provider exposing it. */
public record ToolDescriptor(
    String name,
    String description,
    JsonNode schema,
    String riskLevel,
    List<String> complianceImpact,
    String providerId) {

  public static final String DEFAULT_RISK_LEVEL = "medium";

  public ToolDescriptor {
    riskLevel = riskLevel == null || riskLevel.isBlank() ? DEFAULT_RISK_LEVEL : riskLevel;
    complianceImpact = complianceImpact == null ? List.of() : List.copyOf(complianceImpact);
  }
}
