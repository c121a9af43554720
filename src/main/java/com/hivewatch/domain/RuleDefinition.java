package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative detection rule as written in a rule file or derived from configuration.
 *
 * Example:
 * <pre>
 * id: cmd-pipe-to-shell
 * kind: command-pattern
 * description: Download piped straight into a shell
 * risk_weight: 40
 * parameters:
 *   regex: 'wget\s+.+\s+\|\s*sh'
 * </pre>
 */
public class RuleDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("kind")
    private RuleKind kind;

    @JsonProperty("description")
    private String description;

    @JsonProperty("risk_weight")
    private int riskWeight;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("parameters")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Default constructor
     */
    public RuleDefinition() {
    }

    public RuleDefinition(String id, RuleKind kind, int riskWeight, Map<String, Object> parameters) {
        this.id = id;
        this.kind = kind;
        this.riskWeight = riskWeight;
        this.parameters = new LinkedHashMap<>(parameters);
    }

    // Getters and Setters

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public RuleKind getKind() {
        return kind;
    }

    public void setKind(RuleKind kind) {
        this.kind = kind;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getRiskWeight() {
        return riskWeight;
    }

    public void setRiskWeight(int riskWeight) {
        this.riskWeight = riskWeight;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "RuleDefinition{" + id + " " + (kind != null ? kind.getValue() : null)
            + " weight=" + riskWeight + (enabled ? "" : " disabled") + "}";
    }
}
