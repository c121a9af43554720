package com.hivewatch.correlation.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hivewatch.domain.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses rule files and compiles rule definitions into executable rules.
 *
 * A rule file holds either a list of rules, a map with a {@code rules} list, or a single rule:
 * <pre>
 * rules:
 *   - id: brute-force
 *     kind: rate-threshold
 *     risk_weight: 30
 *     parameters:
 *       event_kind: login_failed
 *       key: source_ip
 *       threshold: 5
 *       window: 60s
 * </pre>
 */
@Component
public class RuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    private final YAMLMapper yamlMapper;

    public RuleCompiler() {
        this.yamlMapper = new YAMLMapper();
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Parses the rule definitions in one YAML document.
     *
     * @param origin file or resource name, for messages
     * @throws IOException if the document is not valid YAML or not a rule structure
     */
    public List<RuleDefinition> parseYaml(String origin, String yaml) throws IOException {
        JsonNode root = yamlMapper.readTree(yaml);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        JsonNode list;
        if (root.isArray()) {
            list = root;
        } else if (root.has("rules")) {
            list = root.get("rules");
        } else if (root.has("id")) {
            return List.of(yamlMapper.treeToValue(root, RuleDefinition.class));
        } else {
            throw new IOException(origin + ": expected a rule list, a 'rules' key, or a single rule");
        }
        List<RuleDefinition> rules = new ArrayList<>(yamlMapper.convertValue(list,
            new TypeReference<List<RuleDefinition>>() { }));
        log.debug("Parsed {} rules from {}", rules.size(), origin);
        return rules;
    }

    /**
     * @throws IllegalArgumentException if the definition is incomplete or its parameters are invalid
     */
    public CompiledRule compile(RuleDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Rule must have an id");
        }
        if (definition.getKind() == null) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " must have a kind");
        }
        if (definition.getRiskWeight() < 0) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " has a negative risk_weight");
        }
        switch (definition.getKind()) {
            case COMMAND_PATTERN:
                return new CommandPatternRule(definition);
            case IP_MEMBERSHIP:
                return new IpMembershipRule(definition);
            case RATE_THRESHOLD:
                return new RateThresholdRule(definition);
            case COMPOSITE:
                return new CompositeRule(definition);
            case EVENT_MATCH:
                return new EventMatchRule(definition);
            default:
                throw new IllegalArgumentException("Unsupported rule kind " + definition.getKind());
        }
    }
}
