package com.hivewatch.correlation;

import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RuleDefinition;
import com.hivewatch.domain.RuleKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule definitions derived from the alert settings: one command rule per configured pattern,
 * the static IP lists, the threat-feed reputation check, successful logins and file uploads.
 */
public final class BuiltinRules {

    public static final String COMMAND_PREFIX = "on-command:";
    public static final String IP_LISTS = "ip-lists";
    public static final String THREAT_INTEL = "threat-intel";
    public static final String SUCCESSFUL_LOGIN = "successful-login";
    public static final String FILE_UPLOAD = "file-upload";

    private BuiltinRules() {
    }

    public static List<RuleDefinition> from(HiveWatchProperties properties) {
        HiveWatchProperties.Alerts alerts = properties.getAlerts();
        List<RuleDefinition> rules = new ArrayList<>();

        for (String pattern : alerts.getOnCommands()) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            rules.add(rule(COMMAND_PREFIX + pattern, RuleKind.COMMAND_PATTERN, alerts.getCommandWeight(),
                Map.of("patterns", List.of(pattern)), "Configured suspicious command: " + pattern));
        }

        if (!alerts.getIpBlacklist().isEmpty() || !alerts.getIpWhitelist().isEmpty()) {
            rules.add(rule(IP_LISTS, RuleKind.IP_MEMBERSHIP, alerts.getBlacklistWeight(),
                Map.of("blacklist", alerts.getIpBlacklist(), "whitelist", alerts.getIpWhitelist()),
                "Source address on the configured blacklist"));
        }

        if (!properties.getThreatIntel().getFeeds().isEmpty()) {
            rules.add(rule(THREAT_INTEL, RuleKind.IP_MEMBERSHIP, properties.getThreatIntel().getThreatWeight(),
                Map.of("reputation", true, "whitelist", alerts.getIpWhitelist()),
                "Source address listed by a threat-intelligence feed"));
        }

        if (alerts.isOnSuccessfulLogin()) {
            rules.add(rule(SUCCESSFUL_LOGIN, RuleKind.EVENT_MATCH, alerts.getLoginWeight(),
                Map.of("event_kind", EventKind.LOGIN_SUCCESS.getValue()), "Attacker logged in"));
        }

        if (alerts.isOnFileUpload()) {
            rules.add(rule(FILE_UPLOAD, RuleKind.EVENT_MATCH, alerts.getFileUploadWeight(),
                Map.of("event_kind", EventKind.FILE_UPLOAD.getValue()), "File uploaded to the honeypot"));
        }
        return rules;
    }

    private static RuleDefinition rule(String id, RuleKind kind, int weight, Map<String, Object> parameters,
                                       String description) {
        RuleDefinition definition = new RuleDefinition(id, kind, weight, new LinkedHashMap<>(parameters));
        definition.setDescription(description);
        return definition;
    }
}
