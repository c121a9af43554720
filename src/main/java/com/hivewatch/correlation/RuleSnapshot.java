package com.hivewatch.correlation;

import com.hivewatch.correlation.rules.CompiledRule;
import com.hivewatch.correlation.rules.CompositeRule;
import com.hivewatch.correlation.rules.IpMembershipRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of compiled rules. An evaluation reads exactly one snapshot from start to finish;
 * a reload builds a new snapshot with a higher version.
 */
public final class RuleSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final Map<String, CompiledRule> rulesById;
    private final List<CompiledRule> eventRules;
    private final List<CompositeRule> compositeRules;
    private final List<IpMembershipRule> ipRules;
    private final Map<String, Integer> weights;

    public RuleSnapshot(long version, Instant loadedAt, List<CompiledRule> rules) {
        this.version = version;
        this.loadedAt = loadedAt;
        Map<String, CompiledRule> byId = new LinkedHashMap<>();
        List<CompiledRule> events = new ArrayList<>();
        List<CompositeRule> composites = new ArrayList<>();
        List<IpMembershipRule> ips = new ArrayList<>();
        Map<String, Integer> weightMap = new LinkedHashMap<>();
        for (CompiledRule rule : rules) {
            byId.put(rule.getId(), rule);
            weightMap.put(rule.getId(), rule.getRiskWeight());
            if (rule instanceof CompositeRule) {
                composites.add((CompositeRule) rule);
            } else {
                events.add(rule);
            }
            if (rule instanceof IpMembershipRule) {
                ips.add((IpMembershipRule) rule);
            }
        }
        this.rulesById = Collections.unmodifiableMap(byId);
        this.eventRules = List.copyOf(events);
        this.compositeRules = List.copyOf(composites);
        this.ipRules = List.copyOf(ips);
        this.weights = Collections.unmodifiableMap(weightMap);
    }

    public static RuleSnapshot empty() {
        return new RuleSnapshot(0, Instant.EPOCH, List.of());
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public CompiledRule get(String id) {
        return rulesById.get(id);
    }

    public boolean contains(String id) {
        return rulesById.containsKey(id);
    }

    public List<CompiledRule> getEventRules() {
        return eventRules;
    }

    public List<CompositeRule> getCompositeRules() {
        return compositeRules;
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }

    public int size() {
        return rulesById.size();
    }

    /**
     * True when any IP-membership rule whitelists the address.
     */
    public boolean isWhitelisted(String ip) {
        if (ip == null) {
            return false;
        }
        for (IpMembershipRule rule : ipRules) {
            if (rule.isWhitelisted(ip)) {
                return true;
            }
        }
        return false;
    }
}
