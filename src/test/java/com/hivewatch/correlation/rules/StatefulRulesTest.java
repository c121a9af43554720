package com.hivewatch.correlation.rules;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.ReputationVerdict;
import com.hivewatch.domain.RuleDefinition;
import com.hivewatch.domain.RuleKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Rate, Composite and IP Membership Rule Tests")
class StatefulRulesTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Event loginFailed(String sessionId, String ip, Instant at) {
        return Event.builder()
            .sessionId(sessionId)
            .sourceIp(ip)
            .kind(EventKind.LOGIN_FAILED)
            .timestamp(at)
            .put(Event.USERNAME, "root")
            .build();
    }

    private static EvaluationContext context(Event event, Set<String> triggered, ReputationVerdict reputation) {
        return new EvaluationContext(event, null, event.getSourceIp(), triggered, () -> reputation);
    }

    private static EvaluationContext context(Event event) {
        return context(event, new LinkedHashSet<>(), ReputationVerdict.UNKNOWN);
    }

    @Test
    @DisplayName("Should match once failures exceed the threshold inside the window")
    void shouldMatchAboveThreshold() {
        // Given: threshold 5 per 60s keyed by source address
        RateThresholdRule rule = new RateThresholdRule(new RuleDefinition("brute-force", RuleKind.RATE_THRESHOLD, 40,
            Map.of("event_kind", "login_failed", "key", "source_ip", "threshold", 5, "window", "60s")));

        // When: six failures arrive ten seconds apart across two sessions
        boolean[] results = new boolean[6];
        for (int i = 0; i < 6; i++) {
            String session = i % 2 == 0 ? "S1" : "S2";
            results[i] = rule.matches(context(loginFailed(session, "9.9.9.9", T0.plusSeconds(i * 10L))));
        }

        // Then: only the sixth crosses the threshold
        assertThat(results).containsExactly(false, false, false, false, false, true);
        assertThat(rule.countFor("9.9.9.9")).isEqualTo(6);
    }

    @Test
    @DisplayName("Should drop entries that fall out of the window")
    void shouldResetAfterWindow() {
        RateThresholdRule rule = new RateThresholdRule(new RuleDefinition("brute-force", RuleKind.RATE_THRESHOLD, 40,
            Map.of("threshold", 2, "window", 30, "key", "session")));

        rule.matches(context(loginFailed("S1", "9.9.9.9", T0)));
        rule.matches(context(loginFailed("S1", "9.9.9.9", T0.plusSeconds(5))));
        boolean late = rule.matches(context(loginFailed("S1", "9.9.9.9", T0.plusSeconds(120))));

        assertThat(late).isFalse();
        assertThat(rule.countFor("S1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore events of other kinds")
    void shouldIgnoreOtherKinds() {
        RateThresholdRule rule = new RateThresholdRule(new RuleDefinition("brute-force", RuleKind.RATE_THRESHOLD, 40,
            Map.of("threshold", 0)));
        Event command = Event.builder().sessionId("S1").sourceIp("9.9.9.9").kind(EventKind.COMMAND)
            .timestamp(T0).put(Event.COMMAND, "id").build();

        assertThat(rule.matches(context(command))).isFalse();
        assertThat(rule.countFor("9.9.9.9")).isZero();
    }

    @Test
    @DisplayName("Should combine triggered rule ids with AND and OR")
    void shouldEvaluateComposites() {
        CompositeRule all = new CompositeRule(new RuleDefinition("mirai", RuleKind.COMPOSITE, 40,
            Map.of("operator", "and", "rules", List.of("uses-busybox", "uses-wget"))));
        CompositeRule any = new CompositeRule(new RuleDefinition("any-download", RuleKind.COMPOSITE, 10,
            Map.of("operator", "OR", "rules", List.of("uses-wget", "uses-curl"))));
        Event event = loginFailed("S1", "9.9.9.9", T0);

        Set<String> partial = new LinkedHashSet<>(List.of("uses-wget"));
        Set<String> full = new LinkedHashSet<>(List.of("uses-wget", "uses-busybox"));

        assertThat(all.matches(context(event, partial, ReputationVerdict.UNKNOWN))).isFalse();
        assertThat(all.matches(context(event, full, ReputationVerdict.UNKNOWN))).isTrue();
        assertThat(any.matches(context(event, partial, ReputationVerdict.UNKNOWN))).isTrue();
        assertThat(all.getSubRules()).containsExactly("uses-busybox", "uses-wget");
    }

    @Test
    @DisplayName("Should match blacklisted and feed-listed addresses but never whitelisted ones")
    void shouldEvaluateIpMembership() {
        // Given
        IpMembershipRule lists = new IpMembershipRule(new RuleDefinition("ip-lists", RuleKind.IP_MEMBERSHIP, 50,
            Map.of("blacklist", List.of("45.9.148.0/24"), "whitelist", List.of("45.9.148.7", "10.0.0.0/8"))));
        IpMembershipRule feeds = new IpMembershipRule(new RuleDefinition("threat-intel", RuleKind.IP_MEMBERSHIP, 40,
            Map.of("reputation", true, "min_confidence", 60)));
        ReputationVerdict listed = new ReputationVerdict("185.156.73.54", ReputationVerdict.Status.LISTED, 80,
            List.of("abuse"), List.of("scanner"));
        ReputationVerdict weak = new ReputationVerdict("185.156.73.54", ReputationVerdict.Status.LISTED, 30,
            List.of("abuse"), List.of());

        // When / Then
        assertThat(lists.matches(context(loginFailed("S1", "45.9.148.20", T0)))).isTrue();
        assertThat(lists.matches(context(loginFailed("S1", "45.9.148.7", T0)))).isFalse();
        assertThat(lists.isWhitelisted("10.1.2.3")).isTrue();
        Event fromFeed = loginFailed("S2", "185.156.73.54", T0);
        assertThat(feeds.matches(context(fromFeed, new LinkedHashSet<>(), listed))).isTrue();
        assertThat(feeds.matches(context(fromFeed, new LinkedHashSet<>(), weak))).isFalse();
        assertThat(feeds.matches(context(fromFeed, new LinkedHashSet<>(), ReputationVerdict.UNKNOWN))).isFalse();
    }
}
