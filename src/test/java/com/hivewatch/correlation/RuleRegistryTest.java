package com.hivewatch.correlation;

import com.hivewatch.MutableClock;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.correlation.rules.RuleCompiler;
import com.hivewatch.domain.RuleKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleRegistry Tests")
class RuleRegistryTest {

    private static final String BRUTE_FORCE = "rules:\n"
        + "  - id: brute-force\n"
        + "    kind: rate-threshold\n"
        + "    risk_weight: 40\n"
        + "    parameters: {event_kind: login_failed, threshold: 5, window: 60s}\n"
        + "  - id: recon\n"
        + "    kind: command-pattern\n"
        + "    risk_weight: 10\n"
        + "    parameters: {patterns: [uname, 'cat /proc/cpuinfo']}\n"
        + "  - id: noisy-recon\n"
        + "    kind: composite\n"
        + "    risk_weight: 20\n"
        + "    parameters: {operator: AND, rules: [brute-force, recon]}\n";

    @TempDir
    Path rulesDir;

    private HiveWatchProperties properties;
    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new HiveWatchProperties();
        properties.getAlerts().setOnCommands(List.of("wget"));
        properties.getRules().setRulesDir(rulesDir.toString());
        properties.getRules().setLoadDefaultRules(false);
        registry = new RuleRegistry(properties, new RuleCompiler(), new MutableClock(Instant.EPOCH));
    }

    @Test
    @DisplayName("Should merge built-in rules with rule files and bump the version on reload")
    void shouldLoadBuiltinsAndFiles() throws IOException {
        // Given
        Files.writeString(rulesDir.resolve("10-auth.yml"), BRUTE_FORCE);

        // When
        RuleSnapshot first = registry.reload();
        RuleSnapshot second = registry.reload();

        // Then
        assertThat(first.contains(BuiltinRules.COMMAND_PREFIX + "wget")).isTrue();
        assertThat(first.contains(BuiltinRules.SUCCESSFUL_LOGIN)).isTrue();
        assertThat(first.contains("brute-force")).isTrue();
        assertThat(first.getCompositeRules()).extracting(r -> r.getId()).containsExactly("noisy-recon");
        assertThat(second.getVersion()).isEqualTo(first.getVersion() + 1);
        assertThat(registry.current()).isSameAs(second);
    }

    @Test
    @DisplayName("Should let later files override earlier definitions and skip broken files")
    void shouldOverrideAndSkipBrokenFiles() throws IOException {
        // Given
        Files.writeString(rulesDir.resolve("10-auth.yml"), BRUTE_FORCE);
        Files.writeString(rulesDir.resolve("20-tuning.yaml"),
            "- id: recon\n  kind: command-pattern\n  risk_weight: 25\n  parameters: {patterns: [uname]}\n"
                + "- id: bad-regex\n  kind: command-pattern\n  risk_weight: 5\n  parameters: {regex: '('}\n"
                + "- id: no-kind\n  risk_weight: 5\n");
        Files.writeString(rulesDir.resolve("30-broken.yml"), "this: [is: not, valid");
        Files.writeString(rulesDir.resolve("notes.txt"), "ignored");

        // When
        RuleSnapshot snapshot = registry.reload();

        // Then
        assertThat(snapshot.getWeights()).containsEntry("recon", 25);
        assertThat(snapshot.contains("bad-regex")).isTrue();
        assertThat(snapshot.contains("no-kind")).isFalse();
        assertThat(snapshot.contains("brute-force")).isTrue();
    }

    @Test
    @DisplayName("Should leave out stateful rules when correlation is disabled")
    void shouldSkipStatefulRulesWithoutCorrelation() throws IOException {
        // Given
        Files.writeString(rulesDir.resolve("10-auth.yml"), BRUTE_FORCE);
        properties.getRules().setEnableCorrelation(false);

        // When
        RuleSnapshot snapshot = registry.reload();

        // Then
        assertThat(snapshot.contains("recon")).isTrue();
        assertThat(snapshot.contains("brute-force")).isFalse();
        assertThat(snapshot.contains("noisy-recon")).isFalse();
        assertThat(snapshot.getEventRules()).noneMatch(rule -> rule.getKind() == RuleKind.RATE_THRESHOLD);
    }

    @Test
    @DisplayName("Should drop composites that refer to rules that are not loaded")
    void shouldDropDanglingComposites() throws IOException {
        Files.writeString(rulesDir.resolve("10-composite.yml"),
            "- id: outer\n  kind: composite\n  parameters: {rules: [inner]}\n"
                + "- id: inner\n  kind: composite\n  parameters: {rules: [missing]}\n");

        RuleSnapshot snapshot = registry.reload();

        assertThat(snapshot.contains("inner")).isFalse();
        assertThat(snapshot.contains("outer")).isFalse();
    }

    @Test
    @DisplayName("Should reload only when the rules directory changed")
    void shouldReloadOnChange() throws IOException {
        // Given
        Path file = rulesDir.resolve("10-auth.yml");
        Files.writeString(file, BRUTE_FORCE);
        long loaded = registry.reload().getVersion();

        // When: nothing changed
        registry.checkForChanges();

        // Then
        assertThat(registry.current().getVersion()).isEqualTo(loaded);

        // When: the file is rewritten
        Files.writeString(file, BRUTE_FORCE.replace("risk_weight: 40", "risk_weight: 45"));
        Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 5_000));
        registry.checkForChanges();

        // Then
        assertThat(registry.current().getVersion()).isEqualTo(loaded + 1);
        assertThat(registry.current().getWeights()).containsEntry("brute-force", 45);
    }

    @Test
    @DisplayName("Should load the bundled default rule pack when enabled")
    void shouldLoadDefaultRulePack() {
        properties.getRules().setLoadDefaultRules(true);

        RuleSnapshot snapshot = registry.reload();

        assertThat(snapshot.contains("brute-force-login")).isTrue();
        assertThat(snapshot.contains("malware-mirai")).isTrue();
        assertThat(snapshot.contains("malware-reverse-shell")).isTrue();
    }
}
