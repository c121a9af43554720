package com.hivewatch.correlation;

import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.correlation.rules.CompiledRule;
import com.hivewatch.correlation.rules.CompositeRule;
import com.hivewatch.correlation.rules.RuleCompiler;
import com.hivewatch.domain.RuleDefinition;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the active {@link RuleSnapshot} and replaces it atomically on reload.
 *
 * Rules are assembled from three layers, later layers overriding earlier ones by id:
 * built-in rules from the alert settings, the classpath rule pack, and the YAML files in the
 * rules directory. A file that fails to parse is skipped with a warning; a rule that fails to
 * compile is dropped on its own. Composite rules referring to missing rules are dropped too.
 */
@Component
public class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    public static final String DEFAULT_RULES = "rules/default-rules.yml";

    private final HiveWatchProperties properties;
    private final RuleCompiler compiler;
    private final Clock clock;

    private final AtomicReference<RuleSnapshot> current = new AtomicReference<>(RuleSnapshot.empty());
    private final AtomicLong versions = new AtomicLong();
    private volatile String directoryFingerprint = "";

    @Autowired
    public RuleRegistry(HiveWatchProperties properties, RuleCompiler compiler, Clock clock) {
        this.properties = properties;
        this.compiler = compiler;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        reload();
    }

    /**
     * The snapshot every new evaluation should use.
     */
    public RuleSnapshot current() {
        return current.get();
    }

    /**
     * Builds a fresh snapshot and swaps it in. Evaluations already holding the previous
     * snapshot finish against it.
     */
    public synchronized RuleSnapshot reload() {
        Map<String, RuleDefinition> definitions = new LinkedHashMap<>();
        BuiltinRules.from(properties).forEach(rule -> definitions.put(rule.getId(), rule));

        if (properties.getRules().isLoadDefaultRules()) {
            mergeAll(definitions, loadClasspathRules(), DEFAULT_RULES);
        }

        Path rulesDir = rulesDirectory();
        if (rulesDir != null) {
            for (Path file : ruleFiles(rulesDir)) {
                try {
                    String yaml = Files.readString(file, StandardCharsets.UTF_8);
                    mergeAll(definitions, compiler.parseYaml(file.toString(), yaml), file.toString());
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Skipping rule file {}: {}", file, e.getMessage());
                }
            }
            directoryFingerprint = fingerprint(rulesDir);
        }

        RuleSnapshot snapshot = new RuleSnapshot(versions.incrementAndGet(), clock.instant(), compileAll(definitions));
        current.set(snapshot);
        log.info("Loaded rule snapshot v{} with {} rules", snapshot.getVersion(), snapshot.size());
        return snapshot;
    }

    /**
     * Reloads when auto-reload is on and the rules directory changed since the last load.
     */
    @Scheduled(fixedDelayString = "${hivewatch.rules.reload-interval:PT10S}",
        initialDelayString = "${hivewatch.rules.reload-interval:PT10S}")
    public void checkForChanges() {
        if (!properties.getRules().isAutoReload()) {
            return;
        }
        Path rulesDir = rulesDirectory();
        if (rulesDir == null) {
            return;
        }
        try {
            if (!fingerprint(rulesDir).equals(directoryFingerprint)) {
                log.info("Rules directory {} changed; reloading", rulesDir);
                reload();
            }
        } catch (RuntimeException e) {
            log.error("Rule reload failed; keeping snapshot v{}", current().getVersion(), e);
        }
    }

    private List<CompiledRule> compileAll(Map<String, RuleDefinition> definitions) {
        boolean correlation = properties.getRules().isEnableCorrelation();
        List<CompiledRule> compiled = new ArrayList<>();
        for (RuleDefinition definition : definitions.values()) {
            if (!definition.isEnabled()) {
                continue;
            }
            if (!correlation && definition.getKind() != null && definition.getKind().isStateful()) {
                log.debug("Correlation disabled; skipping stateful rule {}", definition.getId());
                continue;
            }
            try {
                compiled.add(compiler.compile(definition));
            } catch (RuntimeException e) {
                log.warn("Dropping rule {}: {}", definition.getId(), e.getMessage());
            }
        }

        // Drop composites whose constituents are missing, repeating until stable
        boolean changed = true;
        while (changed) {
            changed = false;
            List<String> ids = compiled.stream().map(CompiledRule::getId).collect(Collectors.toList());
            for (CompiledRule rule : new ArrayList<>(compiled)) {
                if (rule instanceof CompositeRule && !ids.containsAll(((CompositeRule) rule).getSubRules())) {
                    log.warn("Dropping composite rule {}: refers to rules not loaded", rule.getId());
                    compiled.remove(rule);
                    changed = true;
                }
            }
        }
        return compiled;
    }

    private void mergeAll(Map<String, RuleDefinition> target, List<RuleDefinition> rules, String origin) {
        for (RuleDefinition rule : rules) {
            if (rule.getId() == null) {
                log.warn("Ignoring rule without id in {}", origin);
                continue;
            }
            if (target.put(rule.getId(), rule) != null) {
                log.debug("Rule {} from {} overrides an earlier definition", rule.getId(), origin);
            }
        }
    }

    private List<RuleDefinition> loadClasspathRules() {
        ClassPathResource resource = new ClassPathResource(DEFAULT_RULES);
        if (!resource.exists()) {
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return compiler.parseYaml(DEFAULT_RULES, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Cannot load default rule pack: {}", e.getMessage());
            return List.of();
        }
    }

    private Path rulesDirectory() {
        String dir = properties.getRules().getRulesDir();
        if (dir == null || dir.isBlank()) {
            return null;
        }
        return Path.of(dir);
    }

    private static List<Path> ruleFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.toString().endsWith(".yml") || p.toString().endsWith(".yaml"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list rules directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static String fingerprint(Path dir) {
        StringBuilder sb = new StringBuilder();
        for (Path file : ruleFiles(dir)) {
            try {
                sb.append(file.getFileName()).append(':')
                    .append(Files.getLastModifiedTime(file).toMillis()).append(':')
                    .append(Files.size(file)).append(';');
            } catch (IOException e) {
                sb.append(file.getFileName()).append(":?;");
            }
        }
        return sb.toString();
    }
}
