package com.hivewatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for HiveWatch.
 *
 * HiveWatch tails the logs written by a deception honeypot, rebuilds attacker
 * sessions from them, scores each session against detection rules and threat
 * intelligence, and streams risk-scored alerts to the operator while the
 * attack is still in progress.
 *
 * Key Features:
 * - Rotation-safe tailing of JSON, text, TTY capture and download sources
 * - Per-session serialized state with cross-session parallelism
 * - Hot-reloadable rule snapshots (command, IP, rate, composite, event)
 * - Non-blocking geolocation and reputation enrichment
 * - Alert fan-out to independent consumers with per-consumer drop accounting
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class HiveWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiveWatchApplication.class, args);
    }
}
