package com.hivewatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loaded configuration for the ingestion and correlation engine, bound from
 * {@code hivewatch.*}. Validation of the file itself happens upstream; this class
 * only carries values and defaults.
 */
@ConfigurationProperties(prefix = "hivewatch")
public class HiveWatchProperties {

    private Sources sources = new Sources();
    private Alerts alerts = new Alerts();
    private Rules rules = new Rules();
    private Session session = new Session();
    private ThreatIntel threatIntel = new ThreatIntel();
    private GeoIp geoip = new GeoIp();
    private Enrichment enrichment = new Enrichment();
    private Siem siem = new Siem();

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Rules getRules() {
        return rules;
    }

    public void setRules(Rules rules) {
        this.rules = rules;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public ThreatIntel getThreatIntel() {
        return threatIntel;
    }

    public void setThreatIntel(ThreatIntel threatIntel) {
        this.threatIntel = threatIntel;
    }

    public GeoIp getGeoip() {
        return geoip;
    }

    public void setGeoip(GeoIp geoip) {
        this.geoip = geoip;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Siem getSiem() {
        return siem;
    }

    public void setSiem(Siem siem) {
        this.siem = siem;
    }

    /**
     * Log sources to tail.
     */
    public static class Sources {
        private List<String> logPaths = new ArrayList<>();
        private String ttyLogPath;
        private String downloadPath;
        private Duration pollInterval = Duration.ofMillis(500);
        private int historyHours = 0;
        private int dedupWindowSize = 4096;
        private Duration backoffInitial = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
        private int feedCapacity = 10_000;

        public List<String> getLogPaths() {
            return logPaths;
        }

        public void setLogPaths(List<String> logPaths) {
            this.logPaths = logPaths;
        }

        public String getTtyLogPath() {
            return ttyLogPath;
        }

        public void setTtyLogPath(String ttyLogPath) {
            this.ttyLogPath = ttyLogPath;
        }

        public String getDownloadPath() {
            return downloadPath;
        }

        public void setDownloadPath(String downloadPath) {
            this.downloadPath = downloadPath;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getHistoryHours() {
            return historyHours;
        }

        public void setHistoryHours(int historyHours) {
            this.historyHours = historyHours;
        }

        public int getDedupWindowSize() {
            return dedupWindowSize;
        }

        public void setDedupWindowSize(int dedupWindowSize) {
            this.dedupWindowSize = dedupWindowSize;
        }

        public Duration getBackoffInitial() {
            return backoffInitial;
        }

        public void setBackoffInitial(Duration backoffInitial) {
            this.backoffInitial = backoffInitial;
        }

        public Duration getBackoffMax() {
            return backoffMax;
        }

        public void setBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
        }

        public int getFeedCapacity() {
            return feedCapacity;
        }

        public void setFeedCapacity(int feedCapacity) {
            this.feedCapacity = feedCapacity;
        }
    }

    /**
     * Built-in alert triggers and fan-out sizing.
     */
    public static class Alerts {
        private List<String> onCommands = new ArrayList<>();
        private int commandWeight = 30;
        private boolean onSuccessfulLogin = true;
        private int loginWeight = 10;
        private boolean onFileUpload = true;
        private int fileUploadWeight = 30;
        private List<String> ipBlacklist = new ArrayList<>();
        private List<String> ipWhitelist = new ArrayList<>();
        private int blacklistWeight = 50;
        private int queueCapacity = 1024;

        public List<String> getOnCommands() {
            return onCommands;
        }

        public void setOnCommands(List<String> onCommands) {
            this.onCommands = onCommands;
        }

        public int getCommandWeight() {
            return commandWeight;
        }

        public void setCommandWeight(int commandWeight) {
            this.commandWeight = commandWeight;
        }

        public boolean isOnSuccessfulLogin() {
            return onSuccessfulLogin;
        }

        public void setOnSuccessfulLogin(boolean onSuccessfulLogin) {
            this.onSuccessfulLogin = onSuccessfulLogin;
        }

        public int getLoginWeight() {
            return loginWeight;
        }

        public void setLoginWeight(int loginWeight) {
            this.loginWeight = loginWeight;
        }

        public boolean isOnFileUpload() {
            return onFileUpload;
        }

        public void setOnFileUpload(boolean onFileUpload) {
            this.onFileUpload = onFileUpload;
        }

        public int getFileUploadWeight() {
            return fileUploadWeight;
        }

        public void setFileUploadWeight(int fileUploadWeight) {
            this.fileUploadWeight = fileUploadWeight;
        }

        public List<String> getIpBlacklist() {
            return ipBlacklist;
        }

        public void setIpBlacklist(List<String> ipBlacklist) {
            this.ipBlacklist = ipBlacklist;
        }

        public List<String> getIpWhitelist() {
            return ipWhitelist;
        }

        public void setIpWhitelist(List<String> ipWhitelist) {
            this.ipWhitelist = ipWhitelist;
        }

        public int getBlacklistWeight() {
            return blacklistWeight;
        }

        public void setBlacklistWeight(int blacklistWeight) {
            this.blacklistWeight = blacklistWeight;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Rule loading and scoring.
     */
    public static class Rules {
        private int minRiskScore = 50;
        private boolean enableCorrelation = true;
        private boolean autoReload = true;
        private String rulesDir;
        private boolean loadDefaultRules = true;
        private Duration reloadInterval = Duration.ofSeconds(10);
        private int evaluationWorkers = 4;
        private SeverityBandProperties severityBands = new SeverityBandProperties();

        public int getMinRiskScore() {
            return minRiskScore;
        }

        public void setMinRiskScore(int minRiskScore) {
            if (minRiskScore < 0 || minRiskScore > 100) {
                throw new IllegalArgumentException("min-risk-score must be within 0..100, got " + minRiskScore);
            }
            this.minRiskScore = minRiskScore;
        }

        public boolean isEnableCorrelation() {
            return enableCorrelation;
        }

        public void setEnableCorrelation(boolean enableCorrelation) {
            this.enableCorrelation = enableCorrelation;
        }

        public boolean isAutoReload() {
            return autoReload;
        }

        public void setAutoReload(boolean autoReload) {
            this.autoReload = autoReload;
        }

        public String getRulesDir() {
            return rulesDir;
        }

        public void setRulesDir(String rulesDir) {
            this.rulesDir = rulesDir;
        }

        public boolean isLoadDefaultRules() {
            return loadDefaultRules;
        }

        public void setLoadDefaultRules(boolean loadDefaultRules) {
            this.loadDefaultRules = loadDefaultRules;
        }

        public Duration getReloadInterval() {
            return reloadInterval;
        }

        public void setReloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval;
        }

        public int getEvaluationWorkers() {
            return evaluationWorkers;
        }

        public void setEvaluationWorkers(int evaluationWorkers) {
            this.evaluationWorkers = evaluationWorkers;
        }

        public SeverityBandProperties getSeverityBands() {
            return severityBands;
        }

        public void setSeverityBands(SeverityBandProperties severityBands) {
            this.severityBands = severityBands;
        }
    }

    /**
     * Lower bounds of each severity band; scores below {@code medium} are LOW.
     */
    public static class SeverityBandProperties {
        private int medium = 40;
        private int high = 70;
        private int critical = 90;

        public int getMedium() {
            return medium;
        }

        public void setMedium(int medium) {
            this.medium = medium;
        }

        public int getHigh() {
            return high;
        }

        public void setHigh(int high) {
            this.high = high;
        }

        public int getCritical() {
            return critical;
        }

        public void setCritical(int critical) {
            this.critical = critical;
        }
    }

    /**
     * Session lifecycle timing.
     */
    public static class Session {
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration idleThreshold = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(60);
        private int logRetentionDays = 0;
        private boolean closeSummaryAlerts = true;

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getIdleThreshold() {
            return idleThreshold;
        }

        public void setIdleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getLogRetentionDays() {
            return logRetentionDays;
        }

        public void setLogRetentionDays(int logRetentionDays) {
            this.logRetentionDays = logRetentionDays;
        }

        public boolean isCloseSummaryAlerts() {
            return closeSummaryAlerts;
        }

        public void setCloseSummaryAlerts(boolean closeSummaryAlerts) {
            this.closeSummaryAlerts = closeSummaryAlerts;
        }
    }

    /**
     * Threat-intelligence feeds.
     */
    public static class ThreatIntel {
        private List<String> feeds = new ArrayList<>();
        private Duration refreshInterval = Duration.ofHours(24);
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private int threatWeight = 40;
        private int defaultConfidence = 75;

        public List<String> getFeeds() {
            return feeds;
        }

        public void setFeeds(List<String> feeds) {
            this.feeds = feeds;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public int getThreatWeight() {
            return threatWeight;
        }

        public void setThreatWeight(int threatWeight) {
            this.threatWeight = threatWeight;
        }

        public int getDefaultConfidence() {
            return defaultConfidence;
        }

        public void setDefaultConfidence(int defaultConfidence) {
            this.defaultConfidence = defaultConfidence;
        }
    }

    /**
     * Local GeoIP database.
     */
    public static class GeoIp {
        private String databasePath;

        public String getDatabasePath() {
            return databasePath;
        }

        public void setDatabasePath(String databasePath) {
            this.databasePath = databasePath;
        }
    }

    /**
     * Lookup timeout and cache sizing.
     */
    public static class Enrichment {
        private Duration lookupTimeout = Duration.ofMillis(250);
        private long cacheSize = 10_000;
        private Duration cacheTtl = Duration.ofHours(6);

        public Duration getLookupTimeout() {
            return lookupTimeout;
        }

        public void setLookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = lookupTimeout;
        }

        public long getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(long cacheSize) {
            this.cacheSize = cacheSize;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    /**
     * SIEM forwarder consumer.
     */
    public static class Siem {
        private boolean enabled = false;
        private String url;
        private String authToken;
        private int batchSize = 100;
        private Duration sendInterval = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getSendInterval() {
            return sendInterval;
        }

        public void setSendInterval(Duration sendInterval) {
            this.sendInterval = sendInterval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
