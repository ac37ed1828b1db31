package com.phillippitts.coordination.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the event log, pattern store and insight generation.
 */
@ConfigurationProperties(prefix = "coordination.learning")
@Validated
public class LearningProperties {

    public enum StoreType { FILE, MEMORY }

    /** Backing store for events, patterns and insights. */
    @NotNull
    private StoreType store = StoreType.FILE;

    /** Directory holding events.json, patterns.json and insights.json. */
    @NotBlank(message = "Data directory must not be blank")
    private String dataDir = ".coordination/data";

    /** Time-to-live of cached analytics. Every new event invalidates the cache regardless. */
    @NotNull
    private Duration analyticsCacheTtl = Duration.ofMinutes(5);

    /** Insights older than this are pruned on each generation pass. */
    @NotNull
    private Duration insightTtl = Duration.ofHours(24);

    /** Window used for "recent" analytics and the degradation insight. */
    @NotNull
    private Duration recentWindow = Duration.ofHours(1);

    /** Keep only the newest N events; 0 keeps everything. */
    @Min(0)
    private int maxEvents = 0;

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public Duration getAnalyticsCacheTtl() {
        return analyticsCacheTtl;
    }

    public void setAnalyticsCacheTtl(Duration analyticsCacheTtl) {
        this.analyticsCacheTtl = analyticsCacheTtl;
    }

    public Duration getInsightTtl() {
        return insightTtl;
    }

    public void setInsightTtl(Duration insightTtl) {
        this.insightTtl = insightTtl;
    }

    public Duration getRecentWindow() {
        return recentWindow;
    }

    public void setRecentWindow(Duration recentWindow) {
        this.recentWindow = recentWindow;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }
}
