package com.example.slidecast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Storage backend and retention settings for pipeline state, tasks and cancellation markers.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    public enum Store { REDIS, MEMORY }

    private Store store = Store.REDIS;
    private String keyPrefix = "ss";
    private Duration stateTtl = Duration.ofHours(24);
    private Duration cancellationMarkerTtl = Duration.ofMinutes(5);
    private boolean deleteIntermediatesOnSuccess = true;
    private boolean auditEnabled = true;

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public String getKeyPrefix() { return keyPrefix; }
    public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

    public Duration getStateTtl() { return stateTtl; }
    public void setStateTtl(Duration stateTtl) { this.stateTtl = stateTtl; }

    public Duration getCancellationMarkerTtl() { return cancellationMarkerTtl; }
    public void setCancellationMarkerTtl(Duration cancellationMarkerTtl) { this.cancellationMarkerTtl = cancellationMarkerTtl; }

    public boolean isDeleteIntermediatesOnSuccess() { return deleteIntermediatesOnSuccess; }
    public void setDeleteIntermediatesOnSuccess(boolean deleteIntermediatesOnSuccess) { this.deleteIntermediatesOnSuccess = deleteIntermediatesOnSuccess; }

    public boolean isAuditEnabled() { return auditEnabled; }
    public void setAuditEnabled(boolean auditEnabled) { this.auditEnabled = auditEnabled; }

    /**
     * Prepends the configured namespace, e.g. {@code ss:state:abc}. An empty prefix leaves keys untouched.
     */
    public String key(String suffix) {
        return (keyPrefix == null || keyPrefix.isBlank()) ? suffix : keyPrefix + ":" + suffix;
    }
}
