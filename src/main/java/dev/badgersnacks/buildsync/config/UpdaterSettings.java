package dev.badgersnacks.buildsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Set;

/**
 * Tunables for a sync run. Any field left out of the settings file falls back to its default.
 *
 * <p>{@code noDataStatuses} lists HTTP statuses that mean "no build published" rather than a
 * failed request. It is empty by default, so every non-2xx status is reported as an error. The
 * build site answers 500 when it has too few logs for a page; adding 500 here makes such pages
 * count as not available, which also lets dungeon lookups fall back to the previous week.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdaterSettings(
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("maxConcurrentRequests") Integer maxConcurrentRequests,
        @JsonProperty("requestsPerSecond") Double requestsPerSecond,
        @JsonProperty("requestTimeoutSeconds") Long requestTimeoutSeconds,
        @JsonProperty("userAgent") String userAgent,
        @JsonProperty("tableName") String tableName,
        @JsonProperty("managedMarker") String managedMarker,
        @JsonProperty("backupBeforeWrite") Boolean backupBeforeWrite,
        @JsonProperty("noDataStatuses") Set<Integer> noDataStatuses
) {

    public static final String DEFAULT_BASE_URL = "https://www.archon.gg/wow/builds";
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 5;
    public static final double DEFAULT_REQUESTS_PER_SECOND = 2.0d;
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 180L;
    public static final String DEFAULT_USER_AGENT = "TalentBuildSync/1.0";
    public static final String DEFAULT_TABLE_NAME = "ArchonTalentBuilds";
    public static final String DEFAULT_MANAGED_MARKER = " [Archon]";

    public UpdaterSettings {
        baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        maxConcurrentRequests = maxConcurrentRequests == null || maxConcurrentRequests < 1
                ? DEFAULT_MAX_CONCURRENT_REQUESTS
                : maxConcurrentRequests;
        requestsPerSecond = requestsPerSecond == null || requestsPerSecond <= 0
                ? DEFAULT_REQUESTS_PER_SECOND
                : requestsPerSecond;
        requestTimeoutSeconds = requestTimeoutSeconds == null || requestTimeoutSeconds < 1
                ? DEFAULT_REQUEST_TIMEOUT_SECONDS
                : requestTimeoutSeconds;
        userAgent = isBlank(userAgent) ? DEFAULT_USER_AGENT : userAgent.trim();
        tableName = isBlank(tableName) ? DEFAULT_TABLE_NAME : tableName.trim();
        managedMarker = isBlank(managedMarker) ? DEFAULT_MANAGED_MARKER : managedMarker;
        backupBeforeWrite = backupBeforeWrite == null || backupBeforeWrite;
        noDataStatuses = noDataStatuses == null ? Set.of() : Set.copyOf(noDataStatuses);
    }

    public static UpdaterSettings defaults() {
        return new UpdaterSettings(null, null, null, null, null, null, null, null, null);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public UpdaterSettings withBaseUrl(String url) {
        return new UpdaterSettings(url, maxConcurrentRequests, requestsPerSecond, requestTimeoutSeconds,
                userAgent, tableName, managedMarker, backupBeforeWrite, noDataStatuses);
    }

    public UpdaterSettings withRequestTimeout(Duration timeout) {
        return new UpdaterSettings(baseUrl, maxConcurrentRequests, requestsPerSecond,
                Math.max(1L, timeout.toSeconds()), userAgent, tableName, managedMarker,
                backupBeforeWrite, noDataStatuses);
    }

    public UpdaterSettings withNoDataStatuses(Set<Integer> statuses) {
        return new UpdaterSettings(baseUrl, maxConcurrentRequests, requestsPerSecond, requestTimeoutSeconds,
                userAgent, tableName, managedMarker, backupBeforeWrite, statuses);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
