package net.tilefetch.config;

import jakarta.annotation.PostConstruct;
import net.tilefetch.model.RetryBudget;
import net.tilefetch.service.projection.WebMercatorTileProjection;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed configuration for the web tile source.
 */
@Component
@ConfigurationProperties(prefix = "tiles.source")
public class TileSourceProperties {

    /**
     * URL templates with {z}/{x}/{y} (and optionally {s}) placeholders. One entry gives a
     * single-layer source; several give a composite source, base layer first.
     */
    private List<String> urlTemplates = new ArrayList<>(List.of("https://tile.openstreetmap.org/{z}/{x}/{y}.png"));

    /**
     * Values substituted for {s}.
     */
    private List<String> subdomains = new ArrayList<>();

    /**
     * Unique key of this source in the tile cache. Derived from the templates when blank.
     */
    private String cacheKey;

    /**
     * Attempts per source location.
     */
    private int retryCount = RetryBudget.DEFAULT_RETRY_COUNT;

    /**
     * Total budget per tile; each attempt gets requestTimeoutSeconds / retryCount.
     */
    private double requestTimeoutSeconds = RetryBudget.DEFAULT_TIMEOUT_SECONDS;

    private boolean cacheable = true;

    /**
     * Hidden sources neither serve nor cache tiles.
     */
    private boolean hidden = false;

    private int minZoom = 0;

    private int maxZoom = 18;

    private String userAgent = "tilefetch/0.1 (+https://github.com/tilefetch/tilefetch)";

    /**
     * Zoom level to resource location (classpath:, file:) of the image used when the server answers 204.
     */
    private Map<Integer, String> defaultImages = new LinkedHashMap<>();

    private final Cache cache = new Cache();

    @PostConstruct
    void validate() {
        Assert.notEmpty(urlTemplates, "tiles.source.url-templates must contain at least one template");
        Assert.isTrue(retryCount >= 1, "tiles.source.retry-count must be at least 1");
        Assert.isTrue(requestTimeoutSeconds > 0, "tiles.source.request-timeout-seconds must be positive");
        Assert.isTrue(minZoom >= 0 && minZoom <= maxZoom && maxZoom <= WebMercatorTileProjection.MAX_SUPPORTED_ZOOM,
            "tiles.source.min-zoom/max-zoom must satisfy 0 <= min-zoom <= max-zoom <= "
                + WebMercatorTileProjection.MAX_SUPPORTED_ZOOM);
        Assert.isTrue(cache.maxSize > 0, "tiles.source.cache.max-size must be positive");
        Assert.isTrue(!cache.ttl.isNegative() && !cache.ttl.isZero(), "tiles.source.cache.ttl must be positive");
        defaultImages.keySet().forEach(zoom ->
            Assert.isTrue(zoom != null && zoom >= 0, "tiles.source.default-images keys must be non-negative zoom levels"));
    }

    public RetryBudget toRetryBudget() {
        return new RetryBudget(retryCount, requestTimeoutSeconds);
    }

    public List<String> getUrlTemplates() {
        return urlTemplates;
    }

    public void setUrlTemplates(List<String> urlTemplates) {
        this.urlTemplates = urlTemplates;
    }

    public List<String> getSubdomains() {
        return subdomains;
    }

    public void setSubdomains(List<String> subdomains) {
        this.subdomains = subdomains;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public double getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(double requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public boolean isCacheable() {
        return cacheable;
    }

    public void setCacheable(boolean cacheable) {
        this.cacheable = cacheable;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public int getMinZoom() {
        return minZoom;
    }

    public void setMinZoom(int minZoom) {
        this.minZoom = minZoom;
    }

    public int getMaxZoom() {
        return maxZoom;
    }

    public void setMaxZoom(int maxZoom) {
        this.maxZoom = maxZoom;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Map<Integer, String> getDefaultImages() {
        return defaultImages;
    }

    public void setDefaultImages(Map<Integer, String> defaultImages) {
        this.defaultImages = defaultImages;
    }

    public Cache getCache() {
        return cache;
    }

    public static class Cache {

        private long maxSize = 2000;

        private Duration ttl = Duration.ofHours(1);

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
