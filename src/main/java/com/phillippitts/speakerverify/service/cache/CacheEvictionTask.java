package com.phillippitts.speakerverify.service.cache;

import com.phillippitts.speakerverify.config.properties.CacheProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic TTL eviction of the content cache. Disabled while {@code audio.cache.ttl-minutes} is 0.
 */
@Component
public class CacheEvictionTask {

    private static final Logger LOG = LogManager.getLogger(CacheEvictionTask.class);

    private final ContentCache cache;
    private final CacheProperties props;

    public CacheEvictionTask(ContentCache cache, CacheProperties props) {
        this.cache = cache;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${audio.cache.eviction-interval-ms:300000}",
            initialDelayString = "${audio.cache.eviction-interval-ms:300000}")
    public void evictExpired() {
        if (props.getTtlMinutes() <= 0) {
            return;
        }
        int removed = cache.evictOlderThan(Duration.ofMinutes(props.getTtlMinutes()));
        if (removed > 0) {
            LOG.info("Evicted {} cache entries older than {} min", removed, props.getTtlMinutes());
        }
    }
}
