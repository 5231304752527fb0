package org.iceforge.tilecut.api;

import org.iceforge.tilecut.cache.ArtifactCacheFactory;
import org.iceforge.tilecut.cache.ArtifactStoreException;
import org.iceforge.tilecut.cache.ArtifactTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class CacheStatsController {
    private static final Logger log = LoggerFactory.getLogger(CacheStatsController.class);

    private final ArtifactCacheFactory cacheFactory;

    public CacheStatsController(ArtifactCacheFactory cacheFactory) {
        this.cacheFactory = Objects.requireNonNull(cacheFactory);
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> stats() {
        ArtifactTier permanent = cacheFactory.permanentTier();
        long objects = 0L;
        long bytesUsed = 0L;
        boolean error = false;
        try {
            ArtifactTier.Usage usage = permanent.usage();
            objects = usage.objectCount();
            bytesUsed = usage.bytesUsed();
        } catch (ArtifactStoreException e) {
            log.warn("Cache stats unavailable: {}", e.getMessage());
            error = true;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tier", permanent.name());
        out.put("objectCount", objects);
        out.put("bytesUsed", bytesUsed);
        out.put("error", error);
        return out;
    }
}
