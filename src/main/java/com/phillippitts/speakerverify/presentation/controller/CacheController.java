package com.phillippitts.speakerverify.presentation.controller;

import com.phillippitts.speakerverify.presentation.dto.CacheClearResponse;
import com.phillippitts.speakerverify.service.cache.ContentCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Maintenance of the remote-audio cache. Entries in use by running requests are kept.
 */
@RestController
class CacheController {

    private final ContentCache cache;

    CacheController(ContentCache cache) {
        this.cache = cache;
    }

    @DeleteMapping("/cache")
    ResponseEntity<CacheClearResponse> clear() {
        return ResponseEntity.ok(new CacheClearResponse(true, cache.clear()));
    }
}
