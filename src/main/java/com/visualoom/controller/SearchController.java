package com.visualoom.controller;

import com.visualoom.config.AppConfig;
import com.visualoom.dto.ImageResultItem;
import com.visualoom.model.ImageRecord;
import com.visualoom.service.SearchService;
import com.visualoom.service.TagService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for hybrid search.
 *
 * Endpoints:
 * GET /api/search?query=...&topK=... - people/topic/keyword search
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    private final SearchService searchService;
    private final TagService tagService;
    private final AppConfig appConfig;

    public SearchController(SearchService searchService,
            TagService tagService,
            AppConfig appConfig) {
        this.searchService = searchService;
        this.tagService = tagService;
        this.appConfig = appConfig;
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam String query,
            @RequestParam(required = false) Integer topK) {
        int requested = topK != null && topK > 0 ? topK : appConfig.getDefaultTopK();
        int effectiveTopK = Math.min(requested, appConfig.getSearchLimit());

        List<ImageRecord> records = searchService.search(query.trim(), effectiveTopK);
        Map<String, String> tagNames = tagService.tagNamesById();
        List<ImageResultItem> results = records.stream()
                .map(r -> ImageResultItem.from(r, tagNames))
                .toList();
        return ResponseEntity.ok(Map.of(
                "query", query,
                "results", results,
                "count", results.size()));
    }
}
