package com.visualoom.controller;

import com.visualoom.dto.ImageResultItem;
import com.visualoom.model.Tag;
import com.visualoom.service.TagService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for tags and image-tag associations.
 *
 * Endpoints:
 * GET /api/tags - all tags
 * POST /api/tags - create a tag (idempotent by name)
 * GET /api/tags/{name}/images - images carrying a tag
 * POST /api/images/{id}/tags - attach a tag to an image
 * DELETE /api/images/{id}/tags/{name} - detach a tag from an image
 */
@RestController
@RequestMapping("/api")
public class TagController {

    private final TagService tagService;

    public TagController(TagService tagService) {
        this.tagService = tagService;
    }

    @GetMapping("/tags")
    public ResponseEntity<Map<String, Object>> listTags() {
        List<Tag> tags = tagService.getAllTags();
        return ResponseEntity.ok(Map.of("tags", tags, "count", tags.size()));
    }

    /**
     * Body: { "name": "Alice", "type": "person" }
     */
    @PostMapping("/tags")
    public ResponseEntity<Map<String, String>> createTag(@RequestBody Map<String, String> body) {
        String type = body.getOrDefault("type", Tag.TYPE_CUSTOM);
        String id = tagService.createTag(body.get("name"), type);
        return ResponseEntity.ok(Map.of("id", id));
    }

    @GetMapping("/tags/{name}/images")
    public ResponseEntity<Map<String, Object>> imagesByTag(@PathVariable String name) {
        Map<String, String> tagNames = tagService.tagNamesById();
        List<ImageResultItem> results = tagService.getImagesByTagName(name).stream()
                .map(r -> ImageResultItem.from(r, tagNames))
                .toList();
        return ResponseEntity.ok(Map.of("tag", name, "results", results, "count", results.size()));
    }

    /**
     * Body: { "name": "Alice" }
     */
    @PostMapping("/images/{id}/tags")
    public ResponseEntity<Map<String, Object>> addTag(@PathVariable String id,
            @RequestBody Map<String, String> body) {
        boolean changed = tagService.addTagToImage(id, body.get("name"));
        return ResponseEntity.ok(Map.of("id", id, "changed", changed));
    }

    @DeleteMapping("/images/{id}/tags/{name}")
    public ResponseEntity<Map<String, Object>> removeTag(@PathVariable String id, @PathVariable String name) {
        boolean changed = tagService.removeTagFromImage(id, name);
        return ResponseEntity.ok(Map.of("id", id, "changed", changed));
    }
}
