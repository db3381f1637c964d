package com.visualoom.controller;

import com.visualoom.dto.ImageResultItem;
import com.visualoom.service.ImageService;
import com.visualoom.service.TagService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * REST controller for catalogued images.
 *
 * Endpoints:
 * GET /api/images - list the catalog
 * POST /api/images - add a single image file by path
 * DELETE /api/images/{id} - remove an image from the catalog (the file stays)
 * GET /api/folders - folders that contain indexed images
 */
@RestController
@RequestMapping("/api")
public class ImageController {

    private final ImageService imageService;
    private final TagService tagService;

    public ImageController(ImageService imageService, TagService tagService) {
        this.imageService = imageService;
        this.tagService = tagService;
    }

    @GetMapping("/images")
    public ResponseEntity<Map<String, Object>> listImages() {
        Map<String, String> tagNames = tagService.tagNamesById();
        List<ImageResultItem> images = imageService.listImages().stream()
                .map(r -> ImageResultItem.from(r, tagNames))
                .toList();
        return ResponseEntity.ok(Map.of("images", images, "count", images.size()));
    }

    /**
     * Body: { "path": "/photos/a.jpg" }
     */
    @PostMapping("/images")
    public ResponseEntity<Map<String, Object>> addImage(@RequestBody Map<String, String> body) {
        String path = body.get("path");
        if (path == null || path.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "path is required"));
        }
        return imageService.addImage(Paths.get(path.trim()))
                .<ResponseEntity<Map<String, Object>>>map(record -> ResponseEntity.ok(Map.of(
                        "image", ImageResultItem.from(record, tagService.tagNamesById()))))
                .orElse(ResponseEntity.unprocessableEntity()
                        .body(Map.of("error", "Not a readable image: " + path.trim())));
    }

    @DeleteMapping("/images/{id}")
    public ResponseEntity<Map<String, String>> deleteImage(@PathVariable String id) {
        if (!imageService.deleteImage(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Image not found: " + id));
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @GetMapping("/folders")
    public ResponseEntity<Map<String, Object>> listFolders() {
        return ResponseEntity.ok(Map.of("folders", imageService.getIndexedFolders()));
    }
}
