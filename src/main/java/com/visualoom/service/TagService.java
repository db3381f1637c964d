package com.visualoom.service;

import com.visualoom.model.ImageRecord;
import com.visualoom.model.Tag;
import com.visualoom.repository.CatalogRepository;
import com.visualoom.repository.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages the tag catalog and the association of tags with images.
 *
 * Images reference tags by id. Tag ids are only ever written onto an image
 * after the tag itself has been created, so stored references resolve. An id
 * that does not resolve (for example after a tag file was lost) is treated as
 * absent: it never matches a name and resolves to {@link #UNKNOWN_TAG}.
 */
@Service
public class TagService {

    private static final Logger log = LoggerFactory.getLogger(TagService.class);

    public static final String UNKNOWN_TAG = "Unknown";

    private final TagRepository tagRepository;
    private final CatalogRepository catalogRepository;

    public TagService(TagRepository tagRepository, CatalogRepository catalogRepository) {
        this.tagRepository = tagRepository;
        this.catalogRepository = catalogRepository;
    }

    /**
     * Returns the id of the tag with this name, creating it if needed. Calling
     * again with the same name in any letter case returns the same id.
     */
    public String createTag(String name, String type) {
        String trimmed = requireName(name);
        return tagRepository.findOrCreate(trimmed, type).getId();
    }

    public String createTag(String name) {
        return createTag(name, Tag.TYPE_CUSTOM);
    }

    /**
     * Attaches a tag to an image, creating the tag if it does not exist yet.
     * The catalog is only rewritten when the image's tag list changes.
     *
     * @return true if the tag was newly attached; false if the image is unknown
     *         or already carries the tag
     */
    public boolean addTagToImage(String imageId, String tagName) {
        String trimmed = requireName(tagName);
        if (!catalogRepository.existsById(imageId)) {
            log.debug("Cannot tag unknown image {}", imageId);
            return false;
        }
        String tagId = createTag(trimmed);
        boolean changed = catalogRepository.update(imageId, record -> record.addTag(tagId));
        if (changed) {
            log.debug("Tagged image {} with '{}'", imageId, trimmed);
        }
        return changed;
    }

    /**
     * Detaches a tag from an image.
     *
     * @return false if the tag or the image is unknown, or they were not
     *         associated
     */
    public boolean removeTagFromImage(String imageId, String tagName) {
        Optional<Tag> tag = findTag(tagName);
        if (tag.isEmpty()) {
            return false;
        }
        String tagId = tag.get().getId();
        return catalogRepository.update(imageId, record -> record.removeTag(tagId));
    }

    /**
     * Returns every image carrying the named tag, in catalog order.
     */
    public List<ImageRecord> getImagesByTagName(String tagName) {
        Optional<Tag> tag = findTag(tagName);
        if (tag.isEmpty()) {
            return List.of();
        }
        String tagId = tag.get().getId();
        return catalogRepository.findAll().stream()
                .filter(record -> record.getTags() != null && record.getTags().contains(tagId))
                .toList();
    }

    /**
     * Resolves a tag id to its name, or {@link #UNKNOWN_TAG} if no such tag
     * exists.
     */
    public String getTagName(String tagId) {
        return tagRepository.findById(tagId).map(Tag::getName).orElse(UNKNOWN_TAG);
    }

    /**
     * Names of the tags on a record. Ids that do not resolve are skipped.
     */
    public List<String> getTagNames(ImageRecord record) {
        Map<String, String> names = tagNamesById();
        List<String> result = new ArrayList<>();
        for (String tagId : record.getTags()) {
            String name = names.get(tagId);
            if (name != null) {
                result.add(name);
            }
        }
        return result;
    }

    public List<Tag> getAllTags() {
        return tagRepository.findAll();
    }

    /**
     * Snapshot of the tag catalog as id → name.
     */
    public Map<String, String> tagNamesById() {
        Map<String, String> names = new HashMap<>();
        for (Tag tag : tagRepository.findAll()) {
            names.put(tag.getId(), tag.getName());
        }
        return names;
    }

    private Optional<Tag> findTag(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return tagRepository.findByName(name.trim());
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be empty");
        }
        return name.trim();
    }
}
