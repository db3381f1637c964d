package com.visualoom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One indexed image in the catalog. The absolute {@code path} is the
 * de-duplication key; {@code id} is assigned once on insertion and never
 * changes.
 *
 * The embedding is optional: records whose vector could not be computed are
 * still searchable by tag.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImageRecord {

    private String id;
    private String path;
    private String format;
    private Integer width;
    private Integer height;
    private Long sizeBytes;
    private LocalDateTime created;
    private LocalDateTime modified;

    /** Tag ids in insertion order, without duplicates */
    private List<String> tags = new ArrayList<>();

    /** Embedding vector; dimension is fixed by the embedding model */
    private float[] embedding;

    /** Derived thumbnail location, not interpreted here */
    private String thumbnail;

    // ───────────── constructors ─────────────

    public ImageRecord() {
    }

    public ImageRecord(ImageRecord other) {
        this.id = other.id;
        this.path = other.path;
        this.format = other.format;
        this.width = other.width;
        this.height = other.height;
        this.sizeBytes = other.sizeBytes;
        this.created = other.created;
        this.modified = other.modified;
        this.tags = other.tags != null ? new ArrayList<>(other.tags) : new ArrayList<>();
        this.embedding = other.embedding != null ? other.embedding.clone() : null;
        this.thumbnail = other.thumbnail;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    /**
     * Appends a tag id unless it is already present.
     *
     * @return true if the tag list changed
     */
    public boolean addTag(String tagId) {
        if (tags == null) {
            tags = new ArrayList<>();
        }
        if (tags.contains(tagId)) {
            return false;
        }
        return tags.add(tagId);
    }

    public boolean removeTag(String tagId) {
        return tags != null && tags.removeIf(tagId::equals);
    }

    // ───────────── getters / setters ─────────────

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public LocalDateTime getCreated() {
        return created;
    }

    public void setCreated(LocalDateTime created) {
        this.created = created;
    }

    public LocalDateTime getModified() {
        return modified;
    }

    public void setModified(LocalDateTime modified) {
        this.modified = modified;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Replaces the tag list. Repeated ids are collapsed to their first
     * occurrence and null ids are dropped.
     */
    public void setTags(List<String> tags) {
        List<String> distinct = new ArrayList<>();
        if (tags != null) {
            for (String tagId : new LinkedHashSet<>(tags)) {
                if (tagId != null) {
                    distinct.add(tagId);
                }
            }
        }
        this.tags = distinct;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public void setEmbedding(float[] embedding) {
        this.embedding = embedding;
    }

    public String getThumbnail() {
        return thumbnail;
    }

    public void setThumbnail(String thumbnail) {
        this.thumbnail = thumbnail;
    }

    @Override
    public String toString() {
        return "ImageRecord{id=" + id + ", path=" + path + "}";
    }
}
