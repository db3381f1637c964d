package com.visualoom.dto;

import com.visualoom.model.ImageRecord;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A single image returned by the API. Tags are resolved to names and the
 * embedding vector is left out.
 */
public class ImageResultItem {

    private String id;
    private String path;
    private String fileName;
    private String format;
    private Integer width;
    private Integer height;
    private Long sizeBytes;
    private LocalDateTime created;
    private LocalDateTime modified;
    private List<String> tags;
    private boolean embedded;
    private String thumbnail;

    public ImageResultItem() {
    }

    /**
     * Builds the API view of a record.
     *
     * @param tagNames tag id → name; ids missing from the map are dropped
     */
    public static ImageResultItem from(ImageRecord record, Map<String, String> tagNames) {
        ImageResultItem item = new ImageResultItem();
        item.setId(record.getId());
        item.setPath(record.getPath());
        Path fileName = Paths.get(record.getPath()).getFileName();
        item.setFileName(fileName != null ? fileName.toString() : record.getPath());
        item.setFormat(record.getFormat());
        item.setWidth(record.getWidth());
        item.setHeight(record.getHeight());
        item.setSizeBytes(record.getSizeBytes());
        item.setCreated(record.getCreated());
        item.setModified(record.getModified());
        List<String> names = new ArrayList<>();
        for (String tagId : record.getTags()) {
            String name = tagNames.get(tagId);
            if (name != null) {
                names.add(name);
            }
        }
        item.setTags(names);
        item.setEmbedded(record.hasEmbedding());
        item.setThumbnail(record.getThumbnail());
        return item;
    }

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

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
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

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    public void setEmbedded(boolean embedded) {
        this.embedded = embedded;
    }

    public String getThumbnail() {
        return thumbnail;
    }

    public void setThumbnail(String thumbnail) {
        this.thumbnail = thumbnail;
    }
}
