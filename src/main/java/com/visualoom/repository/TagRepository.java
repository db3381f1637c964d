package com.visualoom.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualoom.config.AppConfig;
import com.visualoom.exception.CatalogPersistenceException;
import com.visualoom.model.Tag;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tag catalog backed by a JSON file. Name lookups ignore case; the first
 * spelling of a name to be created is the one that is kept.
 */
@Repository
public class TagRepository {

    private static final Logger log = LoggerFactory.getLogger(TagRepository.class);

    private final Path tagPath;
    private final JsonRecordStore<Tag> store;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<Tag> tags = new ArrayList<>();

    public TagRepository(AppConfig appConfig, ObjectMapper objectMapper) {
        this.tagPath = appConfig.getTagPath();
        this.store = new JsonRecordStore<>(objectMapper, Tag.class);
    }

    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            List<Tag> loaded = new ArrayList<>();
            for (Tag tag : store.load(tagPath)) {
                if (tag.getId() == null || tag.getName() == null) {
                    log.warn("Dropping tag entry without id or name");
                    continue;
                }
                if (find(loaded, tag.getName()).isPresent()) {
                    log.warn("Dropping duplicate tag name '{}'", tag.getName());
                    continue;
                }
                loaded.add(tag);
            }
            tags = loaded;
            log.info("Loaded {} tags from {}", tags.size(), tagPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Tag> findAll() {
        lock.readLock().lock();
        try {
            return tags.stream().map(TagRepository::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Tag> findByName(String name) {
        lock.readLock().lock();
        try {
            return find(tags, name).map(TagRepository::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Tag> findById(String id) {
        lock.readLock().lock();
        try {
            return tags.stream().filter(t -> t.getId().equals(id)).findFirst().map(TagRepository::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the tag with the given name, creating and persisting it if no tag
     * with that name exists yet.
     */
    public Tag findOrCreate(String name, String type) {
        lock.writeLock().lock();
        try {
            Optional<Tag> existing = find(tags, name);
            if (existing.isPresent()) {
                return copy(existing.get());
            }
            Tag created = new Tag(nextId(), name, type != null ? type : Tag.TYPE_CUSTOM);
            List<Tag> next = new ArrayList<>(tags);
            next.add(created);
            try {
                store.save(tagPath, next);
            } catch (IOException e) {
                log.error("Failed to write tag file {}: {}", tagPath, e.getMessage());
                throw new CatalogPersistenceException("Failed to write tag file " + tagPath, e);
            }
            tags = next;
            log.info("Created tag '{}' ({}) as {}", name, created.getType(), created.getId());
            return copy(created);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private String nextId() {
        String id;
        do {
            id = "t" + UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        } while (containsId(id));
        return id;
    }

    private boolean containsId(String id) {
        for (Tag tag : tags) {
            if (tag.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Tag> find(List<Tag> source, String name) {
        return source.stream().filter(t -> t.hasName(name)).findFirst();
    }

    private static Tag copy(Tag tag) {
        return new Tag(tag.getId(), tag.getName(), tag.getType());
    }
}
