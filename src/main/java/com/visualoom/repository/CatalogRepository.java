package com.visualoom.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualoom.config.AppConfig;
import com.visualoom.exception.CatalogPersistenceException;
import com.visualoom.model.ImageRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * The image catalog: the single source of truth for every indexed image.
 *
 * The full record list is held in memory and written through to the catalog
 * file on every change. Writers are serialised by a write lock and merge
 * against the current in-memory list, so concurrent sweeps cannot overwrite
 * each other's records. If a write fails the in-memory list is left unchanged
 * and a {@link CatalogPersistenceException} is thrown.
 *
 * Callers always receive copies; records held here are never handed out.
 */
@Repository
public class CatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(CatalogRepository.class);

    private final Path catalogPath;
    private final JsonRecordStore<ImageRecord> store;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<ImageRecord> records = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();
    private final Set<String> paths = new HashSet<>();

    public CatalogRepository(AppConfig appConfig, ObjectMapper objectMapper) {
        this.catalogPath = appConfig.getCatalogPath();
        this.store = new JsonRecordStore<>(objectMapper, ImageRecord.class);
    }

    /**
     * (Re)loads the catalog from disk. Entries without id or path, and entries
     * repeating an id or path already seen, are dropped.
     */
    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            List<ImageRecord> loaded = new ArrayList<>();
            Set<String> seenIds = new HashSet<>();
            Set<String> seenPaths = new HashSet<>();
            for (ImageRecord record : store.load(catalogPath)) {
                if (record.getId() == null || record.getPath() == null) {
                    log.warn("Dropping catalog entry without id or path: {}", record);
                    continue;
                }
                if (!seenIds.add(record.getId()) || !seenPaths.add(record.getPath())) {
                    log.warn("Dropping duplicate catalog entry: {}", record);
                    continue;
                }
                loaded.add(record);
            }
            commit(loaded);
            log.info("Catalog loaded {} images from {}", records.size(), catalogPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ImageRecord> findAll() {
        lock.readLock().lock();
        try {
            List<ImageRecord> copies = new ArrayList<>(records.size());
            for (ImageRecord record : records) {
                copies.add(new ImageRecord(record));
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ImageRecord> findById(String id) {
        lock.readLock().lock();
        try {
            Integer idx = indexById.get(id);
            return idx == null ? Optional.empty() : Optional.of(new ImageRecord(records.get(idx)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ImageRecord> findByPath(String path) {
        lock.readLock().lock();
        try {
            if (!paths.contains(path)) {
                return Optional.empty();
            }
            return records.stream()
                    .filter(r -> r.getPath().equals(path))
                    .findFirst()
                    .map(ImageRecord::new);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean existsById(String id) {
        lock.readLock().lock();
        try {
            return indexById.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean existsByPath(String path) {
        lock.readLock().lock();
        try {
            return paths.contains(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Appends new records and persists the whole catalog in one write. Records
     * whose path or id is already present are skipped.
     *
     * @return copies of the records that were actually added, in input order
     */
    public List<ImageRecord> saveAll(Collection<ImageRecord> newRecords) {
        if (newRecords.isEmpty()) {
            return List.of();
        }
        lock.writeLock().lock();
        try {
            List<ImageRecord> next = new ArrayList<>(records);
            List<ImageRecord> added = new ArrayList<>();
            Set<String> batchPaths = new HashSet<>();
            Set<String> batchIds = new HashSet<>();
            for (ImageRecord record : newRecords) {
                String path = record.getPath();
                String id = record.getId();
                if (paths.contains(path) || indexById.containsKey(id)
                        || !batchPaths.add(path) || !batchIds.add(id)) {
                    log.debug("Skipping already catalogued image {}", path);
                    continue;
                }
                ImageRecord copy = new ImageRecord(record);
                next.add(copy);
                added.add(new ImageRecord(copy));
            }
            if (added.isEmpty()) {
                return List.of();
            }
            persist(next);
            commit(next);
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a change to one record and persists only if the change reports
     * that something was modified. The id and path of the record are fixed.
     *
     * @param id       image id
     * @param mutation edits a copy of the record and returns true if it changed
     *                 anything
     * @return true if the record existed, changed and was persisted
     */
    public boolean update(String id, Predicate<ImageRecord> mutation) {
        lock.writeLock().lock();
        try {
            Integer idx = indexById.get(id);
            if (idx == null) {
                return false;
            }
            ImageRecord current = records.get(idx);
            ImageRecord copy = new ImageRecord(current);
            if (!mutation.test(copy)) {
                return false;
            }
            copy.setId(current.getId());
            copy.setPath(current.getPath());
            List<ImageRecord> next = new ArrayList<>(records);
            next.set(idx, copy);
            persist(next);
            commit(next);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a record and persists the catalog.
     *
     * @return the removed record, or empty if the id is unknown
     */
    public Optional<ImageRecord> deleteById(String id) {
        lock.writeLock().lock();
        try {
            Integer idx = indexById.get(id);
            if (idx == null) {
                return Optional.empty();
            }
            List<ImageRecord> next = new ArrayList<>(records);
            ImageRecord removed = next.remove(idx.intValue());
            persist(next);
            commit(next);
            return Optional.of(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persist(List<ImageRecord> next) {
        try {
            store.save(catalogPath, next);
        } catch (IOException e) {
            log.error("Failed to write catalog {}: {}", catalogPath, e.getMessage());
            throw new CatalogPersistenceException("Failed to write catalog " + catalogPath, e);
        }
    }

    // Caller holds the write lock
    private void commit(List<ImageRecord> next) {
        records = next;
        indexById.clear();
        paths.clear();
        for (int i = 0; i < next.size(); i++) {
            indexById.put(next.get(i).getId(), i);
            paths.add(next.get(i).getPath());
        }
    }
}
