package com.visualoom.service;

import com.visualoom.config.AppConfig;
import com.visualoom.model.ImageRecord;
import com.visualoom.repository.CatalogRepository;
import com.visualoom.service.embedding.EmbeddingModel;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sweeps a directory tree and adds every image not yet in the catalog.
 *
 * For each sweep:
 * 1. Walk the tree and collect supported files whose absolute path is not
 * catalogued yet (sorted by path)
 * 2. Extract metadata; unreadable files are skipped
 * 3. Assign a fresh id, attach the optional tag, compute the embedding
 * 4. Persist new records in batches of {@code app.index-flush-size} and push
 * them to the EmbeddingStore
 *
 * A failure on one file never stops the sweep. A failed catalog write does,
 * but everything flushed before it stays persisted.
 */
@Service
public class ImageIndexerService {

    private static final Logger log = LoggerFactory.getLogger(ImageIndexerService.class);

    private final CatalogRepository catalogRepository;
    private final EmbeddingStore vectorStore;
    private final MetadataExtractor metadataExtractor;
    private final EmbeddingModel embeddingModel;
    private final TagService tagService;
    private final AppConfig appConfig;

    public ImageIndexerService(CatalogRepository catalogRepository,
            EmbeddingStore vectorStore,
            MetadataExtractor metadataExtractor,
            EmbeddingModel embeddingModel,
            TagService tagService,
            AppConfig appConfig) {
        this.catalogRepository = catalogRepository;
        this.vectorStore = vectorStore;
        this.metadataExtractor = metadataExtractor;
        this.embeddingModel = embeddingModel;
        this.tagService = tagService;
        this.appConfig = appConfig;
    }

    /**
     * On startup: loads all catalogued embeddings into the vector store.
     */
    @PostConstruct
    public void loadExistingEmbeddings() {
        vectorStore.loadAll(catalogRepository.findAll());
    }

    public List<ImageRecord> index(Path root) {
        return index(root, null, IndexProgressListener.NONE);
    }

    /**
     * Indexes every new image under {@code root}.
     *
     * @param root     directory to sweep, recursively
     * @param tagName  optional tag attached to each new image; may be null
     * @param listener progress callbacks
     * @return the records added by this sweep, in path order
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public List<ImageRecord> index(Path root, String tagName, IndexProgressListener listener) {
        Path dir = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Not a directory: " + dir);
        }
        log.info("Starting sweep of {}", dir);

        List<Path> candidates = discover(dir);
        listener.onDiscovered(candidates.size());
        if (candidates.isEmpty()) {
            log.info("No new images found in {}", dir);
            return List.of();
        }

        String tagId = (tagName != null && !tagName.isBlank()) ? tagService.createTag(tagName) : null;
        int flushSize = Math.max(1, appConfig.getIndexFlushSize());

        List<ImageRecord> indexed = new ArrayList<>();
        List<ImageRecord> pending = new ArrayList<>();
        int processed = 0;
        for (Path file : candidates) {
            buildRecord(file, tagId).ifPresent(pending::add);
            processed++;
            if (pending.size() >= flushSize) {
                indexed.addAll(flush(pending));
            }
            listener.onProgress(processed, indexed.size());
        }
        indexed.addAll(flush(pending));
        listener.onProgress(processed, indexed.size());

        log.info("Indexed {} new images from {} ({} candidates)", indexed.size(), dir, candidates.size());
        return indexed;
    }

    /**
     * Adds one image to the catalog, outside of any sweep.
     *
     * @param file image file
     * @return the new record, or the existing one if the path is already
     *         catalogued; empty if the file cannot be read as an image
     * @throws IllegalArgumentException if {@code file} is not a regular file
     *                                  with a supported extension
     */
    public Optional<ImageRecord> indexFile(Path file) {
        Path path = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path) || !metadataExtractor.isSupportedImage(path)) {
            throw new IllegalArgumentException("Not a supported image file: " + path);
        }
        Optional<ImageRecord> existing = catalogRepository.findByPath(path.toString());
        if (existing.isPresent()) {
            log.debug("{} is already catalogued as {}", path, existing.get().getId());
            return existing;
        }

        Optional<ImageRecord> record = buildRecord(path, null);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        List<ImageRecord> added = flush(new ArrayList<>(List.of(record.get())));
        if (added.isEmpty()) {
            // Catalogued by a concurrent sweep in the meantime
            return catalogRepository.findByPath(path.toString());
        }
        log.info("Added {} to the catalog as {}", path, added.get(0).getId());
        return Optional.of(added.get(0));
    }

    /**
     * Collects supported files under {@code dir} that are not catalogued yet.
     * Directories and files that cannot be read are logged and skipped.
     */
    private List<Path> discover(Path dir) {
        List<Path> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && metadataExtractor.isSupportedImage(file)) {
                        Path absolute = file.toAbsolutePath().normalize();
                        if (!catalogRepository.existsByPath(absolute.toString())) {
                            candidates.add(absolute);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot access {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + dir, e);
        }
        candidates.sort(Comparator.comparing(Path::toString));
        return candidates;
    }

    private Optional<ImageRecord> buildRecord(Path file, String tagId) {
        Optional<ImageRecord> extracted = metadataExtractor.extract(file);
        if (extracted.isEmpty()) {
            return Optional.empty();
        }
        ImageRecord record = extracted.get();
        record.setId(UUID.randomUUID().toString());
        if (tagId != null) {
            record.addTag(tagId);
        }
        record.setEmbedding(computeEmbedding(file));
        return Optional.of(record);
    }

    /**
     * Returns the image embedding, or null when the model gives none. The
     * record is catalogued either way.
     */
    private float[] computeEmbedding(Path file) {
        try {
            Optional<float[]> vector = embeddingModel.imageEmbedding(file);
            if (vector.isPresent() && vector.get().length > 0) {
                return vector.get();
            }
            log.debug("No embedding produced for {}", file.getFileName());
        } catch (RuntimeException e) {
            log.warn("Embedding failed for {}: {}", file, e.getMessage());
        }
        return null;
    }

    private List<ImageRecord> flush(List<ImageRecord> pending) {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<ImageRecord> added = catalogRepository.saveAll(pending);
        pending.clear();
        vectorStore.addAll(added);
        return added;
    }
}
