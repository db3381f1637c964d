package com.visualoom.service;

import com.visualoom.model.ImageRecord;
import com.visualoom.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog-level operations on images that are not part of a sweep.
 */
@Service
public class ImageService {

    private static final Logger log = LoggerFactory.getLogger(ImageService.class);

    private final CatalogRepository catalogRepository;
    private final EmbeddingStore vectorStore;
    private final ImageIndexerService imageIndexerService;

    public ImageService(CatalogRepository catalogRepository,
            EmbeddingStore vectorStore,
            ImageIndexerService imageIndexerService) {
        this.catalogRepository = catalogRepository;
        this.vectorStore = vectorStore;
        this.imageIndexerService = imageIndexerService;
    }

    /**
     * Catalogues a single image file with no tags. Its embedding is computed
     * when the model can produce one.
     *
     * @return the new record, or the existing one for an already catalogued
     *         path; empty if the file is not a readable image
     */
    public Optional<ImageRecord> addImage(Path file) {
        return imageIndexerService.indexFile(file);
    }

    public List<ImageRecord> listImages() {
        return catalogRepository.findAll();
    }

    /**
     * Removes an image from the catalog and from vector search. The file on
     * disk is left alone.
     *
     * @return false if the id is unknown
     */
    public boolean deleteImage(String imageId) {
        return catalogRepository.deleteById(imageId)
                .map(removed -> {
                    vectorStore.remove(removed.getId());
                    log.info("Removed image {} ({}) from the catalog", removed.getId(), removed.getPath());
                    return true;
                })
                .orElseGet(() -> {
                    log.debug("Image {} not found in catalog", imageId);
                    return false;
                });
    }

    /**
     * Unique parent directories of all catalogued images, sorted.
     */
    public List<String> getIndexedFolders() {
        return catalogRepository.findAll().stream()
                .map(record -> Paths.get(record.getPath()).getParent())
                .filter(Objects::nonNull)
                .map(Path::toString)
                .distinct()
                .sorted()
                .toList();
    }
}
