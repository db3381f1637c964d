package com.visualoom.service;

import com.visualoom.model.ImageRecord;
import com.visualoom.util.EmbeddingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * In-memory vector catalog with exact cosine similarity search.
 *
 * Holds the image records it was given and, derived from them, a dense matrix
 * of unit vectors with a parallel id list. Records without an embedding are
 * left out of the matrix. The matrix is rebuilt from scratch after every
 * mutation, so a write costs O(n) in the number of embedded records; this
 * suits catalogs that fit comfortably in memory.
 *
 * Thread safety: mutations are serialised on the store; each rebuild publishes
 * a new immutable snapshot through a volatile field, so searches never block
 * and always see one consistent matrix.
 */
@Component
public class EmbeddingStore {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStore.class);

    private final Object mutationLock = new Object();
    private final List<ImageRecord> records = new ArrayList<>();

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Replaces the whole content of the store (called at startup).
     */
    public void loadAll(Collection<ImageRecord> catalog) {
        synchronized (mutationLock) {
            records.clear();
            for (ImageRecord record : catalog) {
                records.add(new ImageRecord(record));
            }
            rebuild();
            log.info("EmbeddingStore loaded {} vectors from {} records", snapshot.size(), records.size());
        }
    }

    /**
     * Appends a record, replacing any record with the same id.
     */
    public void add(ImageRecord record) {
        addAll(List.of(record));
    }

    public void addAll(Collection<ImageRecord> newRecords) {
        if (newRecords.isEmpty()) {
            return;
        }
        synchronized (mutationLock) {
            for (ImageRecord record : newRecords) {
                records.removeIf(r -> r.getId().equals(record.getId()));
                records.add(new ImageRecord(record));
            }
            rebuild();
        }
    }

    /**
     * Removes a record by id.
     *
     * @return true if a record was removed
     */
    public boolean remove(String id) {
        synchronized (mutationLock) {
            boolean removed = records.removeIf(r -> r.getId().equals(id));
            if (removed) {
                rebuild();
            }
            return removed;
        }
    }

    /**
     * Finds the records most similar to the query vector.
     *
     * @param query query embedding; need not be unit length
     * @param topK  maximum number of hits
     * @return hits in descending score order, ties in catalog order; empty if
     *         the store holds no vectors
     * @throws IllegalArgumentException if the query dimension differs from the
     *                                  stored vectors
     */
    public List<SearchHit> search(float[] query, int topK) {
        Snapshot current = snapshot;
        if (current.size() == 0 || topK <= 0) {
            return Collections.emptyList();
        }
        if (query.length != current.dimension) {
            throw new IllegalArgumentException(
                    "Query dimension " + query.length + " does not match store dimension " + current.dimension);
        }

        float[] unitQuery = EmbeddingUtils.l2Normalize(query);
        double[] scores = new double[current.size()];
        List<Integer> order = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            // Rows are already unit length; cosineSimilarity normalises again anyway
            scores[i] = EmbeddingUtils.cosineSimilarity(unitQuery, current.rows[i]);
            order.add(i);
        }
        // List.sort is stable, so equal scores keep catalog order
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        int count = Math.min(topK, order.size());
        List<SearchHit> hits = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int row = order.get(i);
            hits.add(new SearchHit(new ImageRecord(current.records[row]), scores[row]));
        }
        return hits;
    }

    /**
     * Number of vectors currently searchable.
     */
    public int getSize() {
        return snapshot.size();
    }

    public List<String> getIds() {
        return List.of(snapshot.ids);
    }

    // Caller holds mutationLock
    private void rebuild() {
        int dimension = -1;
        List<String> ids = new ArrayList<>();
        List<float[]> rows = new ArrayList<>();
        List<ImageRecord> embedded = new ArrayList<>();
        for (ImageRecord record : records) {
            if (!record.hasEmbedding()) {
                continue;
            }
            float[] vector = record.getEmbedding();
            if (dimension < 0) {
                dimension = vector.length;
            } else if (vector.length != dimension) {
                log.warn("Excluding {} from vector search: dimension {} differs from {}",
                        record.getPath(), vector.length, dimension);
                continue;
            }
            ids.add(record.getId());
            rows.add(EmbeddingUtils.l2Normalize(vector));
            embedded.add(record);
        }
        snapshot = new Snapshot(
                ids.toArray(new String[0]),
                rows.toArray(new float[0][]),
                embedded.toArray(new ImageRecord[0]),
                dimension);
    }

    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(new String[0], new float[0][], new ImageRecord[0], -1);

        final String[] ids;
        final float[][] rows;
        final ImageRecord[] records;
        final int dimension;

        Snapshot(String[] ids, float[][] rows, ImageRecord[] records, int dimension) {
            this.ids = ids;
            this.rows = rows;
            this.records = records;
            this.dimension = dimension;
        }

        int size() {
            return ids.length;
        }
    }

    /** Represents a search result from the vector store. */
    public static class SearchHit {
        public final ImageRecord record;
        public final double score;

        public SearchHit(ImageRecord record, double score) {
            this.record = record;
            this.score = score;
        }
    }
}
