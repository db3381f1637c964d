package com.visualoom.service;

import com.visualoom.config.AppConfig;
import com.visualoom.dto.ParsedQuery;
import com.visualoom.model.ImageRecord;
import com.visualoom.repository.CatalogRepository;
import com.visualoom.service.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hybrid search over the catalog.
 *
 * A query is split into {@code @person} filters, {@code #topic} filters and
 * free-text keywords. Person filters select catalog records carrying a tag of
 * that name; keywords are embedded and matched against the EmbeddingStore.
 * Tag matches come first in catalog order, followed by semantic matches not
 * already present. The merged list is not cut back to {@code topK}.
 *
 * Topic filters are parsed but not matched against anything yet.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private static final Pattern PERSON_TOKEN = Pattern.compile("@(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TOPIC_TOKEN = Pattern.compile("#(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern FILTER_TOKEN = Pattern.compile("[@#]\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore vectorStore;
    private final CatalogRepository catalogRepository;
    private final TagService tagService;
    private final AppConfig appConfig;

    public SearchService(EmbeddingModel embeddingModel,
            EmbeddingStore vectorStore,
            CatalogRepository catalogRepository,
            TagService tagService,
            AppConfig appConfig) {
        this.embeddingModel = embeddingModel;
        this.vectorStore = vectorStore;
        this.catalogRepository = catalogRepository;
        this.tagService = tagService;
        this.appConfig = appConfig;
    }

    public ParsedQuery parse(String query) {
        if (query == null || query.isBlank()) {
            return new ParsedQuery(List.of(), List.of(), List.of());
        }
        List<String> people = captures(PERSON_TOKEN, query);
        List<String> topics = captures(TOPIC_TOKEN, query);
        String remainder = FILTER_TOKEN.matcher(query).replaceAll("");
        List<String> keywords = new ArrayList<>();
        for (String word : WHITESPACE.split(remainder)) {
            if (!word.isEmpty()) {
                keywords.add(word);
            }
        }
        return new ParsedQuery(people, topics, keywords);
    }

    public List<ImageRecord> search(String query) {
        return search(query, appConfig.getDefaultTopK());
    }

    /**
     * Runs a hybrid query.
     *
     * @param query free text with optional {@code @person} and {@code #topic}
     *              tokens
     * @param topK  number of semantic matches to request
     * @return tag matches followed by semantic matches, without duplicates
     */
    public List<ImageRecord> search(String query, int topK) {
        ParsedQuery parsed = parse(query);
        Map<String, ImageRecord> merged = new LinkedHashMap<>();

        if (parsed.hasFilters()) {
            if (!parsed.getTopics().isEmpty()) {
                log.debug("Topic filters {} are not matched against the catalog", parsed.getTopics());
            }
            for (ImageRecord record : findByPeople(parsed.getPeople())) {
                merged.putIfAbsent(record.getId(), record);
            }
        }

        if (parsed.hasKeywords()) {
            for (ImageRecord record : semanticMatches(parsed.keywordText(), topK)) {
                merged.putIfAbsent(record.getId(), record);
            }
        }

        return new ArrayList<>(merged.values());
    }

    /**
     * Records carrying a tag whose name equals one of the given names, ignoring
     * case, in catalog order.
     */
    private List<ImageRecord> findByPeople(List<String> people) {
        if (people.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new HashSet<>();
        for (String person : people) {
            wanted.add(person.toLowerCase(Locale.ROOT));
        }
        Map<String, String> tagNames = tagService.tagNamesById();

        List<ImageRecord> matches = new ArrayList<>();
        for (ImageRecord record : catalogRepository.findAll()) {
            for (String tagId : record.getTags()) {
                String name = tagNames.get(tagId);
                if (name != null && wanted.contains(name.toLowerCase(Locale.ROOT))) {
                    matches.add(record);
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Embeds the keyword text and returns the closest catalog records. Any
     * failure of the embedding model or the store yields no semantic matches.
     */
    private List<ImageRecord> semanticMatches(String text, int topK) {
        try {
            Optional<float[]> queryVector = embeddingModel.textEmbedding(text);
            if (queryVector.isEmpty() || queryVector.get().length == 0) {
                log.warn("No embedding for query '{}', skipping semantic search", text);
                return List.of();
            }
            List<ImageRecord> matches = new ArrayList<>();
            for (EmbeddingStore.SearchHit hit : vectorStore.search(queryVector.get(), topK)) {
                // Re-read from the catalog so tags reflect the latest state
                catalogRepository.findById(hit.record.getId()).ifPresent(matches::add);
            }
            return matches;
        } catch (RuntimeException e) {
            log.warn("Semantic search failed for '{}': {}", text, e.getMessage());
            return List.of();
        }
    }

    private static List<String> captures(Pattern pattern, String text) {
        List<String> values = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            values.add(matcher.group(1));
        }
        return values;
    }
}
