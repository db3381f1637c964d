package com.visualoom.dto;

import java.util.List;

/**
 * A search string split into its three token classes.
 */
public class ParsedQuery {

    /** Names given as {@code @name} */
    private final List<String> people;

    /** Names given as {@code #topic}; parsed but not matched yet */
    private final List<String> topics;

    /** Remaining free-text words */
    private final List<String> keywords;

    public ParsedQuery(List<String> people, List<String> topics, List<String> keywords) {
        this.people = List.copyOf(people);
        this.topics = List.copyOf(topics);
        this.keywords = List.copyOf(keywords);
    }

    public List<String> getPeople() {
        return people;
    }

    public List<String> getTopics() {
        return topics;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public boolean hasFilters() {
        return !people.isEmpty() || !topics.isEmpty();
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    public String keywordText() {
        return String.join(" ", keywords);
    }
}
