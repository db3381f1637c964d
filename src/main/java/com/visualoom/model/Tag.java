package com.visualoom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A named label that can be attached to images. Names are unique ignoring case.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tag {

    public static final String TYPE_PERSON = "person";
    public static final String TYPE_TOPIC = "topic";
    public static final String TYPE_CUSTOM = "custom";

    private String id;
    private String name;
    private String type = TYPE_CUSTOM;

    public Tag() {
    }

    public Tag(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public boolean hasName(String candidate) {
        return name != null && candidate != null && name.equalsIgnoreCase(candidate);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
