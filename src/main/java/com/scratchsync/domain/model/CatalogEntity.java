package com.scratchsync.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scraped catalog record (e.g. one scratch-ticket game).
 *
 * Apart from the identifier and the asset URL attributes, the content is opaque:
 * every other field scraped upstream is kept as-is in the attribute map.
 */
@JsonPropertyOrder({"id"})
public class CatalogEntity {

    public static final String LIFECYCLE_ATTRIBUTE = "lifecycle";

    /** Stable identifier inside its catalog (game number, slug, ...). */
    private String id;

    /** All other scraped fields, in scrape order. */
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public CatalogEntity() {
    }

    public CatalogEntity(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * String view of an attribute; null when absent, null-valued or blank.
     */
    public String getStringAttribute(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /**
     * An attribute counts as present only when it holds a non-null value.
     */
    public boolean hasAttribute(String name) {
        return attributes.get(name) != null;
    }

    public void removeAttribute(String name) {
        attributes.remove(name);
    }

    @JsonIgnore
    public String getAssetUrl(AssetKind kind) {
        return getStringAttribute(kind.getAttribute());
    }

    public void setAssetUrl(AssetKind kind, String url) {
        attributes.put(kind.getAttribute(), url);
    }

    /**
     * Stores the lifecycle key ("new", "continuing", "ended") as a plain attribute.
     */
    public void markLifecycle(Lifecycle lifecycle) {
        attributes.put(LIFECYCLE_ATTRIBUTE, lifecycle.getKey());
    }

    /**
     * Shallow copy; attribute values are shared.
     */
    public CatalogEntity copy() {
        CatalogEntity copy = new CatalogEntity(id);
        copy.attributes.putAll(attributes);
        return copy;
    }
}
