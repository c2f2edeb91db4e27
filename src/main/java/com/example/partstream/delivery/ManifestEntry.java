package com.example.partstream.delivery;

import com.example.partstream.part.Part;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Shape of one part as listed by the manifest; built without evaluating the part.
 */
public record ManifestEntry(
        @JsonProperty("key") String key,
        @JsonProperty("index") int index,
        @JsonProperty("type") String type,
        @JsonProperty("is_lazy") boolean lazy,
        @JsonProperty("kind") String kind,
        @JsonProperty("dependencies") List<String> dependencies) {

    public static final String TYPE_LAZY = "lazy";
    public static final String TYPE_STATIC = "static";

    public static ManifestEntry of(Part part, int index) {
        return new ManifestEntry(
                part.name(),
                index,
                part.isLazy() ? TYPE_LAZY : TYPE_STATIC,
                part.isLazy(),
                part.kind().name().toLowerCase(Locale.ROOT),
                part.dependsOn());
    }
}
