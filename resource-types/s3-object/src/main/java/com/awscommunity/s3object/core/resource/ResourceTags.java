package com.awscommunity.s3object.core.resource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.awscommunity.s3object.model.Tag;

public final class ResourceTags {
    private ResourceTags() {}

    /**
     * Stack-level tags first, then the model's own tags; a model tag wins over a stack tag with
     * the same key. Insertion order is kept.
     */
    public static Map<String, String> merge(Map<String, String> stackTags, List<Tag> modelTags) {
        Map<String, String> out = new LinkedHashMap<>();
        if (stackTags != null) out.putAll(stackTags);
        if (modelTags != null) {
            for (Tag t : modelTags) {
                if (t == null) continue;
                out.put(t.key(), t.value());
            }
        }
        return out;
    }

    /** Tag set as the model reports it; empty becomes null so an untagged object reads back without Tags. */
    public static List<Tag> toModelTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        List<Tag> out = new ArrayList<>(tags.size());
        tags.forEach((k, v) -> out.add(new Tag(k, v)));
        return out;
    }
}
