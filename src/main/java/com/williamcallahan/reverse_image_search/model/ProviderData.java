/**
 * Enriched source record resolved from a search hit
 *
 * @author William Callahan
 *
 * Features:
 * - Serializes to the same JSON layout regardless of which provider produced it
 * - Field values are restricted to a single string, a list of tags, or a boolean
 * - Extra links keep insertion order and never contain blanks
 */

package com.williamcallahan.reverse_image_search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ProviderData {

    private final String priorityKey;
    private final String providerId;
    private final String providerLink;
    private final List<String> mainFiles;
    private final Map<String, Object> fields;
    private final Set<String> extraLinks;

    @JsonCreator
    public ProviderData(@JsonProperty("priority_key") String priorityKey,
                        @JsonProperty("provider_id") String providerId,
                        @JsonProperty("provider_link") String providerLink,
                        @JsonProperty("main_files") List<String> mainFiles,
                        @JsonProperty("fields") Map<String, ?> fields,
                        @JsonProperty("extra_links") Collection<String> extraLinks) {
        this.priorityKey = Objects.requireNonNull(priorityKey, "priorityKey");
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.providerLink = providerLink;
        this.mainFiles = mainFiles == null ? List.of() : mainFiles.stream()
            .filter(Objects::nonNull)
            .filter(file -> !file.isBlank())
            .toList();
        this.fields = Collections.unmodifiableMap(normalizeFields(fields));
        Set<String> links = new LinkedHashSet<>();
        if (extraLinks != null) {
            for (String link : extraLinks) {
                if (link != null && !link.isBlank()) {
                    links.add(link);
                }
            }
        }
        this.extraLinks = Collections.unmodifiableSet(links);
    }

    private static Map<String, Object> normalizeFields(Map<String, ?> raw) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (raw == null) {
            return normalized;
        }
        raw.forEach((name, value) -> {
            if (name == null || value == null) {
                return;
            }
            if (value instanceof String || value instanceof Boolean) {
                normalized.put(name, value);
            } else if (value instanceof Collection<?> collection) {
                List<String> tags = new ArrayList<>();
                for (Object tag : collection) {
                    if (tag != null && !tag.toString().isBlank()) {
                        tags.add(tag.toString());
                    }
                }
                normalized.put(name, Collections.unmodifiableList(tags));
            } else {
                throw new IllegalArgumentException("Field '" + name + "' must be a string, a list of tags or a boolean but was "
                    + value.getClass().getSimpleName());
            }
        });
        return normalized;
    }

    public static Builder builder(String priorityKey, String providerId) {
        return new Builder(priorityKey, providerId);
    }

    @JsonProperty("priority_key")
    public String getPriorityKey() {
        return priorityKey;
    }

    @JsonProperty("provider_id")
    public String getProviderId() {
        return providerId;
    }

    @JsonProperty("provider_link")
    public String getProviderLink() {
        return providerLink;
    }

    @JsonProperty("main_files")
    public List<String> getMainFiles() {
        return mainFiles;
    }

    @JsonProperty("fields")
    public Map<String, Object> getFields() {
        return fields;
    }

    @JsonProperty("extra_links")
    public Set<String> getExtraLinks() {
        return extraLinks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProviderData that)) return false;
        return priorityKey.equals(that.priorityKey)
            && providerId.equals(that.providerId)
            && Objects.equals(providerLink, that.providerLink)
            && mainFiles.equals(that.mainFiles)
            && fields.equals(that.fields)
            && extraLinks.equals(that.extraLinks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priorityKey, providerId, providerLink, mainFiles, fields, extraLinks);
    }

    @Override
    public String toString() {
        return "ProviderData{providerId='" + providerId + "', priorityKey='" + priorityKey
            + "', providerLink='" + providerLink + "', extraLinks=" + extraLinks.size() + "}";
    }

    public static final class Builder {
        private final String priorityKey;
        private final String providerId;
        private String providerLink;
        private final List<String> mainFiles = new ArrayList<>();
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final Set<String> extraLinks = new LinkedHashSet<>();

        private Builder(String priorityKey, String providerId) {
            this.priorityKey = priorityKey;
            this.providerId = providerId;
        }

        public Builder providerLink(String providerLink) {
            this.providerLink = providerLink;
            return this;
        }

        public Builder mainFile(String mainFile) {
            if (mainFile != null) {
                this.mainFiles.add(mainFile);
            }
            return this;
        }

        public Builder field(String name, String value) {
            if (value != null && !value.isBlank()) {
                fields.put(name, value);
            }
            return this;
        }

        public Builder field(String name, List<String> tags) {
            if (tags != null && !tags.isEmpty()) {
                fields.put(name, tags);
            }
            return this;
        }

        public Builder field(String name, boolean value) {
            fields.put(name, value);
            return this;
        }

        public Builder extraLink(String link) {
            if (link != null) {
                extraLinks.add(link);
            }
            return this;
        }

        public Builder extraLinks(Collection<String> links) {
            if (links != null) {
                links.forEach(this::extraLink);
            }
            return this;
        }

        public ProviderData build() {
            return new ProviderData(priorityKey, providerId, providerLink, mainFiles, fields, extraLinks);
        }
    }
}
