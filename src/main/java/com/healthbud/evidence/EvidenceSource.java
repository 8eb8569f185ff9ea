package com.healthbud.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A search hit from a trusted medical site.
 */
public final class EvidenceSource {
    @JsonProperty("title") public final String title;
    @JsonProperty("url") public final String url;
    @JsonProperty("snippet") public final String snippet;

    @JsonCreator
    public EvidenceSource(
            @JsonProperty("title") String title,
            @JsonProperty("url") String url,
            @JsonProperty("snippet") String snippet) {
        this.title = title;
        this.url = url;
        this.snippet = snippet == null ? "" : snippet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvidenceSource)) return false;
        EvidenceSource that = (EvidenceSource) o;
        return Objects.equals(title, that.title) && Objects.equals(url, that.url)
            && Objects.equals(snippet, that.snippet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, url, snippet);
    }

    @Override
    public String toString() {
        return String.format("EvidenceSource{title='%s', url='%s'}", title, url);
    }
}
