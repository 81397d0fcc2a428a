package com.example.playlistrouter.domain.filter;

import com.example.playlistrouter.domain.model.TrackInfo;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Track attributes a rule can reference, keyed by their JSON name.
 */
public enum FilterAttribute {

    DURATION_MS("duration_ms", Kind.NUMERIC, TrackInfo::getDurationMs, null, null),
    POPULARITY("popularity", Kind.NUMERIC, TrackInfo::getPopularity, null, null),
    RELEASE_YEAR("release_year", Kind.NUMERIC, TrackInfo::getReleaseYear, null, null),
    ARTIST_POPULARITY("artist_popularity", Kind.NUMERIC, TrackInfo::getMaxArtistPopularity, null, null),
    GENRES("genres", Kind.VALUES, null, TrackInfo::getAllGenres, null),
    EXPLICIT("explicit", Kind.VALUES, null,
            track -> Collections.singletonList(String.valueOf(track.isExplicit())), null),
    TRACK_KEYWORDS("track_keywords", Kind.TEXT, null, null, TrackInfo::getName),
    ARTIST_KEYWORDS("artist_keywords", Kind.TEXT, null, null,
            track -> String.join(" ", track.getArtistNames()));

    public enum Kind {
        NUMERIC,
        VALUES,
        TEXT
    }

    private final String key;
    private final Kind kind;
    private final ToDoubleFunction<TrackInfo> numericExtractor;
    private final Function<TrackInfo, List<String>> valuesExtractor;
    private final Function<TrackInfo, String> textExtractor;

    FilterAttribute(String key,
                    Kind kind,
                    ToDoubleFunction<TrackInfo> numericValue,
                    Function<TrackInfo, List<String>> values,
                    Function<TrackInfo, String> text) {
        this.key = key;
        this.kind = kind;
        this.numericExtractor = numericValue;
        this.valuesExtractor = values;
        this.textExtractor = text;
    }

    public String getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    double numericValueOf(TrackInfo track) {
        return numericExtractor.applyAsDouble(track);
    }

    List<String> valuesOf(TrackInfo track) {
        List<String> result = valuesExtractor.apply(track);
        return result == null ? Collections.emptyList() : result;
    }

    String textOf(TrackInfo track) {
        String result = textExtractor.apply(track);
        return result == null ? "" : result;
    }

    public static FilterAttribute fromKey(String key) {
        for (FilterAttribute attribute : values()) {
            if (attribute.key.equals(key)) {
                return attribute;
            }
        }
        throw new FilterRuleException("Unknown filter attribute: " + key);
    }
}
