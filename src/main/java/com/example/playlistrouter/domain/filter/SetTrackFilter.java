package com.example.playlistrouter.domain.filter;

import com.example.playlistrouter.domain.model.TrackInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive set matching. {@code VALUES} attributes compare whole values, {@code TEXT}
 * attributes look for keywords inside the text.
 */
class SetTrackFilter implements TrackFilter {

    private final FilterAttribute attribute;
    private final List<String> include;
    private final List<String> exclude;

    SetTrackFilter(FilterAttribute attribute, SetPredicate predicate) {
        this.attribute = attribute;
        this.include = predicate.getInclude() == null ? null : normalize(predicate.getInclude());
        this.exclude = predicate.getExclude() == null ? Collections.emptyList() : normalize(predicate.getExclude());
    }

    @Override
    public boolean matches(TrackInfo track) {
        if (attribute.getKind() == FilterAttribute.Kind.TEXT) {
            return matchesText(attribute.textOf(track).toLowerCase(Locale.ROOT));
        }
        return matchesValues(normalize(attribute.valuesOf(track)));
    }

    private boolean matchesValues(List<String> values) {
        for (String excluded : exclude) {
            if (values.contains(excluded)) {
                return false;
            }
        }
        if (include == null) {
            return true;
        }
        for (String included : include) {
            if (values.contains(included)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesText(String text) {
        for (String excluded : exclude) {
            if (text.contains(excluded)) {
                return false;
            }
        }
        if (include == null) {
            return true;
        }
        for (String included : include) {
            if (text.contains(included)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> raw) {
        List<String> normalized = new ArrayList<>(raw.size());
        for (String value : raw) {
            if (value != null) {
                normalized.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
