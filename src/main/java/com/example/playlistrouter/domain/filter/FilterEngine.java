package com.example.playlistrouter.domain.filter;

import com.example.playlistrouter.domain.model.TrackInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiled form of a {@link FilterRules} document. A track matches when every compiled
 * filter matches; an engine without filters matches everything.
 */
public final class FilterEngine {

    private static final FilterEngine MATCH_ALL = new FilterEngine(Collections.emptyList());

    private final List<TrackFilter> filters;

    private FilterEngine(List<TrackFilter> filters) {
        this.filters = filters;
    }

    public static FilterEngine matchAll() {
        return MATCH_ALL;
    }

    /**
     * @throws FilterRuleException when the rules reference an unknown attribute, use a
     *                             predicate type the attribute does not support, or carry an
     *                             inverted range
     */
    public static FilterEngine compile(FilterRules rules) {
        if (rules == null) {
            return MATCH_ALL;
        }
        if (rules.getVersion() == null || rules.getVersion() != FilterRules.CURRENT_VERSION) {
            throw new FilterRuleException("Unsupported filter rules version: " + rules.getVersion());
        }
        if (rules.getRules() == null || rules.getRules().isEmpty()) {
            return MATCH_ALL;
        }
        List<TrackFilter> filters = new ArrayList<>(rules.getRules().size());
        for (Map.Entry<String, FilterPredicate> entry : rules.getRules().entrySet()) {
            FilterAttribute attribute = FilterAttribute.fromKey(entry.getKey());
            FilterPredicate predicate = entry.getValue();
            if (predicate == null) {
                continue;
            }
            filters.add(toFilter(attribute, predicate));
        }
        return new FilterEngine(filters);
    }

    public boolean matches(TrackInfo track) {
        for (TrackFilter filter : filters) {
            if (!filter.matches(track)) {
                return false;
            }
        }
        return true;
    }

    private static TrackFilter toFilter(FilterAttribute attribute, FilterPredicate predicate) {
        if (predicate instanceof RangePredicate) {
            if (attribute.getKind() != FilterAttribute.Kind.NUMERIC) {
                throw new FilterRuleException("Attribute " + attribute.getKey() + " does not accept a range filter");
            }
            RangePredicate range = (RangePredicate) predicate;
            if (range.getMin() != null && range.getMax() != null && range.getMin() > range.getMax()) {
                throw new FilterRuleException("Invalid range for " + attribute.getKey()
                        + ": min " + range.getMin() + " > max " + range.getMax());
            }
            return new RangeTrackFilter(attribute, range);
        }
        if (predicate instanceof SetPredicate) {
            if (attribute.getKind() == FilterAttribute.Kind.NUMERIC) {
                throw new FilterRuleException("Attribute " + attribute.getKey() + " does not accept a set filter");
            }
            return new SetTrackFilter(attribute, (SetPredicate) predicate);
        }
        throw new FilterRuleException("Unsupported predicate for " + attribute.getKey() + ": "
                + predicate.getClass().getSimpleName());
    }
}
