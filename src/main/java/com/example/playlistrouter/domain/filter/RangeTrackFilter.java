package com.example.playlistrouter.domain.filter;

import com.example.playlistrouter.domain.model.TrackInfo;

class RangeTrackFilter implements TrackFilter {

    private final FilterAttribute attribute;
    private final RangePredicate predicate;

    RangeTrackFilter(FilterAttribute attribute, RangePredicate predicate) {
        this.attribute = attribute;
        this.predicate = predicate;
    }

    @Override
    public boolean matches(TrackInfo track) {
        return predicate.matches(attribute.numericValueOf(track));
    }
}
