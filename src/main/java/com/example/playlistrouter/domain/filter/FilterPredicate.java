package com.example.playlistrouter.domain.filter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RangePredicate.class, name = "range"),
        @JsonSubTypes.Type(value = SetPredicate.class, name = "set")
})
public interface FilterPredicate {
}
