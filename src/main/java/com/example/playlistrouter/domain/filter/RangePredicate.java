package com.example.playlistrouter.domain.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Inclusive bounds; a null bound is unbounded. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RangePredicate implements FilterPredicate {

    private Double min;
    private Double max;

    public boolean matches(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
