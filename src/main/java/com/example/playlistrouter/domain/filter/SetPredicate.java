package com.example.playlistrouter.domain.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusion/exclusion lists. A null {@code include} imposes no constraint, an empty one
 * matches nothing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SetPredicate implements FilterPredicate {

    private List<String> include;
    private List<String> exclude;
}
