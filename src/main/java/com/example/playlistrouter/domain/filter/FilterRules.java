package com.example.playlistrouter.domain.filter;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored filter document of a child playlist: predicates keyed by attribute name, e.g.
 * <pre>
 * {"version":1,"rules":{"popularity":{"type":"range","min":50,"max":100},
 *                       "genres":{"type":"set","include":["rock"]}}}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterRules {

    public static final int CURRENT_VERSION = 1;

    private Integer version = CURRENT_VERSION;

    private Map<String, FilterPredicate> rules = new LinkedHashMap<>();
}
