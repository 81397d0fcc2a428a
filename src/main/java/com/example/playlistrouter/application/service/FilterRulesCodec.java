package com.example.playlistrouter.application.service;

import com.example.playlistrouter.domain.filter.FilterEngine;
import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.filter.FilterRules;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads and writes the JSON stored in {@code child_playlist.filter_rules}. Parsing is strict:
 * unknown properties, unknown predicate types and unknown attributes are all errors.
 */
@Component
public class FilterRulesCodec {

    private final ObjectMapper objectMapper;
    private final ObjectReader rulesReader;

    public FilterRulesCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.rulesReader = objectMapper.readerFor(FilterRules.class)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Returns null for a blank column, meaning the child takes every track. */
    public FilterRules parse(String json) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return rulesReader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new FilterRuleException("Unparsable filter rules: " + e.getOriginalMessage(), e);
        }
    }

    public FilterEngine compile(String json) {
        return FilterEngine.compile(parse(json));
    }

    /** Validates the rules and returns their JSON form; null rules serialize to null. */
    public String serialize(FilterRules rules) {
        if (rules == null) {
            return null;
        }
        if (rules.getVersion() == null) {
            rules.setVersion(FilterRules.CURRENT_VERSION);
        }
        FilterEngine.compile(rules);
        try {
            return objectMapper.writeValueAsString(rules);
        } catch (JsonProcessingException e) {
            throw new FilterRuleException("Failed to serialize filter rules", e);
        }
    }
}
