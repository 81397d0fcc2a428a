package com.example.playlistrouter.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.playlistrouter.domain.filter.FilterRuleException;
import com.example.playlistrouter.domain.filter.FilterRules;
import com.example.playlistrouter.domain.filter.RangePredicate;
import com.example.playlistrouter.domain.filter.SetPredicate;
import com.example.playlistrouter.domain.model.TrackInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class FilterRulesCodecTest {

    private final FilterRulesCodec codec = new FilterRulesCodec(new ObjectMapper());

    @Test
    void parseShouldReadTaggedPredicates() {
        FilterRules rules = codec.parse("{\"version\":1,\"rules\":{"
                + "\"popularity\":{\"type\":\"range\",\"min\":50,\"max\":100},"
                + "\"genres\":{\"type\":\"set\",\"include\":[\"rock\"]}}}");

        assertEquals(1, rules.getVersion());
        RangePredicate popularity = (RangePredicate) rules.getRules().get("popularity");
        assertEquals(50.0, popularity.getMin());
        assertEquals(100.0, popularity.getMax());
        SetPredicate genres = (SetPredicate) rules.getRules().get("genres");
        assertEquals(Collections.singletonList("rock"), genres.getInclude());
        assertNull(genres.getExclude());
    }

    @Test
    void blankColumnShouldMeanNoRules() {
        assertNull(codec.parse(null));
        assertNull(codec.parse("  "));
        assertTrue(codec.compile("").matches(new TrackInfo()));
    }

    @Test
    void parseShouldRejectMalformedDocuments() {
        assertThrows(FilterRuleException.class, () -> codec.parse("{not json"));
        assertThrows(FilterRuleException.class,
                () -> codec.parse("{\"version\":1,\"rules\":{\"popularity\":{\"type\":\"between\",\"min\":1}}}"));
        assertThrows(FilterRuleException.class,
                () -> codec.parse("{\"version\":1,\"rules\":{},\"owner\":\"me\"}"));
    }

    @Test
    void compileShouldRejectUnknownAttribute() {
        assertThrows(FilterRuleException.class,
                () -> codec.compile("{\"version\":1,\"rules\":{\"mood\":{\"type\":\"set\",\"include\":[\"sad\"]}}}"));
    }

    @Test
    void serializeShouldDefaultVersionAndKeepTypeTag() {
        FilterRules rules = new FilterRules();
        rules.setVersion(null);
        rules.getRules().put("popularity", new RangePredicate(60.0, null));

        String json = codec.serialize(rules);

        assertTrue(json.contains("\"version\":1"));
        assertTrue(json.contains("\"type\":\"range\""));
        assertFalse(json.contains("\"max\""));
        RangePredicate reread = (RangePredicate) codec.parse(json).getRules().get("popularity");
        assertEquals(60.0, reread.getMin());
    }

    @Test
    void serializeShouldValidateBeforeWriting() {
        FilterRules rules = new FilterRules();
        rules.getRules().put("popularity", new RangePredicate(90.0, 10.0));

        assertThrows(FilterRuleException.class, () -> codec.serialize(rules));
        assertNull(codec.serialize(null));
    }
}
