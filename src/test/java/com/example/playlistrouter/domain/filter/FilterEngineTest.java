package com.example.playlistrouter.domain.filter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.playlistrouter.domain.model.TrackInfo;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilterEngineTest {

    @Test
    void noRulesShouldMatchEveryTrack() {
        assertTrue(FilterEngine.compile(null).matches(track("Anything", 0)));
        assertTrue(FilterEngine.compile(new FilterRules()).matches(track("Anything", 0)));
    }

    @Test
    void rangeBoundsShouldBeInclusive() {
        FilterEngine engine = FilterEngine.compile(rules("popularity", new RangePredicate(50.0, 80.0)));

        assertTrue(engine.matches(track("Low edge", 50)));
        assertTrue(engine.matches(track("High edge", 80)));
        assertFalse(engine.matches(track("Below", 49)));
        assertFalse(engine.matches(track("Above", 81)));
    }

    @Test
    void openRangeShouldOnlyCheckPresentBound() {
        FilterEngine engine = FilterEngine.compile(rules("release_year", new RangePredicate(2000.0, null)));
        TrackInfo old = track("Old", 10);
        old.setReleaseYear(1999);
        TrackInfo recent = track("Recent", 10);
        recent.setReleaseYear(2021);

        assertFalse(engine.matches(old));
        assertTrue(engine.matches(recent));
    }

    @Test
    void everyPredicateShouldHoldForAMatch() {
        Map<String, FilterPredicate> predicates = new LinkedHashMap<>();
        predicates.put("popularity", new RangePredicate(50.0, null));
        predicates.put("genres", new SetPredicate(Collections.singletonList("rock"), null));
        FilterEngine engine = FilterEngine.compile(new FilterRules(1, predicates));

        TrackInfo popularRock = track("A", 70);
        popularRock.setAllGenres(Arrays.asList("rock", "indie"));
        TrackInfo popularPop = track("B", 70);
        popularPop.setAllGenres(Collections.singletonList("pop"));
        TrackInfo obscureRock = track("C", 20);
        obscureRock.setAllGenres(Collections.singletonList("rock"));

        assertTrue(engine.matches(popularRock));
        assertFalse(engine.matches(popularPop));
        assertFalse(engine.matches(obscureRock));
    }

    @Test
    void genresShouldCompareIgnoringCase() {
        FilterEngine engine = FilterEngine.compile(rules("genres",
                new SetPredicate(Collections.singletonList(" Indie Rock "), null)));
        TrackInfo track = track("A", 0);
        track.setAllGenres(Collections.singletonList("indie rock"));

        assertTrue(engine.matches(track));
    }

    @Test
    void excludedValueShouldRejectEvenWhenIncluded() {
        FilterEngine engine = FilterEngine.compile(rules("genres",
                new SetPredicate(Collections.singletonList("rock"), Collections.singletonList("metal"))));
        TrackInfo track = track("A", 0);
        track.setAllGenres(Arrays.asList("rock", "metal"));

        assertFalse(engine.matches(track));
    }

    @Test
    void emptyIncludeListShouldMatchNothing() {
        FilterEngine engine = FilterEngine.compile(rules("genres", new SetPredicate(Collections.emptyList(), null)));
        TrackInfo track = track("A", 0);
        track.setAllGenres(Collections.singletonList("rock"));

        assertFalse(engine.matches(track));
    }

    @Test
    void missingIncludeListShouldOnlyApplyExclusions() {
        FilterEngine engine = FilterEngine.compile(rules("genres",
                new SetPredicate(null, Collections.singletonList("country"))));
        TrackInfo untagged = track("A", 0);
        TrackInfo country = track("B", 0);
        country.setAllGenres(Collections.singletonList("country"));

        assertTrue(engine.matches(untagged));
        assertFalse(engine.matches(country));
    }

    @Test
    void explicitShouldMatchOnBooleanText() {
        FilterEngine engine = FilterEngine.compile(rules("explicit",
                new SetPredicate(null, Collections.singletonList("true"))));
        TrackInfo clean = track("Clean", 0);
        TrackInfo explicit = track("Explicit", 0);
        explicit.setExplicit(true);

        assertTrue(engine.matches(clean));
        assertFalse(engine.matches(explicit));
    }

    @Test
    void keywordsShouldMatchSubstrings() {
        FilterEngine trackKeywords = FilterEngine.compile(rules("track_keywords",
                new SetPredicate(Collections.singletonList("remix"), null)));
        FilterEngine artistKeywords = FilterEngine.compile(rules("artist_keywords",
                new SetPredicate(Collections.singletonList("daft"), null)));
        TrackInfo track = track("One More Time (Club REMIX)", 0);
        track.setArtistNames(Arrays.asList("Daft Punk", "Romanthony"));

        assertTrue(trackKeywords.matches(track));
        assertTrue(artistKeywords.matches(track));
        assertFalse(trackKeywords.matches(track("One More Time", 0)));
    }

    @Test
    void unknownAttributeShouldBeRejected() {
        assertThrows(FilterRuleException.class,
                () -> FilterEngine.compile(rules("tempo", new RangePredicate(100.0, 140.0))));
    }

    @Test
    void predicateTypeShouldFitAttribute() {
        assertThrows(FilterRuleException.class,
                () -> FilterEngine.compile(rules("genres", new RangePredicate(1.0, 2.0))));
        assertThrows(FilterRuleException.class,
                () -> FilterEngine.compile(rules("popularity", new SetPredicate(Collections.singletonList("50"), null))));
    }

    @Test
    void invertedRangeShouldBeRejected() {
        assertThrows(FilterRuleException.class,
                () -> FilterEngine.compile(rules("duration_ms", new RangePredicate(300000.0, 100000.0))));
    }

    @Test
    void unsupportedVersionShouldBeRejected() {
        FilterRules rules = rules("popularity", new RangePredicate(1.0, 2.0));
        rules.setVersion(2);

        assertThrows(FilterRuleException.class, () -> FilterEngine.compile(rules));
    }

    @Test
    void unsupportedVersionShouldBeRejectedEvenWithoutPredicates() {
        FilterRules rules = new FilterRules();
        rules.setVersion(99);

        assertThrows(FilterRuleException.class, () -> FilterEngine.compile(rules));
    }

    private FilterRules rules(String attribute, FilterPredicate predicate) {
        Map<String, FilterPredicate> predicates = new LinkedHashMap<>();
        predicates.put(attribute, predicate);
        return new FilterRules(FilterRules.CURRENT_VERSION, predicates);
    }

    private TrackInfo track(String name, int popularity) {
        TrackInfo track = new TrackInfo();
        track.setId(name);
        track.setName(name);
        track.setUri("spotify:track:" + name);
        track.setPopularity(popularity);
        return track;
    }
}
