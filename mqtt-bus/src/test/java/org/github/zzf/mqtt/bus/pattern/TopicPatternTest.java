package org.github.zzf.mqtt.bus.pattern;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.github.zzf.mqtt.bus.exception.InvalidParameterException;
import org.github.zzf.mqtt.bus.exception.InvalidPatternException;
import org.github.zzf.mqtt.bus.exception.MissingParameterException;
import org.github.zzf.mqtt.bus.exception.ParameterCountMismatchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class TopicPatternTest {

    @ParameterizedTest(name = "{1} has {0} parameters")
    @CsvFileSource(resources = {"/pattern/valid_pattern.csv"})
    void givenValidPattern_whenCompile_thenParameterCountAndTopicFilter(int count, String pattern,
        String topicFilter) {
        TopicPattern p = TopicPattern.compile(pattern);
        then(p.parameterCount()).isEqualTo(count);
        then(p.parameterNames()).hasSize(count);
        then(p.topicFilter()).isEqualTo(topicFilter);
        then(p.pattern()).isEqualTo(pattern);
    }

    @ParameterizedTest(name = "{1}: {0}")
    @CsvFileSource(resources = {"/pattern/invalid_pattern.csv"})
    void givenInvalidPattern_whenCompile_thenException(String reason, String pattern) {
        thenThrownBy(() -> TopicPattern.compile(pattern))
            .isInstanceOf(InvalidPatternException.class)
            .extracting(e -> ((InvalidPatternException) e).pattern())
            .isEqualTo(pattern);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void givenNullOrEmptyPattern_whenCompile_thenException(String pattern) {
        thenThrownBy(() -> TopicPattern.compile(pattern)).isInstanceOf(InvalidPatternException.class);
    }

    @Test
    void givenPatternWithNullCharacter_whenCompile_thenException() {
        thenThrownBy(() -> TopicPattern.compile("a/\u0000/b")).isInstanceOf(InvalidPatternException.class);
    }

    @Test
    void givenTooLongPattern_whenCompile_thenException() {
        String pattern = "a".repeat(TopicPattern.MAX_LENGTH + 1);
        thenThrownBy(() -> TopicPattern.compile(pattern)).isInstanceOf(InvalidPatternException.class);
        then(TopicPattern.compile("a".repeat(TopicPattern.MAX_LENGTH)).parameterCount()).isZero();
    }

    @Test
    void givenPattern_whenCompile_thenSegments() {
        TopicPattern p = TopicPattern.compile("devices/+deviceId/config/#keys");
        then(p.segments()).extracting(Segment::type).containsExactly(
            Segment.Type.LITERAL, Segment.Type.SINGLE_LEVEL, Segment.Type.LITERAL, Segment.Type.MULTI_LEVEL);
        then(p.segments().get(0).text()).isEqualTo("devices");
        then(p.segments().get(1).name()).isEqualTo("deviceId");
        then(p.segments().get(3).name()).isEqualTo("keys");
        then(p.parameterNames()).containsExactly("deviceId", "keys");
        thenThrownBy(() -> p.segments().get(0).name()).isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest(name = "{0} match {1}")
    @CsvFileSource(resources = {"/pattern/topic_match.csv"})
    void givenTopic_whenMatchPattern_thenMatch(String topic, String pattern) {
        TopicPattern p = TopicPattern.compile(pattern);
        Optional<TopicMatch> match = p.match(topic);
        then(match).isPresent();
        then(match.get().topic()).isEqualTo(topic);
        then(match.get().pattern()).isSameAs(p);
    }

    @ParameterizedTest(name = "{0} will not match {1}")
    @CsvFileSource(resources = {"/pattern/topic_not_match.csv"})
    void givenTopic_whenMatchPattern_thenNotMatch(String topic, String pattern) {
        then(TopicPattern.compile(pattern).match(topic)).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void givenNullOrEmptyTopic_whenMatch_thenNotMatch(String topic) {
        then(TopicPattern.compile("#all").match(topic)).isEmpty();
    }

    @Test
    void givenMatchedTopic_whenExtractParameters_thenNamedValues() {
        TopicPattern p = TopicPattern.compile("devices/+deviceId/config/#keys");
        Map<String, Object> params = p.extractParameters(p.match("devices/d1/config/http/host").get());
        then(params).containsExactly(
            Map.entry("deviceId", "d1"),
            Map.entry("keys", List.of("http", "host")));
    }

    @Test
    void givenMultiLevelParameter_whenMatchOneLevel_thenListOfOne() {
        TopicPattern p = TopicPattern.compile("sport/#rest");
        then(p.extractParameters(p.match("sport/tennis").get())).containsEntry("rest", List.of("tennis"));
        // an empty trailing level is a level too
        then(p.extractParameters(p.match("sport/").get())).containsEntry("rest", List.of(""));
    }

    @Test
    void givenMatchOfAnotherPattern_whenExtractParameters_thenException() {
        TopicPattern p1 = TopicPattern.compile("a/+x");
        TopicPattern p2 = TopicPattern.compile("a/+x");
        TopicMatch match = p1.match("a/b").get();
        thenThrownBy(() -> p2.extractParameters(match)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void givenParams_whenBuildTopic_thenTopic() {
        TopicPattern p = TopicPattern.compile("devices/+deviceId/config/#keys");
        Map<String, Object> params = new HashMap<>();
        params.put("deviceId", "d1");
        params.put("keys", List.of("http", "host"));
        then(p.buildTopic(params)).isEqualTo("devices/d1/config/http/host");
    }

    @Test
    void givenNonStringValue_whenBuildTopic_thenConvertedToString() {
        TopicPattern p = TopicPattern.compile("room/+floor/+number");
        then(p.buildTopic(Map.of("floor", 3, "number", 301L))).isEqualTo("room/3/301");
    }

    @Test
    void givenNoParameter_whenBuildTopic_thenPatternItself() {
        then(TopicPattern.compile("a/b/c").buildTopic(Map.of())).isEqualTo("a/b/c");
    }

    @Test
    void givenBuiltTopic_whenMatch_thenSameParams() {
        TopicPattern p = TopicPattern.compile("+tenant/devices/+deviceId/#path");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tenant", "t1");
        params.put("deviceId", "d1");
        params.put("path", List.of("a", "b", "c"));
        String topic = p.buildTopic(params);
        then(topic).isEqualTo("t1/devices/d1/a/b/c");
        then(p.extractParameters(p.match(topic).get())).isEqualTo(params);
    }

    @Test
    void givenWrongParameterCount_whenBuildTopic_thenException() {
        TopicPattern p = TopicPattern.compile("a/+x/+y");
        thenThrownBy(() -> p.buildTopic(Map.of("x", "1")))
            .isInstanceOf(ParameterCountMismatchException.class)
            .hasMessage("wrong parameter count, got 1, expected 2");
        thenThrownBy(() -> p.buildTopic(Map.of("x", "1", "y", "2", "z", "3")))
            .isInstanceOf(ParameterCountMismatchException.class);
    }

    @Test
    void givenMissingParameter_whenBuildTopic_thenException() {
        TopicPattern p = TopicPattern.compile("a/+x/+y");
        thenThrownBy(() -> p.buildTopic(Map.of("x", "1", "z", "2")))
            .isInstanceOf(MissingParameterException.class)
            .extracting(e -> ((MissingParameterException) e).name())
            .isEqualTo("y");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a/b", "a+", "#"})
    void givenIllegalSingleLevelValue_whenBuildTopic_thenException(String value) {
        TopicPattern p = TopicPattern.compile("a/+x");
        thenThrownBy(() -> p.buildTopic(Map.of("x", value))).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void givenIllegalMultiLevelValue_whenBuildTopic_thenException() {
        TopicPattern p = TopicPattern.compile("a/#x");
        thenThrownBy(() -> p.buildTopic(Map.of("x", List.of()))).isInstanceOf(InvalidParameterException.class);
        thenThrownBy(() -> p.buildTopic(Map.of("x", "b/c"))).isInstanceOf(InvalidParameterException.class);
        thenThrownBy(() -> p.buildTopic(Map.of("x", List.of("b", "")))).isInstanceOf(InvalidParameterException.class);
        thenThrownBy(() -> p.buildTopic(Map.of("x", List.of("b/c")))).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void givenNullValue_whenBuildTopic_thenException() {
        TopicPattern p = TopicPattern.compile("a/+x");
        Map<String, Object> params = new HashMap<>();
        params.put("x", null);
        thenThrownBy(() -> p.buildTopic(params)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void givenSamePatternString_whenCompileTwice_thenEqual() {
        then(TopicPattern.compile("a/+x")).isEqualTo(TopicPattern.compile("a/+x"))
            .hasSameHashCodeAs(TopicPattern.compile("a/+x"))
            .isNotEqualTo(TopicPattern.compile("a/+y"));
    }

}
