package org.github.zzf.mqtt.bus.pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.github.zzf.mqtt.bus.exception.InvalidParameterException;
import org.github.zzf.mqtt.bus.exception.InvalidPatternException;
import org.github.zzf.mqtt.bus.exception.MissingParameterException;
import org.github.zzf.mqtt.bus.exception.ParameterCountMismatchException;

/**
 * A compiled, parameterized topic pattern.
 * <pre>
 *     devices/+deviceId/config/#keys
 * </pre>
 * <p>Levels are separated by '/'. A level starting with '+' is a single-level parameter, a level starting
 * with '#' is a multi-level parameter and must be the last level. Every other level is a literal.</p>
 * <p>The pattern subscribes as the MQTT Topic Filter that replaces each parameter with its wildcard:
 * {@code devices/+/config/#}.</p>
 * <p>Instances are immutable.</p>
 */
public final class TopicPattern {

    public static final String LEVEL_SEPARATOR = "/";
    public static final String SINGLE_LEVEL_WILDCARD = "+";
    public static final String MULTI_LEVEL_WILDCARD = "#";
    static final String $ = "$";
    // topic names and topic filters are UTF-8 encoded strings with a 2 bytes length prefix
    static final int MAX_LENGTH = 65535;

    private final String pattern;
    private final List<Segment> segments;
    private final List<String> parameterNames;
    private final boolean multiLevel;
    private final String topicFilter;

    private TopicPattern(String pattern, List<Segment> segments) {
        this.pattern = pattern;
        this.segments = Collections.unmodifiableList(segments);
        List<String> names = new ArrayList<>(segments.size());
        StringBuilder filter = new StringBuilder(pattern.length());
        for (Segment s : segments) {
            if (s.parameter()) {
                names.add(s.name());
            }
            filter.append(s.topicFilterLevel()).append(LEVEL_SEPARATOR);
        }
        this.parameterNames = Collections.unmodifiableList(names);
        this.multiLevel = segments.get(segments.size() - 1).type() == Segment.Type.MULTI_LEVEL;
        this.topicFilter = filter.substring(0, filter.length() - LEVEL_SEPARATOR.length());
    }

    /**
     * compile a pattern string
     *
     * @param pattern the pattern
     * @return the compiled pattern
     * @throws InvalidPatternException if the pattern is malformed
     */
    public static TopicPattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException(pattern, "pattern must not be empty");
        }
        if (pattern.indexOf('\u0000') != -1) {
            throw new InvalidPatternException(pattern, "pattern must not contain U+0000");
        }
        if (pattern.getBytes(UTF_8).length > MAX_LENGTH) {
            throw new InvalidPatternException(pattern, "pattern is longer than " + MAX_LENGTH + " bytes");
        }
        // "a//b" and "/a" keep their empty levels, like MQTT topics do
        String[] levels = pattern.split(LEVEL_SEPARATOR, -1);
        List<Segment> segments = new ArrayList<>(levels.length);
        Set<String> names = new HashSet<>();
        for (int i = 0; i < levels.length; i++) {
            Segment s = parseSegment(pattern, levels[i]);
            if (s.type() == Segment.Type.MULTI_LEVEL && i != levels.length - 1) {
                throw new InvalidPatternException(pattern, "multi-level parameter must be the last level: " + s);
            }
            if (s.parameter() && !names.add(s.name())) {
                throw new InvalidPatternException(pattern, "duplicate parameter name: " + s.name());
            }
            segments.add(s);
        }
        return new TopicPattern(pattern, segments);
    }

    private static Segment parseSegment(String pattern, String level) {
        if (level.startsWith(SINGLE_LEVEL_WILDCARD) || level.startsWith(MULTI_LEVEL_WILDCARD)) {
            String name = level.substring(1);
            if (name.isEmpty()) {
                throw new InvalidPatternException(pattern, "parameter name must not be empty");
            }
            if (containsWildcard(name)) {
                throw new InvalidPatternException(pattern, "parameter name contains a wildcard character: " + name);
            }
            return level.startsWith(SINGLE_LEVEL_WILDCARD) ? Segment.singleLevel(name) : Segment.multiLevel(name);
        }
        if (containsWildcard(level)) {
            // sport/tennis#/ranking or sport+ are not valid
            throw new InvalidPatternException(pattern, "wildcard character inside a literal level: " + level);
        }
        return Segment.literal(level);
    }

    static boolean containsWildcard(String str) {
        return str.contains(SINGLE_LEVEL_WILDCARD) || str.contains(MULTI_LEVEL_WILDCARD);
    }

    /**
     * match a Topic Name
     *
     * @param topic the Topic Name of a received message
     * @return the match, or empty if the topic does not match
     */
    public Optional<TopicMatch> match(String topic) {
        if (topic == null || topic.isEmpty() || containsWildcard(topic)) {
            return Optional.empty();
        }
        // The Server MUST NOT match Topic Filters starting with a wildcard character (# or +) with Topic Names
        // beginning with a $ character
        if (topic.startsWith($) && segments.get(0).parameter()) {
            return Optional.empty();
        }
        String[] levels = topic.split(LEVEL_SEPARATOR, -1);
        // a multi-level parameter needs at least one level
        if (multiLevel ? levels.length < segments.size() : levels.length != segments.size()) {
            return Optional.empty();
        }
        List<Object> captured = new ArrayList<>(parameterNames.size());
        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            switch (s.type()) {
                case LITERAL:
                    if (!s.text().equals(levels[i])) {
                        return Optional.empty();
                    }
                    break;
                case SINGLE_LEVEL:
                    if (levels[i].isEmpty()) {
                        return Optional.empty();
                    }
                    captured.add(levels[i]);
                    break;
                case MULTI_LEVEL:
                    captured.add(List.of(Arrays.copyOfRange(levels, i, levels.length)));
                    break;
                default:
                    throw new IllegalStateException();
            }
        }
        return Optional.of(new TopicMatch(this, topic, captured));
    }

    /**
     * bind every parameter name to its captured value
     *
     * @param match a match produced by this pattern
     * @return name -> String (single-level) or List&lt;String&gt; (multi-level), in pattern order
     */
    public Map<String, Object> extractParameters(TopicMatch match) {
        checkNotNull(match, "match");
        checkArgument(match.pattern() == this, "match was produced by another pattern: %s", match);
        List<Object> captured = match.captured();
        Map<String, Object> params = new LinkedHashMap<>(parameterNames.size() * 2);
        for (int i = 0; i < parameterNames.size(); i++) {
            params.put(parameterNames.get(i), captured.get(i));
        }
        return Collections.unmodifiableMap(params);
    }

    /**
     * build a Topic Name by substituting each parameter with its value
     * <p>A single-level value is converted with {@link String#valueOf(Object)}; a multi-level value must be a
     * {@link Collection} of one or more levels.</p>
     *
     * @param params parameter values by name
     * @return the Topic Name
     * @throws ParameterCountMismatchException if the number of values differs from {@link #parameterCount()}
     * @throws MissingParameterException if a parameter has no value
     * @throws InvalidParameterException if a value can not be placed into a topic
     */
    public String buildTopic(Map<String, ?> params) {
        checkNotNull(params, "params");
        if (params.size() != parameterCount()) {
            throw new ParameterCountMismatchException(parameterCount(), params.size());
        }
        StringBuilder topic = new StringBuilder(pattern.length() * 2);
        for (Segment s : segments) {
            if (s.parameter() && !params.containsKey(s.name())) {
                throw new MissingParameterException(s.name());
            }
            switch (s.type()) {
                case LITERAL:
                    topic.append(s.text());
                    break;
                case SINGLE_LEVEL:
                    topic.append(level(s.name(), params.get(s.name())));
                    break;
                case MULTI_LEVEL:
                    topic.append(levels(s.name(), params.get(s.name())));
                    break;
                default:
                    throw new IllegalStateException();
            }
            topic.append(LEVEL_SEPARATOR);
        }
        return topic.substring(0, topic.length() - LEVEL_SEPARATOR.length());
    }

    private static String level(String name, Object value) {
        if (value == null) {
            throw new InvalidParameterException(name, "value must not be null");
        }
        String level = String.valueOf(value);
        if (level.isEmpty()) {
            throw new InvalidParameterException(name, "value must not be empty");
        }
        if (level.contains(LEVEL_SEPARATOR) || containsWildcard(level)) {
            throw new InvalidParameterException(name, "value must not contain '/', '+' or '#': " + level);
        }
        return level;
    }

    private static String levels(String name, Object value) {
        if (!(value instanceof Collection)) {
            throw new InvalidParameterException(name, "multi-level value must be a list of levels: " + value);
        }
        Collection<?> levels = (Collection<?>) value;
        if (levels.isEmpty()) {
            throw new InvalidParameterException(name, "multi-level value must have at least one level");
        }
        List<String> ret = new ArrayList<>(levels.size());
        for (Object l : levels) {
            ret.add(level(name, l));
        }
        return String.join(LEVEL_SEPARATOR, ret);
    }

    /**
     * @return count of parameter segments; a multi-level parameter counts once
     */
    public int parameterCount() {
        return parameterNames.size();
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public List<Segment> segments() {
        return segments;
    }

    /**
     * @return the MQTT Topic Filter to subscribe to, e.g. {@code devices/+/config/#}
     */
    public String topicFilter() {
        return topicFilter;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return pattern.equals(((TopicPattern) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }

}
