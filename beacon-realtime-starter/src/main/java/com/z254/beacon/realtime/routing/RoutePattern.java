package com.z254.beacon.realtime.routing;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A route template such as {@code /tickets/:id/comments}, compiled into a list of
 * literal and capture segments.
 *
 * <p>Literal segments must match exactly. {@code :name} segments match any single
 * non-empty segment, which is percent-decoded and captured. One trailing slash on the
 * path is tolerated.
 */
public final class RoutePattern {

    private static final Pattern PARAM_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String source;
    private final List<Segment> segments;

    private RoutePattern(String source, List<Segment> segments) {
        this.source = source;
        this.segments = segments;
    }

    public static RoutePattern compile(String pattern) {
        if (pattern == null || !pattern.startsWith("/")) {
            throw new IllegalArgumentException("Route pattern must start with '/': " + pattern);
        }
        List<Segment> segments = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (String part : split(pattern)) {
            if (part.startsWith(":")) {
                String name = part.substring(1);
                if (!PARAM_NAME.matcher(name).matches()) {
                    throw new IllegalArgumentException("Invalid parameter name '" + name + "' in " + pattern);
                }
                if (!names.add(name)) {
                    throw new IllegalArgumentException("Duplicate parameter '" + name + "' in " + pattern);
                }
                segments.add(new Segment(name, true));
            } else {
                segments.add(new Segment(part, false));
            }
        }
        return new RoutePattern(pattern, Collections.unmodifiableList(segments));
    }

    /**
     * Match a request path (without query string).
     *
     * @return the captured parameters, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        List<String> parts = split(path);
        if (parts.size() != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            String part = parts.get(i);
            if (segment.capture()) {
                if (part.isEmpty()) {
                    return Optional.empty();
                }
                try {
                    params.put(segment.value(), UriUtils.decode(part, StandardCharsets.UTF_8));
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
            } else if (!segment.value().equals(part)) {
                return Optional.empty();
            }
        }
        return Optional.of(params);
    }

    public String getSource() {
        return source;
    }

    public List<String> getParameterNames() {
        return segments.stream()
                .filter(Segment::capture)
                .map(Segment::value)
                .toList();
    }

    private static List<String> split(String path) {
        if (path.equals("/")) {
            return List.of();
        }
        // Only one trailing slash is dropped; empty segments are kept so "//" never matches.
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        String[] raw = trimmed.substring(1).split("/", -1);
        return List.of(raw);
    }

    @Override
    public String toString() {
        return source;
    }

    private record Segment(String value, boolean capture) {
    }
}
