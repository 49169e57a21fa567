package com.scenariomock.core.matching;

import com.scenariomock.core.error.BackendException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches request URLs against path templates.
 *
 * <p>Template syntax:
 * <ul>
 *   <li>{@code {name}} (any identifier) matches exactly one path segment ({@code [^/]+})</li>
 *   <li>{@code {*}} matches anything, including slashes ({@code .*})</li>
 *   <li>all other text is a regular expression; the whole template is anchored</li>
 * </ul>
 */
public final class PathMatcher {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\*|[A-Za-z_][A-Za-z0-9_]*)}");
    private static final String SEGMENT_REGEX = "[^/]+";
    private static final String WILDCARD_REGEX = ".*";

    private static final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    private PathMatcher() {
        // utility class
    }

    /**
     * Tests whether the path of {@code url} satisfies {@code pathPattern}.
     *
     * @throws BackendException of kind CONFIGURATION if the template does not compile
     */
    public static boolean matches(String pathPattern, String url) throws BackendException {
        return compile(pathPattern).matcher(extractPath(url)).matches();
    }

    /**
     * Compiles a template into an anchored regular expression, caching the result.
     *
     * @throws BackendException of kind CONFIGURATION if the template does not compile
     */
    public static Pattern compile(String pathPattern) throws BackendException {
        if (pathPattern == null || pathPattern.isEmpty()) {
            throw BackendException.configuration("Path pattern must not be empty");
        }
        Pattern cached = compiled.get(pathPattern);
        if (cached != null) {
            return cached;
        }
        String regex = "^" + toRegex(pathPattern) + "$";
        try {
            Pattern pattern = Pattern.compile(regex);
            compiled.putIfAbsent(pathPattern, pattern);
            return pattern;
        } catch (PatternSyntaxException e) {
            throw BackendException.configuration(
                    "Invalid path pattern '" + pathPattern + "': " + e.getDescription(), e);
        }
    }

    /**
     * Expands placeholders without anchoring.
     */
    static String toRegex(String pathPattern) {
        Matcher matcher = PLACEHOLDER.matcher(pathPattern);
        StringBuilder regex = new StringBuilder();
        while (matcher.find()) {
            String replacement = "*".equals(matcher.group(1)) ? WILDCARD_REGEX : SEGMENT_REGEX;
            matcher.appendReplacement(regex, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(regex);
        return regex.toString();
    }

    /**
     * Reduces a URL to its path: drops query string, fragment, scheme and host.
     * A URL without a path yields {@code "/"}.
     */
    public static String extractPath(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        if (path.startsWith("http://")) {
            path = path.substring("http://".length());
        } else if (path.startsWith("https://")) {
            path = path.substring("https://".length());
        }
        int slash = path.indexOf('/');
        return slash >= 0 ? path.substring(slash) : "/";
    }
}
