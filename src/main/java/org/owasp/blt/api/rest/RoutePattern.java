package org.owasp.blt.api.rest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled form of a route template such as {@code /users/{id}/posts/{post_id}}.
 *
 * Each {@code {name}} slot matches one path segment made of word characters and hyphens.
 * Everything else in the template is literal and must match verbatim. Instances are immutable.
 */
public final class RoutePattern {

    private static final Pattern SLOT_NAME = Pattern.compile("\\w+");
    private static final String SLOT_REGEX = "([\\w\\-]+)";

    private final String template;
    private final Pattern regex;
    private final List<String> paramNames;
    private final SpecificityKey specificity;

    private RoutePattern(String template, Pattern regex, List<String> paramNames, SpecificityKey specificity) {
        this.template = template;
        this.regex = regex;
        this.paramNames = paramNames;
        this.specificity = specificity;
    }

    /**
     * Compile a route template.
     *
     * @throws PatternException if braces are unbalanced, a slot name is empty or not an identifier,
     *                          or the same slot name appears twice
     */
    public static RoutePattern compile(String template) {
        if (template == null) {
            throw new PatternException("Route template must not be null");
        }

        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        Set<String> names = new LinkedHashSet<>();
        int literalChars = 0;

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                throw new PatternException("Unbalanced '}' at index " + i + " in route template: " + template);
            }
            if (c != '{') {
                literal.append(c);
                literalChars++;
                i++;
                continue;
            }

            int close = template.indexOf('}', i + 1);
            int nextOpen = template.indexOf('{', i + 1);
            if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                throw new PatternException("Unbalanced '{' at index " + i + " in route template: " + template);
            }
            String name = template.substring(i + 1, close);
            if (!SLOT_NAME.matcher(name).matches()) {
                throw new PatternException("Invalid parameter name '" + name + "' in route template: " + template);
            }
            if (!names.add(name)) {
                throw new PatternException("Duplicate parameter name '" + name + "' in route template: " + template);
            }

            flushLiteral(regex, literal);
            regex.append(SLOT_REGEX);
            i = close + 1;
        }
        flushLiteral(regex, literal);
        regex.append('$');

        SpecificityKey key = new SpecificityKey(names.size(), literalChars, countSegments(template));
        return new RoutePattern(template, Pattern.compile(regex.toString()),
                Collections.unmodifiableList(new ArrayList<>(names)), key);
    }

    /**
     * Match a concrete path end-to-end.
     *
     * @return captured parameters by name (empty for a pure-literal template), or {@code null} on no match
     */
    public Map<String, String> match(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = regex.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        Map<String, String> params = new HashMap<>();
        for (int i = 0; i < paramNames.size(); i++) {
            params.put(paramNames.get(i), matcher.group(i + 1));
        }
        return params;
    }

    public String getTemplate() {
        return template;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public SpecificityKey getSpecificity() {
        return specificity;
    }

    @Override
    public String toString() {
        return template;
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static int countSegments(String template) {
        int segments = 0;
        for (String part : template.split("/")) {
            if (!part.isEmpty()) {
                segments++;
            }
        }
        return segments;
    }
}
