package io.tessera.core.workflow;

import io.tessera.core.model.Renderable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/// Formatting helpers for the generated workflow source.
///
/// Values are rendered as literals of the target runtime's source language:
/// strings are double-quoted and escaped, booleans become `True`/`False`,
/// null becomes `None`, collections become lists and maps become dicts.
/// {@link Renderable} values (callbacks, schedules) contribute their own
/// rendered form.
public final class SourceLiterals {

    public static final String INDENT = "    ";

    private SourceLiterals() {}

    /// Renders a single value as a source literal.
    ///
    /// @param value the value, may be null
    /// @return literal text, never null
    public static String literal(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Renderable renderable) {
            return renderable.render();
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return quote(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            map.forEach((k, v) -> joiner.add(quote(String.valueOf(k)) + ": " + literal(v)));
            return joiner.toString();
        }
        if (value instanceof Iterable<?> iterable) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            iterable.forEach(item -> joiner.add(literal(item)));
            return joiner.toString();
        }
        return quote(value.toString());
    }

    /// Renders `key=value` pairs separated by commas.
    ///
    /// @param arguments ordered keyword arguments, not null
    /// @return joined keyword arguments, empty when `arguments` is empty
    public static String keywordArguments(Map<String, ?> arguments) {
        List<String> parts = new ArrayList<>();
        arguments.forEach((k, v) -> parts.add(k + "=" + literal(v)));
        return String.join(", ", parts);
    }

    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /// Turns an identifier such as a task ID into a valid variable name.
    ///
    /// @param id raw identifier, not null
    /// @return lower-case name made of letters, digits and underscores
    public static String identifier(String id) {
        StringBuilder sb = new StringBuilder();
        for (char c : id.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) ? Character.toLowerCase(c) : '_');
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /// Prefixes every non-empty line of `text` with one indentation level.
    public static String indent(String text) {
        StringJoiner joiner = new StringJoiner("\n");
        for (String line : text.split("\n", -1)) {
            joiner.add(line.isEmpty() ? line : INDENT + line);
        }
        return joiner.toString();
    }
}
