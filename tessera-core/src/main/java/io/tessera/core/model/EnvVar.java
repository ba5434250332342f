package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;

/// An environment variable written to the project's environment file.
///
/// @param key variable name, not blank
/// @param value variable value without line breaks, rendered as an empty string when null
public record EnvVar(String key, String value) implements Entity<String, EnvVar>, Renderable {

    public EnvVar {
        ValidationException.requireText(key, "EnvVar key");
        if (key.contains("=") || hasLineBreak(key)) {
            throw new ValidationException("EnvVar key must not contain '=' or newlines: " + key);
        }
        if (value != null && hasLineBreak(value)) {
            throw new ValidationException("EnvVar value must not contain newlines: " + key);
        }
    }

    private static boolean hasLineBreak(String text) {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    @Override
    public String identityKey() {
        return key;
    }

    @Override
    public EnvVar merge(EnvVar other) {
        return other;
    }

    /// Renders this variable as a `KEY=VALUE` line.
    @Override
    public String render() {
        return key + "=" + (value == null ? "" : value);
    }
}
