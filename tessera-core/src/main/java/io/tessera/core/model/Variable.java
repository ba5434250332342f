package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// A runtime variable declared in the settings document.
///
/// Overwrite-on-collision: a variable added under an existing key replaces the
/// previous one entirely.
///
/// @param key variable name, not blank
/// @param value variable value, may be null
public record Variable(String key, String value)
        implements Entity<String, Variable>, SettingsEntry {

    public Variable {
        ValidationException.requireText(key, "Variable key");
    }

    @Override
    public String identityKey() {
        return key;
    }

    @Override
    public Variable merge(Variable other) {
        return other;
    }

    @Override
    public Map<String, Object> toSettings() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("variable_name", key);
        record.put("variable_value", value);
        return Collections.unmodifiableMap(record);
    }
}
