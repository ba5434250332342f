package io.tessera.core.model;

import java.util.Map;

/// An entity rendered as one record of the settings document.
///
/// Pools, variables and connections each contribute a record to their named
/// section. Records preserve key order so the document is reproducible.
public interface SettingsEntry {

    /// Returns this entity as an ordered settings record.
    ///
    /// @return unmodifiable, insertion-ordered record, never null
    Map<String, Object> toSettings();
}
