package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// A named, capacity-limited execution resource referenced by tasks.
///
/// Pools are the one keyed entity kind that accumulates on collision: the
/// default {@link #merge(Pool)} sums slot counts so that several rule matches
/// requesting capacity from the same pool add up.
///
/// @param name pool name, not blank
/// @param slots available slots, not negative
/// @param description free-text description, never null (may be empty)
public record Pool(String name, int slots, String description)
        implements Entity<String, Pool>, SettingsEntry {

    public Pool {
        ValidationException.requireText(name, "Pool name");
        if (slots < 0) {
            throw new ValidationException("Pool slots must not be negative: " + slots);
        }
        description = description == null ? "" : description;
    }

    public Pool(String name, int slots) {
        this(name, slots, "");
    }

    @Override
    public String identityKey() {
        return name;
    }

    /// Adds the slots of `other` to this pool.
    ///
    /// Merging with an equal pool returns this pool unchanged. The description
    /// of this pool is kept unless it is blank.
    ///
    /// @param other pool with the same name, not null
    /// @return combined pool, never null
    @Override
    public Pool merge(Pool other) {
        return PoolMergeStrategy.SUM.merge(this, other);
    }

    @Override
    public Map<String, Object> toSettings() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("pool_name", name);
        record.put("pool_slot", slots);
        record.put("pool_description", description);
        return Collections.unmodifiableMap(record);
    }
}
