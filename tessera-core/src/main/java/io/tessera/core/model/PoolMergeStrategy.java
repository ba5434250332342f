package io.tessera.core.model;

/// Combinators for two pools colliding on the same name.
///
/// Every strategy returns the existing pool when both pools are equal, so adding
/// the same pool twice never changes the project. The existing description is
/// kept unless blank.
public enum PoolMergeStrategy {
    /// Slot counts are added together.
    SUM {
        @Override
        int slots(int existing, int incoming) {
            return Math.addExact(existing, incoming);
        }
    },
    /// The larger slot count wins.
    MAX {
        @Override
        int slots(int existing, int incoming) {
            return Math.max(existing, incoming);
        }
    },
    /// The incoming slot count replaces the existing one.
    REPLACE {
        @Override
        int slots(int existing, int incoming) {
            return incoming;
        }
    };

    abstract int slots(int existing, int incoming);

    /// Combines `incoming` into `existing`.
    ///
    /// @param existing pool already held by the project, not null
    /// @param incoming pool being added, not null, same name as `existing`
    /// @return combined pool, never null
    /// @throws IllegalArgumentException if the pool names differ
    public Pool merge(Pool existing, Pool incoming) {
        if (!existing.name().equals(incoming.name())) {
            throw new IllegalArgumentException(
                    "Cannot merge pool '" + incoming.name() + "' into '" + existing.name() + "'");
        }
        if (existing.equals(incoming)) {
            return existing;
        }
        String description =
                existing.description().isBlank() ? incoming.description() : existing.description();
        return new Pool(existing.name(), slots(existing.slots(), incoming.slots()), description);
    }
}
