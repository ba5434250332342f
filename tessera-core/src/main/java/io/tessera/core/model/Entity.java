package io.tessera.core.model;

/// Contract shared by every entity kind a project aggregates.
///
/// An entity exposes a stable identity key and knows how to combine itself with
/// another instance carrying the same key. Structural equality is provided by
/// `equals`/`hashCode`.
///
/// @param <K> identity key type
/// @param <E> the implementing entity type
public interface Entity<K, E extends Entity<K, E>> {

    /// Returns the key under which the project stores this entity.
    ///
    /// @return identity key, never null
    K identityKey();

    /// Combines this entity with an incoming entity of the same identity.
    ///
    /// Overwrite-kind entities return `other`; accumulating kinds return a new,
    /// combined instance. Merging an entity with an equal entity must return a
    /// value equal to it.
    ///
    /// @param other the entity arriving later, not null
    /// @return the combined entity, never null
    E merge(E other);
}
