package io.tessera.core.model;

/// An entity with a textual form written verbatim into an output artifact.
public interface Renderable {

    /// Renders this entity to text.
    ///
    /// @return rendered text, never null (may be empty)
    String render();
}
