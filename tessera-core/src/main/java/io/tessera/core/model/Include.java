package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/// An auxiliary file copied verbatim into the output directory.
///
/// @param filepath path relative to the output directory, not blank, not absolute,
///     without `..` segments
/// @param contents raw file contents, rendered as an empty string when null
public record Include(String filepath, String contents)
        implements Entity<String, Include>, Renderable {

    public Include {
        ValidationException.requireText(filepath, "Include filepath");
        Path path;
        try {
            path = Path.of(filepath);
        } catch (InvalidPathException e) {
            throw new ValidationException("Include filepath is not a valid path: " + filepath);
        }
        if (path.isAbsolute()) {
            throw new ValidationException("Include filepath must be relative: " + filepath);
        }
        for (Path segment : path) {
            if ("..".equals(segment.toString())) {
                throw new ValidationException(
                        "Include filepath must not leave the output directory: " + filepath);
            }
        }
    }

    @Override
    public String identityKey() {
        return filepath;
    }

    @Override
    public Include merge(Include other) {
        return other;
    }

    @Override
    public String render() {
        return contents == null ? "" : contents;
    }
}
