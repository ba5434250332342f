package io.tessera.serialization.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// Writes whole files: a reader sees either the previous file or the complete
/// new content, never a truncated artifact.
///
/// Content goes to a temporary sibling file that is then moved over the target.
/// Parent directories are created as needed.
final class AtomicFileWriter {

    private AtomicFileWriter() {}

    /// Writes `content` to `target` as UTF-8.
    ///
    /// @param target file to create or replace, not null
    /// @param content full file content, not null
    /// @throws IOException if the directories, temporary file or move fail
    static void write(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(
                        temp,
                        target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
