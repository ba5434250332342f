package io.tessera.core.exception;

import java.io.Serial;

/// Raised when an entity is constructed with a missing or malformed identity field,
/// or when an add-operation receives a value of the wrong kind.
///
/// @apiNote Add-operations validate the whole batch before inserting anything, so
/// a caller that catches this exception sees the project exactly as it was before the call.
public class ValidationException extends TesseraException {
    @Serial private static final long serialVersionUID = -4187305518815935371L;

    public ValidationException(String message) {
        super(message);
    }

    /// Fails with a `ValidationException` when `value` is null or blank.
    ///
    /// @param value the text to check, may be null
    /// @param field field name used in the message, not null
    /// @return `value`, never null or blank
    /// @throws ValidationException if `value` is null or blank
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    /// Fails with a `ValidationException` when `value` is null.
    ///
    /// @param value the value to check, may be null
    /// @param field field name used in the message, not null
    /// @return `value`, never null
    /// @throws ValidationException if `value` is null
    public static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
