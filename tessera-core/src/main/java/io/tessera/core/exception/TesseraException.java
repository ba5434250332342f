package io.tessera.core.exception;

import java.io.Serial;

/// Base type for all errors raised by the project aggregation engine.
///
/// Every subtype is raised synchronously at the point of misuse and is never
/// swallowed by the engine itself.
///
/// @see ValidationException
/// @see EmptyProjectException
/// @see StructuralException
public class TesseraException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3124410982351170612L;

    public TesseraException(String message) {
        super(message);
    }

    public TesseraException(String message, Throwable cause) {
        super(message, cause);
    }
}
