package io.tessera.core.exception;

import java.io.Serial;

/// Raised when a project without any workflow is rendered.
///
/// Recoverable by the caller: add workflows, then render again. Nothing is
/// written to the output directory before this exception is thrown.
public class EmptyProjectException extends TesseraException {
    @Serial private static final long serialVersionUID = 7730947140221645096L;

    public EmptyProjectException(String message) {
        super(message);
    }
}
