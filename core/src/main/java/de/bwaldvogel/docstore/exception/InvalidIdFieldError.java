package de.bwaldvogel.docstore.exception;

public class InvalidIdFieldError extends ServerError {

    private static final long serialVersionUID = 1L;

    public InvalidIdFieldError(String message) {
        super(ErrorCode.InvalidIdField, message);
    }

}
