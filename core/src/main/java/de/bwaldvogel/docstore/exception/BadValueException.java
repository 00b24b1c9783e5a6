package de.bwaldvogel.docstore.exception;

public class BadValueException extends ServerError {

    private static final long serialVersionUID = 1L;

    public BadValueException(String message) {
        super(ErrorCode.BadValue, message);
    }

}
