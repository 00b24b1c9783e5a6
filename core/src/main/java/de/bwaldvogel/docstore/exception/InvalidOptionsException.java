package de.bwaldvogel.docstore.exception;

public class InvalidOptionsException extends ServerError {

    private static final long serialVersionUID = 1L;

    public InvalidOptionsException(String message) {
        super(ErrorCode.InvalidOptions, message);
    }

}
