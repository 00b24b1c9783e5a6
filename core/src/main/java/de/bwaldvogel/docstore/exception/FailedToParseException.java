package de.bwaldvogel.docstore.exception;

public class FailedToParseException extends ServerError {

    private static final long serialVersionUID = 1L;

    public FailedToParseException(String message) {
        super(ErrorCode.FailedToParse, message);
    }

}
