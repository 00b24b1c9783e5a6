package de.bwaldvogel.docstore.exception;

public class CannotCreateIndexException extends ServerError {

    private static final long serialVersionUID = 1L;

    public CannotCreateIndexException(String message) {
        super(ErrorCode.CannotCreateIndex, message);
    }

}
