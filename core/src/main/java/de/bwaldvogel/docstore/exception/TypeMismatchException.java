package de.bwaldvogel.docstore.exception;

public class TypeMismatchException extends ServerError {

    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message) {
        super(ErrorCode.TypeMismatch, message);
    }

}
