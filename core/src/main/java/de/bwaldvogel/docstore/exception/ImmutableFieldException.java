package de.bwaldvogel.docstore.exception;

public class ImmutableFieldException extends ServerError {

    private static final long serialVersionUID = 1L;

    public ImmutableFieldException(String path) {
        super(ErrorCode.ImmutableField,
            "Performing an update on the path '" + path + "' would modify the immutable field '_id'");
    }

}
