package de.bwaldvogel.docstore.exception;

public class DocumentTooLargeException extends ServerError {

    private static final long serialVersionUID = 1L;

    public DocumentTooLargeException(long size, int maxSize) {
        super(ErrorCode.BSONObjectTooLarge, "object to insert too large. size in bytes: " + size + ", max size: " + maxSize);
    }

}
