package de.bwaldvogel.docstore.exception;

public class NoSuchCollectionException extends ServerError {

    private static final long serialVersionUID = 1L;

    public NoSuchCollectionException() {
        super(ErrorCode.NamespaceNotFound, "ns not found");
    }

    public NoSuchCollectionException(String fullName) {
        super(ErrorCode.NamespaceNotFound, "ns not found " + fullName);
    }

}
