package de.bwaldvogel.docstore.exception;

public class NamespaceExistsException extends ServerError {

    private static final long serialVersionUID = 1L;

    public NamespaceExistsException(String fullName) {
        super(ErrorCode.NamespaceExists, "Collection " + fullName + " already exists.");
    }

}
