package de.bwaldvogel.docstore.exception;

public class InvalidNamespaceError extends ServerError {

    private static final long serialVersionUID = 1L;

    public InvalidNamespaceError(String message) {
        super(ErrorCode.InvalidNamespace, message);
    }

    public static InvalidNamespaceError invalidCollectionName(String collectionName) {
        return new InvalidNamespaceError("Invalid collection name: " + collectionName);
    }

    public static InvalidNamespaceError invalidNamespace(String namespace) {
        return new InvalidNamespaceError("Invalid namespace specified '" + namespace + "'");
    }

}
