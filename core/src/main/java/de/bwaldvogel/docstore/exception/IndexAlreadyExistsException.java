package de.bwaldvogel.docstore.exception;

public class IndexAlreadyExistsException extends ServerError {

    private static final long serialVersionUID = 1L;

    public IndexAlreadyExistsException(String indexName) {
        super(ErrorCode.IndexAlreadyExists, "Identical index already exists: " + indexName);
    }

}
