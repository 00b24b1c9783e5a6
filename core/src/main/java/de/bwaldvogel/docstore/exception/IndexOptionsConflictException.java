package de.bwaldvogel.docstore.exception;

public class IndexOptionsConflictException extends ServerError {

    private static final long serialVersionUID = 1L;

    public IndexOptionsConflictException(String existingIndexName) {
        super(ErrorCode.IndexOptionsConflict, "Index already exists with a different name: " + existingIndexName);
    }

}
