package de.bwaldvogel.docstore.exception;

import de.bwaldvogel.docstore.bson.Json;

public class PathNotViableException extends ServerError {

    private static final long serialVersionUID = 1L;

    public PathNotViableException(String field, String key, Object element) {
        super(ErrorCode.PathNotViable, "Cannot create field '" + field + "' in element "
            + "{" + key + ": " + Json.toCompactJsonValue(element) + "}");
    }

    public PathNotViableException(String message) {
        super(ErrorCode.PathNotViable, message);
    }

}
