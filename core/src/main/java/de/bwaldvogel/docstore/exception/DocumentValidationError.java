package de.bwaldvogel.docstore.exception;

import de.bwaldvogel.docstore.bson.Json;

/**
 * A document violates the rules for stored content. The message depends on whether the key itself or the value
 * stored under it is at fault.
 */
public class DocumentValidationError extends ServerError {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_UTF8_KEY("not a valid UTF-8 string"),
        DOLLAR_PREFIXED_KEY("key must not start with '$' sign"),
        DOTTED_KEY("key must not contain '.' sign"),
        DUPLICATE_KEY("duplicate keys are not allowed"),
        NESTED_ARRAY("nested arrays are not supported"),
        INFINITY("infinity values are not allowed"),
        NAN("NaN values are not allowed"),
        ;

        private final String reason;

        Kind(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }

        boolean isKeyViolation() {
            return this == INVALID_UTF8_KEY || this == DOLLAR_PREFIXED_KEY || this == DOTTED_KEY || this == DUPLICATE_KEY;
        }
    }

    private final Kind kind;
    private final String key;

    public DocumentValidationError(Kind kind, String key) {
        this(kind, key, null);
    }

    public DocumentValidationError(Kind kind, String key, Object value) {
        super(ErrorCode.BadValue, formatMessage(kind, key, value));
        this.kind = kind;
        this.key = key;
    }

    private static String formatMessage(Kind kind, String key, Object value) {
        if (kind.isKeyViolation()) {
            return "invalid key: \"" + key + "\" (" + kind.getReason() + ")";
        }
        return "invalid value: " + Json.toValidationJson(key, value) + " (" + kind.getReason() + ")";
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    public String getDetail() {
        return kind.getReason();
    }

}
