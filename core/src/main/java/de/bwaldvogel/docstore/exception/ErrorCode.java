package de.bwaldvogel.docstore.exception;

public enum ErrorCode {
    InternalError(1),
    BadValue(2),
    FailedToParse(9),
    TypeMismatch(14),
    IllegalOperation(20),
    NamespaceNotFound(26),
    IndexNotFound(27),
    PathNotViable(28),
    ConflictingUpdateOperators(40),
    NamespaceExists(48),
    DollarPrefixedFieldName(52),
    InvalidIdField(53),
    EmptyFieldName(56),
    CommandNotFound(59),
    ImmutableField(66),
    CannotCreateIndex(67),
    IndexAlreadyExists(68),
    InvalidOptions(72),
    InvalidNamespace(73),
    IndexOptionsConflict(85),
    IndexKeySpecsConflict(86),
    InvalidIndexSpecificationOption(197),
    NotImplemented(238),
    BSONObjectTooLarge(10334),
    DuplicateKey(11000),
    Interrupted(11601),

    _15998(15998) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _28667(28667) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _28724(28724) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _31249(31249) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _31253(31253) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _31254(31254) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _40414(40414) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _51024(51024) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    _51108(51108) {
        @Override
        public String getName() {
            return "Location" + getValue();
        }
    },
    ;

    private final int id;

    ErrorCode(int id) {
        this.id = id;
    }

    public int getValue() {
        return id;
    }

    public String getName() {
        return name();
    }
}
