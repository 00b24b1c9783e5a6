package de.bwaldvogel.docstore.wire;

public final class BsonConstants {

    private BsonConstants() {
    }

    public static final int MAX_BSON_OBJECT_SIZE = 16 * 1024 * 1024;

    static final byte TERMINATING_BYTE = 0x00;

    static final byte TYPE_DOUBLE = 0x01;
    static final byte TYPE_UTF8_STRING = 0x02;
    static final byte TYPE_EMBEDDED_DOCUMENT = 0x03;
    static final byte TYPE_ARRAY = 0x04;
    static final byte TYPE_DATA = 0x05;
    static final byte TYPE_OBJECT_ID = 0x07;
    static final byte TYPE_BOOLEAN = 0x08;
    static final byte TYPE_UTC_DATETIME = 0x09;
    static final byte TYPE_NULL = 0x0A;
    static final byte TYPE_REGEX = 0x0B;
    static final byte TYPE_INT32 = 0x10;
    static final byte TYPE_TIMESTAMP = 0x11;
    static final byte TYPE_INT64 = 0x12;
    static final byte TYPE_DECIMAL128 = 0x13;

    static final byte BOOLEAN_VALUE_FALSE = 0x00;
    static final byte BOOLEAN_VALUE_TRUE = 0x01;

    static final byte STRING_TERMINATION = 0x00;

    static final int LENGTH_OBJECTID = 12;

}
