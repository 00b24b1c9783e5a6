package de.bwaldvogel.docstore.wire;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import de.bwaldvogel.docstore.bson.BinData;
import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonTimestamp;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.ObjectId;
import de.bwaldvogel.docstore.exception.BadValueException;
import io.netty.buffer.ByteBuf;

/**
 * Decodes little-endian BSON into {@link Document}s.
 * <p>
 * Repeated keys and keys that are not valid UTF-8 are kept in the decoded key sequence of the document,
 * so that they can be rejected by the validator with a proper message instead of failing here.
 */
public class BsonDecoder {

    public Document decodeBson(ByteBuf buffer) {
        final int totalObjectLength = buffer.readIntLE();
        final int length = totalObjectLength - 4;
        if (length < 1) {
            throw new BadValueException("Malformed BSON: document too short (" + totalObjectLength + " bytes)");
        }
        if (buffer.readableBytes() < length) {
            throw new BadValueException("Malformed BSON: too few bytes to read: " + buffer.readableBytes() + " < " + length);
        }

        ByteBuf localBuffer = buffer.readSlice(length);
        Document document = new Document();
        while (localBuffer.isReadable()) {
            byte type = localBuffer.readByte();
            if (type == BsonConstants.TERMINATING_BYTE) {
                if (localBuffer.isReadable()) {
                    throw new BadValueException("Malformed BSON: unexpected end of document");
                }
                return document;
            }
            byte[] rawKey = readCStringBytes(localBuffer);
            String key = decodeUtf8Lenient(rawKey);
            boolean wellFormedKey = isValidUtf8(rawKey);
            Object value = decodeValue(type, localBuffer);
            document.appendDecoded(key, value, wellFormedKey);
        }
        throw new BadValueException("Malformed BSON: missing terminating byte");
    }

    private Object decodeValue(byte type, ByteBuf buffer) {
        switch (type) {
            case BsonConstants.TYPE_DOUBLE:
                return Double.valueOf(Double.longBitsToDouble(buffer.readLongLE()));
            case BsonConstants.TYPE_UTF8_STRING:
                return decodeString(buffer);
            case BsonConstants.TYPE_EMBEDDED_DOCUMENT:
                return decodeBson(buffer);
            case BsonConstants.TYPE_ARRAY:
                return decodeArray(buffer);
            case BsonConstants.TYPE_DATA:
                return decodeBinary(buffer);
            case BsonConstants.TYPE_OBJECT_ID:
                byte[] bytes = new byte[BsonConstants.LENGTH_OBJECTID];
                buffer.readBytes(bytes);
                return new ObjectId(bytes);
            case BsonConstants.TYPE_BOOLEAN:
                return decodeBoolean(buffer);
            case BsonConstants.TYPE_UTC_DATETIME:
                return Instant.ofEpochMilli(buffer.readLongLE());
            case BsonConstants.TYPE_NULL:
                return null;
            case BsonConstants.TYPE_REGEX:
                String pattern = decodeCString(buffer);
                String options = decodeCString(buffer);
                return new BsonRegularExpression(pattern, options);
            case BsonConstants.TYPE_INT32:
                return Integer.valueOf(buffer.readIntLE());
            case BsonConstants.TYPE_TIMESTAMP:
                return new BsonTimestamp(buffer.readLongLE());
            case BsonConstants.TYPE_INT64:
                return Long.valueOf(buffer.readLongLE());
            case BsonConstants.TYPE_DECIMAL128:
                long low = buffer.readLongLE();
                long high = buffer.readLongLE();
                return new Decimal128(high, low);
            default:
                throw new BadValueException("Malformed BSON: unknown type: 0x" + Integer.toHexString(type & 0xFF));
        }
    }

    private List<Object> decodeArray(ByteBuf buffer) {
        Document document = decodeBson(buffer);
        return new ArrayList<>(document.values());
    }

    private BinData decodeBinary(ByteBuf buffer) {
        int length = buffer.readIntLE();
        byte subtype = buffer.readByte();
        if (length < 0 || length > buffer.readableBytes()) {
            throw new BadValueException("Malformed BSON: illegal binary length " + length);
        }
        byte[] data = new byte[length];
        buffer.readBytes(data);
        return new BinData(subtype, data);
    }

    private Boolean decodeBoolean(ByteBuf buffer) {
        byte value = buffer.readByte();
        switch (value) {
            case BsonConstants.BOOLEAN_VALUE_FALSE:
                return Boolean.FALSE;
            case BsonConstants.BOOLEAN_VALUE_TRUE:
                return Boolean.TRUE;
            default:
                throw new BadValueException("Malformed BSON: illegal boolean value: " + value);
        }
    }

    String decodeString(ByteBuf buffer) {
        int length = buffer.readIntLE();
        if (length < 1 || length > buffer.readableBytes()) {
            throw new BadValueException("Malformed BSON: illegal string length " + length);
        }
        byte[] data = new byte[length - 1];
        buffer.readBytes(data);
        byte trail = buffer.readByte();
        if (trail != BsonConstants.STRING_TERMINATION) {
            throw new BadValueException("Malformed BSON: unexpected string trailer " + trail);
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    String decodeCString(ByteBuf buffer) {
        return new String(readCStringBytes(buffer), StandardCharsets.UTF_8);
    }

    private static byte[] readCStringBytes(ByteBuf buffer) {
        int length = buffer.bytesBefore(BsonConstants.STRING_TERMINATION);
        if (length < 0) {
            throw new BadValueException("Malformed BSON: string termination not found");
        }
        byte[] bytes = new byte[length];
        buffer.readBytes(bytes);
        buffer.readByte(); // string termination
        return bytes;
    }

    private static String decodeUtf8Lenient(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static boolean isValidUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

}
