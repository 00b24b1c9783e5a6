package de.bwaldvogel.docstore.wire;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;

import org.bson.RawBsonDocument;
import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.bson.BinData;
import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonTimestamp;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.ObjectId;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

public class BsonEncoderTest {

    @Test
    void testEncodeEmptyDocument() throws Exception {
        ByteBuf buffer = Unpooled.buffer();
        try {
            new BsonEncoder().encodeDocument(new Document(), buffer);
            assertThat(buffer.writerIndex()).isEqualTo(5);
            assertThat(buffer.readerIndex()).isEqualTo(0);
            assertThat(buffer.readIntLE()).isEqualTo(5);
            assertThat(buffer.readByte()).isEqualTo(BsonConstants.TERMINATING_BYTE);
        } finally {
            buffer.release();
        }
    }

    @Test
    void testEncodeDecodeRoundtrip() throws Exception {
        Document document = new Document();
        document.put("key1", "value");
        document.put("key2", 123.0);
        document.put("key3", Arrays.asList(1L, 2L));
        document.put("key4", true);
        document.put("key5", new ObjectId());
        document.put("key6", null);
        document.put("key7", new Document("nested", Integer.valueOf(42)));
        document.put("key8", Instant.ofEpochMilli(1234567890L));
        document.put("key9", new BsonTimestamp(Instant.ofEpochSecond(1000), 3));
        document.put("key10", new Decimal128(new BigDecimal("1.5")));
        document.put("key11", new BinData((byte) 4, new byte[] { 1, 2, 3 }));
        document.put("key12", Double.valueOf(-0.0));

        ByteBuf buffer = Unpooled.buffer();
        try {
            new BsonEncoder().encodeDocument(document, buffer);

            Document decodedDocument = new BsonDecoder().decodeBson(buffer);
            assertThat(decodedDocument).isEqualTo(document);
            assertThat(buffer.isReadable()).isFalse();
        } finally {
            buffer.release();
        }
    }

    @Test
    void testEncodedBytesAreReadableByTheJavaDriver() throws Exception {
        Document document = new Document("_id", Integer.valueOf(1));
        document.put("text", "\u0442\u0435\u0441\u0442");
        document.put("list", Arrays.asList(Long.valueOf(7L), "x"));
        document.put("regex", new BsonRegularExpression("^a", "i"));

        ByteBuf buffer = Unpooled.buffer();
        try {
            new BsonEncoder().encodeDocument(document, buffer);
            RawBsonDocument rawDocument = new RawBsonDocument(ByteBufUtil.getBytes(buffer));

            assertThat(rawDocument.keySet()).containsExactly("_id", "text", "list", "regex");
            assertThat(rawDocument.getInt32("_id").getValue()).isEqualTo(1);
            assertThat(rawDocument.getString("text").getValue()).isEqualTo("\u0442\u0435\u0441\u0442");
            assertThat(rawDocument.getArray("list").get(0).asInt64().getValue()).isEqualTo(7L);
            assertThat(rawDocument.getArray("list").get(1).asString().getValue()).isEqualTo("x");
            assertThat(rawDocument.getRegularExpression("regex").getPattern()).isEqualTo("^a");
            assertThat(rawDocument.getRegularExpression("regex").getOptions()).isEqualTo("i");
        } finally {
            buffer.release();
        }
    }

}
