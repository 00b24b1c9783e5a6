package de.bwaldvogel.docstore.backend;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.bson.types.Binary;

import de.bwaldvogel.docstore.bson.BinData;
import de.bwaldvogel.docstore.bson.BsonRegularExpression;
import de.bwaldvogel.docstore.bson.BsonTimestamp;
import de.bwaldvogel.docstore.bson.Decimal128;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.bson.ObjectId;

public class TestUtils {

    private TestUtils() {
    }

    public static <T> List<T> toArray(Iterable<T> iterable) {
        List<T> array = new ArrayList<>();
        for (T obj : iterable) {
            array.add(obj);
        }
        return array;
    }

    /**
     * Parses relaxed JSON such as {@code "a: 1, b: {c: 'x'}"}. The surrounding braces are optional.
     */
    public static Document json(String string) {
        string = string.trim();
        if (!string.startsWith("{")) {
            string = "{" + string + "}";
        }
        return (Document) convert(org.bson.Document.parse(string));
    }

    public static List<Document> jsonList(String... json) {
        return Stream.of(json)
            .map(TestUtils::json)
            .collect(Collectors.toList());
    }

    private static Object convert(Object value) {
        if (value instanceof Map<?, ?> map) {
            Document document = new Document();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                document.put((String) entry.getKey(), convert(entry.getValue()));
            }
            return document;
        } else if (value instanceof List<?> list) {
            return list.stream()
                .map(TestUtils::convert)
                .collect(Collectors.toCollection(ArrayList::new));
        } else if (value instanceof org.bson.types.ObjectId objectId) {
            return new ObjectId(objectId.toByteArray());
        } else if (value instanceof org.bson.types.Decimal128 decimal) {
            return new Decimal128(decimal.getHigh(), decimal.getLow());
        } else if (value instanceof Binary binary) {
            return new BinData(binary.getType(), binary.getData());
        } else if (value instanceof Pattern pattern) {
            return new BsonRegularExpression(pattern.pattern(), toOptions(pattern.flags()));
        } else if (value instanceof org.bson.BsonRegularExpression regularExpression) {
            return new BsonRegularExpression(regularExpression.getPattern(), regularExpression.getOptions());
        } else if (value instanceof org.bson.BsonTimestamp timestamp) {
            return new BsonTimestamp(timestamp.getValue());
        } else if (value instanceof Date date) {
            return date.toInstant();
        }
        return value;
    }

    private static String toOptions(int flags) {
        StringBuilder options = new StringBuilder();
        if ((flags & Pattern.CASE_INSENSITIVE) != 0) {
            options.append('i');
        }
        if ((flags & Pattern.MULTILINE) != 0) {
            options.append('m');
        }
        if ((flags & Pattern.DOTALL) != 0) {
            options.append('s');
        }
        if ((flags & Pattern.COMMENTS) != 0) {
            options.append('x');
        }
        return options.toString();
    }

}
