package de.bwaldvogel.docstore.bson;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.ServerError;

public final class BsonRegularExpression implements Bson {

    private static final long serialVersionUID = 1L;

    private static final String REGEX = "$regex";
    private static final String OPTIONS = "$options";

    private final String pattern;
    private final String options;

    private transient Pattern compiledPattern;

    public BsonRegularExpression(String pattern, String options) {
        this.pattern = Objects.requireNonNull(pattern);
        this.options = options != null ? options : "";
    }

    public BsonRegularExpression(String pattern) {
        this(pattern, null);
    }

    public static boolean isRegularExpression(Object object) {
        if (object instanceof Map<?, ?> map) {
            return map.containsKey(REGEX);
        }
        return object instanceof BsonRegularExpression;
    }

    public static BsonRegularExpression convertToRegularExpression(Object pattern) {
        if (pattern instanceof BsonRegularExpression regularExpression) {
            return regularExpression;
        }
        if (!isRegularExpression(pattern)) {
            throw new IllegalArgumentException("'" + pattern + "' is not a regular expression");
        }
        Document document = (Document) pattern;
        Object regex = document.get(REGEX);
        Object options = document.get(OPTIONS);
        if (regex instanceof BsonRegularExpression regularExpression) {
            if (options == null) {
                return regularExpression;
            }
            return new BsonRegularExpression(regularExpression.getPattern(), requireString(options, OPTIONS));
        }
        return new BsonRegularExpression(requireString(regex, REGEX), options == null ? null : requireString(options, OPTIONS));
    }

    private static String requireString(Object value, String field) {
        if (!(value instanceof String string)) {
            throw new ServerError(ErrorCode.BadValue, field + " has to be a string");
        }
        return string;
    }

    public String getPattern() {
        return pattern;
    }

    public String getOptions() {
        return options;
    }

    public Pattern toPattern() {
        if (compiledPattern == null) {
            compiledPattern = createPattern();
        }
        return compiledPattern;
    }

    Pattern createPattern() {
        int flags = 0;
        for (char option : options.toCharArray()) {
            switch (option) {
                case 'i':
                    flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    break;
                case 'm':
                    flags |= Pattern.MULTILINE;
                    break;
                case 's':
                    flags |= Pattern.DOTALL;
                    break;
                case 'x':
                    flags |= Pattern.COMMENTS;
                    break;
                default:
                    throw new ServerError(ErrorCode._51108, "invalid flag in regex options: " + option);
            }
        }
        try {
            return Pattern.compile(pattern, flags);
        } catch (PatternSyntaxException e) {
            throw new ServerError(ErrorCode.BadValue, "Regular expression is invalid: " + e.getDescription());
        }
    }

    public boolean matches(String value) {
        return toPattern().matcher(value).find();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BsonRegularExpression other = (BsonRegularExpression) o;
        return pattern.equals(other.pattern) && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, options);
    }

    @Override
    public String toString() {
        Document document = new Document(REGEX, pattern);
        if (!options.isEmpty()) {
            document.append(OPTIONS, options);
        }
        return document.toString();
    }

}
