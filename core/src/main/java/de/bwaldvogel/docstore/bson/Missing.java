package de.bwaldvogel.docstore.bson;

/**
 * Marker for a field that is absent, as opposed to a field that holds {@code null}.
 */
public final class Missing implements Bson {

    private static final long serialVersionUID = 1L;

    private static final Missing INSTANCE = new Missing();

    private Missing() {
    }

    public static Missing getInstance() {
        return INSTANCE;
    }

    public static boolean isNullOrMissing(Object value) {
        return value == null || value instanceof Missing;
    }

    @Override
    public String toString() {
        return "[missing]";
    }

}
