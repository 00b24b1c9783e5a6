package de.bwaldvogel.docstore.bson;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

public class ObjectId implements Bson, Comparable<ObjectId> {

    private static final long serialVersionUID = 1L;

    public static final int LENGTH = 12;

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-f]{" + 2 * LENGTH + "}$");

    private static final AtomicInteger COUNTER = new AtomicInteger(new SecureRandom().nextInt());

    private static final byte[] PROCESS_UNIQUE = createProcessUnique();

    private final byte[] data;

    public ObjectId() {
        this(Instant.now());
    }

    ObjectId(Instant timestamp) {
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        buffer.putInt((int) timestamp.getEpochSecond());
        buffer.put(PROCESS_UNIQUE);
        int counter = COUNTER.getAndIncrement();
        buffer.put((byte) (counter >> 16));
        buffer.put((byte) (counter >> 8));
        buffer.put((byte) counter);
        this.data = buffer.array();
    }

    public ObjectId(byte[] data) {
        if (data.length != LENGTH) {
            throw new IllegalArgumentException("Illegal ObjectId length: " + data.length);
        }
        this.data = data.clone();
    }

    public ObjectId(String hexString) {
        if (!HEX_PATTERN.matcher(hexString).matches()) {
            throw new IllegalArgumentException("Failed to parse '" + hexString + "'");
        }
        this.data = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            data[i] = (byte) Integer.parseInt(hexString.substring(2 * i, 2 * i + 2), 16);
        }
    }

    private static byte[] createProcessUnique() {
        byte[] bytes = new byte[5];
        new SecureRandom().nextBytes(bytes);
        return bytes;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public Instant getTimestamp() {
        return Instant.ofEpochSecond(ByteBuffer.wrap(data).getInt() & 0xFFFFFFFFL);
    }

    public String getHexData() {
        StringBuilder sb = new StringBuilder(2 * LENGTH);
        for (byte b : data) {
            sb.append(String.format("%02x", b & 0xFF));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((ObjectId) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public int compareTo(ObjectId other) {
        return Arrays.compareUnsigned(data, other.data);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getHexData() + "]";
    }

}
