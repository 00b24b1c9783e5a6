package de.bwaldvogel.docstore.bson;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

public final class BinData implements Comparable<BinData>, Bson {

    private static final long serialVersionUID = 1L;

    private final byte subtype;
    private final byte[] data;

    public BinData(byte[] data) {
        this((byte) 0x00, data);
    }

    public BinData(byte subtype, byte[] data) {
        this.subtype = subtype;
        this.data = Objects.requireNonNull(data);
    }

    public byte getSubtype() {
        return subtype;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinData binData = (BinData) o;
        return subtype == binData.subtype && Arrays.equals(data, binData.data);
    }

    @Override
    public int hashCode() {
        return 31 * subtype + Arrays.hashCode(data);
    }

    // shorter data sorts first, then the subtype, then the bytes
    @Override
    public int compareTo(BinData other) {
        if (data.length != other.data.length) {
            return Integer.compare(data.length, other.data.length);
        }
        if (subtype != other.subtype) {
            return Integer.compare(subtype & 0xFF, other.subtype & 0xFF);
        }
        for (int i = 0; i < data.length; i++) {
            int compare = Integer.compare(data[i] & 0xFF, other.data[i] & 0xFF);
            if (compare != 0) {
                return compare;
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        return "BinData(" + (subtype & 0xFF) + ", " + Base64.getEncoder().encodeToString(data) + ")";
    }

}
