package org.owasp.blt.api.rest;

import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering key for competing route templates: {@code (paramCount, -literalChars, -segmentCount)}.
 *
 * Ascending order puts fewer parameters first, then more literal characters, then fewer segments.
 */
public final class SpecificityKey implements Comparable<SpecificityKey> {

    private static final Comparator<SpecificityKey> ORDER = Comparator
            .comparingInt(SpecificityKey::getParamCount)
            .thenComparingInt(k -> -k.getLiteralChars())
            .thenComparingInt(k -> -k.getSegmentCount());

    private final int paramCount;
    private final int literalChars;
    private final int segmentCount;

    public SpecificityKey(int paramCount, int literalChars, int segmentCount) {
        this.paramCount = paramCount;
        this.literalChars = literalChars;
        this.segmentCount = segmentCount;
    }

    public int getParamCount() {
        return paramCount;
    }

    public int getLiteralChars() {
        return literalChars;
    }

    public int getSegmentCount() {
        return segmentCount;
    }

    @Override
    public int compareTo(SpecificityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpecificityKey)) return false;
        SpecificityKey that = (SpecificityKey) o;
        return paramCount == that.paramCount
                && literalChars == that.literalChars
                && segmentCount == that.segmentCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(paramCount, literalChars, segmentCount);
    }

    @Override
    public String toString() {
        return "(" + paramCount + ", " + (-literalChars) + ", " + (-segmentCount) + ")";
    }
}
