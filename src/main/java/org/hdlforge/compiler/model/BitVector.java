package org.hdlforge.compiler.model;

import java.util.BitSet;
import java.util.Objects;

/**
 * Fixed-width four-state number. Bit 0 is the least significant bit.
 * <p>
 * Values are mutable through {@link #setBit(int, Bit)} while they are being built;
 * nodes that hold a vector keep their own {@link #copy()}.
 */
public final class BitVector {

    private final int width;
    private final BitSet ones = new BitSet();
    private final BitSet unknown = new BitSet();

    /**
     * Creates an all-zero vector.
     * @param width Number of bits, must be positive.
     */
    public BitVector(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bit vector width must be positive, got: " + width);
        }
        this.width = width;
    }

    /**
     * Creates a vector from the low {@code width} bits of a long.
     * @param width Number of bits (1..64).
     * @param value The value.
     * @return The new vector.
     */
    public static BitVector of(int width, long value) {
        BitVector vector = new BitVector(width);
        for (int i = 0; i < Math.min(width, Long.SIZE); i++) {
            vector.setBit(i, Bit.of(((value >>> i) & 1L) != 0));
        }
        return vector;
    }

    /**
     * Creates a vector with every bit unknown.
     * @param width Number of bits.
     * @return The new vector.
     */
    public static BitVector allX(int width) {
        BitVector vector = new BitVector(width);
        vector.unknown.set(0, width);
        return vector;
    }

    public int width() {
        return width;
    }

    /**
     * Sets one bit.
     * @param index Bit index, 0 is least significant.
     * @param bit The new value.
     */
    public void setBit(int index, Bit bit) {
        checkIndex(index);
        ones.set(index, bit == Bit.ONE);
        unknown.set(index, bit == Bit.X);
    }

    /**
     * @param index Bit index, 0 is least significant.
     * @return The value of the bit.
     */
    public Bit getBit(int index) {
        checkIndex(index);
        if (unknown.get(index)) {
            return Bit.X;
        }
        return Bit.of(ones.get(index));
    }

    /**
     * @return true if no bit is {@code x}.
     */
    public boolean isFullyKnown() {
        return unknown.isEmpty();
    }

    /**
     * Bitwise AND with four-state rules: a known 0 on either side wins over {@code x}.
     * @param other Operand of the same width.
     * @return The new vector.
     */
    public BitVector and(BitVector other) {
        requireSameWidth(other);
        BitVector result = new BitVector(width);
        for (int i = 0; i < width; i++) {
            Bit a = getBit(i);
            Bit b = other.getBit(i);
            if (a == Bit.ZERO || b == Bit.ZERO) {
                result.setBit(i, Bit.ZERO);
            } else if (a == Bit.ONE && b == Bit.ONE) {
                result.setBit(i, Bit.ONE);
            } else {
                result.setBit(i, Bit.X);
            }
        }
        return result;
    }

    /**
     * Logical equality ({@code ==}): 0 if any pair of known bits differs,
     * otherwise {@code x} if any bit is unknown, otherwise 1.
     * @param other Operand of the same width.
     * @return The comparison result.
     */
    public Bit logicalEquals(BitVector other) {
        requireSameWidth(other);
        boolean sawUnknown = false;
        for (int i = 0; i < width; i++) {
            Bit a = getBit(i);
            Bit b = other.getBit(i);
            if (!a.isKnown() || !b.isKnown()) {
                sawUnknown = true;
            } else if (a != b) {
                return Bit.ZERO;
            }
        }
        return sawUnknown ? Bit.X : Bit.ONE;
    }

    /**
     * Concatenation {@code {high, low}}.
     * @param high The most significant part.
     * @param low The least significant part.
     * @return A vector of the combined width.
     */
    public static BitVector concat(BitVector high, BitVector low) {
        BitVector result = new BitVector(high.width + low.width);
        for (int i = 0; i < low.width; i++) {
            result.setBit(i, low.getBit(i));
        }
        for (int i = 0; i < high.width; i++) {
            result.setBit(low.width + i, high.getBit(i));
        }
        return result;
    }

    /**
     * @return A Verilog sized binary literal, e.g. {@code 3'b01x}.
     */
    public String toVerilogLiteral() {
        return width + "'b" + toBinaryString();
    }

    /**
     * @return The bits most significant first.
     */
    public String toBinaryString() {
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            sb.append(getBit(i).symbol());
        }
        return sb.toString();
    }

    public BitVector copy() {
        BitVector copy = new BitVector(width);
        copy.ones.or(ones);
        copy.unknown.or(unknown);
        return copy;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= width) {
            throw new IllegalArgumentException("Bit index " + index + " out of range for width " + width);
        }
    }

    private void requireSameWidth(BitVector other) {
        if (other.width != width) {
            throw new IllegalArgumentException("Width mismatch: " + width + " vs " + other.width);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitVector that)) return false;
        return width == that.width && ones.equals(that.ones) && unknown.equals(that.unknown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, ones, unknown);
    }

    @Override
    public String toString() {
        return toVerilogLiteral();
    }
}
