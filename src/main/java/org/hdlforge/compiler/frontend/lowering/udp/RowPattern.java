package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.model.Bit;
import org.hdlforge.compiler.model.BitVector;
import org.hdlforge.compiler.model.UdpSymbol;

import java.util.List;

/**
 * Match condition of a table line: the line matches when {@code (field & mask) == compare}.
 * <p>
 * For {@code 0 ? 1} (inputs in port order) the mask is {@code 101} and the compare
 * value {@code 100}, written most significant bit first.
 *
 * @param mask 1 for every position that must match exactly.
 * @param compare The required values at masked positions, 0 elsewhere.
 */
public record RowPattern(BitVector mask, BitVector compare) {

    /**
     * Encodes a line's input symbols. Symbol {@code i} maps to bit {@code i}.
     * Symbols past {@code width} are ignored and missing ones leave their bits unmasked.
     *
     * @param symbols The input symbols in port order.
     * @param width The field width.
     * @return The pattern.
     */
    public static RowPattern of(List<UdpSymbol> symbols, int width) {
        BitVector mask = new BitVector(width);
        BitVector compare = new BitVector(width);
        int bitIndex = 0;
        for (UdpSymbol symbol : symbols) {
            if (bitIndex >= width) {
                break;
            }
            switch (symbol) {
                case ZERO -> {
                    mask.setBit(bitIndex, Bit.ONE);
                    compare.setBit(bitIndex, Bit.ZERO);
                }
                case ONE -> {
                    mask.setBit(bitIndex, Bit.ONE);
                    compare.setBit(bitIndex, Bit.ONE);
                }
                case DONT_CARE -> {
                    mask.setBit(bitIndex, Bit.ZERO);
                    compare.setBit(bitIndex, Bit.ZERO);
                }
            }
            bitIndex++;
        }
        return new RowPattern(mask, compare);
    }

    /**
     * Evaluates the pattern against a field value.
     * @param field The field value.
     * @return 1 on match, 0 on mismatch, {@code x} if a masked field bit is unknown.
     */
    public Bit matches(BitVector field) {
        return field.and(mask).logicalEquals(compare);
    }
}
