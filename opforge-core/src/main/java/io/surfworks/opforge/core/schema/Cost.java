package io.surfworks.opforge.core.schema;

/**
 * Estimated cost of executing one operator instance.
 *
 * @param flops      floating-point operations
 * @param bytesMoved total bytes read and written
 */
public record Cost(long flops, long bytesMoved) {

    public static final Cost ZERO = new Cost(0, 0);

    public Cost {
        if (flops < 0 || bytesMoved < 0) {
            throw new IllegalArgumentException(
                "Cost components must be non-negative: flops=" + flops + ", bytesMoved=" + bytesMoved);
        }
    }

    public Cost plus(Cost other) {
        return new Cost(flops + other.flops, bytesMoved + other.bytesMoved);
    }
}
