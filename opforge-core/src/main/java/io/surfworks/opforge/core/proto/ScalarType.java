package io.surfworks.opforge.core.proto;

/**
 * Scalar element types carried by {@link TensorShape}.
 *
 * <p>Byte size is 0 for types without a fixed element width
 * ({@link #UNDEFINED} and {@link #STRING}).
 */
public enum ScalarType {
    UNDEFINED(0),

    // IEEE 754 and brain float
    F16(2),
    BF16(2),
    F32(4),
    F64(8),

    // Integer types
    I8(1),
    I16(2),
    I32(4),
    I64(8),
    U8(1),
    U16(2),

    BOOL(1),
    STRING(0);

    private final int byteSize;

    ScalarType(int byteSize) {
        this.byteSize = byteSize;
    }

    public int byteSize() {
        return byteSize;
    }
}
