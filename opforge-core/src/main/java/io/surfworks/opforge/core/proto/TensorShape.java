package io.surfworks.opforge.core.proto;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tensor shape descriptor: dimensions, element type, and an unknown-shape flag.
 * Describes a tensor without its data.
 *
 * <p>A shape with {@code unknownShape == true} carries no meaningful dims or type;
 * it is what inference produces when nothing can be said about an output.
 *
 * @param dims         dimension sizes, outermost first
 * @param dataType     element type
 * @param unknownShape whether the shape could not be determined
 */
public record TensorShape(
    long[] dims,
    ScalarType dataType,
    boolean unknownShape
) {
    private static final TensorShape UNKNOWN = new TensorShape(new long[0], ScalarType.UNDEFINED, true);

    public TensorShape {
        Objects.requireNonNull(dims, "dims cannot be null");
        Objects.requireNonNull(dataType, "dataType cannot be null");
        dims = dims.clone();
        for (int i = 0; i < dims.length; i++) {
            if (dims[i] < 0) {
                throw new IllegalArgumentException(
                    "Dimension " + i + " must be non-negative, got " + dims[i]);
            }
        }
    }

    /**
     * Create a known shape with the given element type and dimensions.
     */
    public static TensorShape of(ScalarType dataType, long... dims) {
        return new TensorShape(dims, dataType, false);
    }

    /**
     * A shape about which nothing is known.
     */
    public static TensorShape unknown() {
        return UNKNOWN;
    }

    @Override
    public long[] dims() {
        return dims.clone();
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return dims.length;
    }

    /**
     * Size of dimension {@code axis}.
     *
     * @throws IndexOutOfBoundsException if the axis is not within the rank
     */
    public long dim(int axis) {
        if (axis < 0 || axis >= dims.length) {
            throw new IndexOutOfBoundsException(
                "Axis " + axis + " out of bounds for shape of rank " + dims.length);
        }
        return dims[axis];
    }

    /**
     * Total number of elements. A rank-0 shape holds one element.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public long elementCount() {
        long count = 1;
        for (long dim : dims) {
            count = saturatedMultiply(count, dim);
        }
        return count;
    }

    /**
     * Total size in bytes, or 0 when the element type has no fixed width.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public long byteSize() {
        return saturatedMultiply(elementCount(), dataType.byteSize());
    }

    /**
     * Same dimensions with a different element type.
     */
    public TensorShape withDataType(ScalarType type) {
        return new TensorShape(dims, type, unknownShape);
    }

    /**
     * Check if dimensions are equal, ignoring element type.
     */
    public boolean dimsEqual(TensorShape other) {
        return Arrays.equals(this.dims, other.dims);
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorShape that)) return false;
        return Arrays.equals(dims, that.dims) &&
               dataType == that.dataType &&
               unknownShape == that.unknownShape;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(dims);
        result = 31 * result + dataType.hashCode();
        result = 31 * result + Boolean.hashCode(unknownShape);
        return result;
    }

    @Override
    public String toString() {
        if (unknownShape) {
            return "TensorShape[unknown]";
        }
        return "TensorShape[dims=" + Arrays.toString(dims) + ", dataType=" + dataType + "]";
    }
}
