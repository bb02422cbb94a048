package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.TensorShape;

import java.util.List;

/**
 * Cost model for element-wise operators: each element of the output is
 * produced by a fixed number of flops per input, and every input and output
 * element is moved once.
 *
 * <p>The output is assumed to have the shape of input 0. Unknown shapes
 * contribute nothing. Totals too large for a {@code long} saturate at
 * {@link Long#MAX_VALUE}.
 */
public final class PointwiseCost implements CostInferenceFunction {

    private final int flopsPerElement;

    /**
     * @param flopsPerElement flops spent per output element for each input beyond the first
     */
    public PointwiseCost(int flopsPerElement) {
        if (flopsPerElement < 0) {
            throw new IllegalArgumentException("flopsPerElement must be non-negative, got " + flopsPerElement);
        }
        this.flopsPerElement = flopsPerElement;
    }

    @Override
    public Cost infer(OperatorDef def, List<TensorShape> inputs) {
        if (inputs.isEmpty() || inputs.get(0).unknownShape()) {
            return Cost.ZERO;
        }
        TensorShape first = inputs.get(0);
        long outputElements = first.elementCount();
        long flops = saturatedMultiply(
            saturatedMultiply(outputElements, flopsPerElement), Math.max(1, inputs.size() - 1));

        long bytes = saturatedMultiply(first.byteSize(), def.outputCount());
        for (TensorShape input : inputs) {
            if (!input.unknownShape()) {
                bytes = saturatedAdd(bytes, input.byteSize());
            }
        }
        return new Cost(flops, bytes);
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
