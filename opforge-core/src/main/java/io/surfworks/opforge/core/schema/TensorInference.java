package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.ScalarType;
import io.surfworks.opforge.core.proto.TensorShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stock tensor inference functions.
 *
 * <p>All of them produce exactly one shape per output declared by the operator
 * instance. Functions that copy from a particular input throw
 * {@link IllegalArgumentException} when that input (or dimension) is absent.
 */
public final class TensorInference {

    private static final TensorInferenceFunction UNKNOWN_OUTPUTS =
        (def, inputs) -> Collections.nCopies(def.outputCount(), TensorShape.unknown());

    private static final TensorInferenceFunction IDENTICAL = (def, inputs) -> {
        List<TensorShape> out = new ArrayList<>(def.outputCount());
        for (int i = 0; i < def.outputCount(); i++) {
            out.add(requireInput(def, inputs, i));
        }
        return out;
    };

    private TensorInference() {} // Utility class

    /**
     * Marks every output as unknown. The default for schemas without a
     * registered function.
     */
    public static TensorInferenceFunction unknownOutputs() {
        return UNKNOWN_OUTPUTS;
    }

    /**
     * Output i has the type and shape of input i.
     */
    public static TensorInferenceFunction identicalTypeAndShape() {
        return IDENTICAL;
    }

    /**
     * Every output has the type and shape of input {@code index}.
     */
    public static TensorInferenceFunction identicalTypeAndShapeOfInput(int index) {
        checkIndex(index, "input index");
        return (def, inputs) -> Collections.nCopies(def.outputCount(), requireInput(def, inputs, index));
    }

    /**
     * Every output is a 1-D tensor whose single dimension equals dimension
     * {@code dim} of input {@code index}, with that input's element type.
     */
    public static TensorInferenceFunction identicalTypeAndShapeOfInputDim(int index, int dim) {
        checkIndex(index, "input index");
        checkIndex(dim, "dimension");
        return (def, inputs) -> {
            TensorShape source = requireInput(def, inputs, index);
            if (dim >= source.rank()) {
                throw new IllegalArgumentException(
                    def.type() + ": input " + index + " has rank " + source.rank()
                        + ", no dimension " + dim);
            }
            TensorShape vector = TensorShape.of(source.dataType(), source.dim(dim));
            return Collections.nCopies(def.outputCount(), vector);
        };
    }

    /**
     * Output i takes the dims of input i and element type {@code type}.
     * When there are fewer inputs than outputs the remaining outputs take
     * input 0's dims; with no inputs at all, outputs are scalars.
     */
    public static TensorInferenceFunction scalarType(ScalarType type) {
        Objects.requireNonNull(type, "type cannot be null");
        return (def, inputs) -> {
            List<TensorShape> out = new ArrayList<>(def.outputCount());
            for (int i = 0; i < def.outputCount(); i++) {
                if (inputs.isEmpty()) {
                    out.add(TensorShape.of(type));
                } else {
                    TensorShape source = i < inputs.size() ? inputs.get(i) : inputs.get(0);
                    out.add(source.withDataType(type));
                }
            }
            return out;
        };
    }

    private static TensorShape requireInput(OperatorDef def, List<TensorShape> inputs, int index) {
        if (index >= inputs.size()) {
            throw new IllegalArgumentException(
                def.type() + ": shape of input " + index + " requested but only "
                    + inputs.size() + " input shapes given");
        }
        return inputs.get(index);
    }

    private static void checkIndex(int value, String what) {
        if (value < 0) {
            throw new IllegalArgumentException(what + " must be non-negative, got " + value);
        }
    }
}
