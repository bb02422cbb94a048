package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.TensorShape;

import java.util.List;

/**
 * Infers output types and shapes of an operator instance from its input shapes,
 * without executing it.
 *
 * @see TensorInference for the stock implementations
 */
@FunctionalInterface
public interface TensorInferenceFunction {

    /**
     * @param def    the operator instance
     * @param inputs type and shape of each input, in order
     * @return type and shape of each output, in order
     */
    List<TensorShape> infer(OperatorDef def, List<TensorShape> inputs);
}
