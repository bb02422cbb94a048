package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;
import io.surfworks.opforge.core.proto.TensorShape;

import java.util.List;

/**
 * Estimates the cost of an operator instance from its input shapes.
 */
@FunctionalInterface
public interface CostInferenceFunction {

    Cost infer(OperatorDef def, List<TensorShape> inputs);
}
