package io.surfworks.opforge.operators;

import io.surfworks.opforge.core.schema.InplacePair;
import io.surfworks.opforge.core.schema.OpSchemaProvider;
import io.surfworks.opforge.core.schema.OpSchemaRegistry;
import io.surfworks.opforge.core.schema.PointwiseCost;

import java.util.Set;

/**
 * Schemas of element-wise operators.
 */
public final class ElementwiseOpSchemas implements OpSchemaProvider {

    public static final String SUM = "Sum";

    @Override
    public void registerSchemas() {
        OpSchemaRegistry.register(SUM)
            .numInputs(1, Integer.MAX_VALUE)
            .numOutputs(1)
            .allowInplace(Set.of(InplacePair.of(0, 0)))
            .inputsCanCrossDevices()
            .identicalTypeAndShapeOfInput(0)
            .costInferenceFunction(new PointwiseCost(1))
            .doc("""
                Element-wise sum of each of the input tensors. The first input tensor can be
                used in-place as the output tensor, in which case the sum will be done in
                place and results will be accumulated in input0. All inputs and outputs must
                have the same shape and data type.
                """)
            .describeInput(0, "data_0", "First of the input tensors. Can be inplace.")
            .describeOutput(0, "sum", "Output tensor. Same dimension as inputs.");
    }
}
