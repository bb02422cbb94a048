package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;

/**
 * Determines where each input and output of an operator instance must live.
 */
@FunctionalInterface
public interface DeviceInferenceFunction {

    DevicePlacement infer(OperatorDef def);
}
