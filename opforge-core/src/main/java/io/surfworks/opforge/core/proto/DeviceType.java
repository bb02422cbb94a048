package io.surfworks.opforge.core.proto;

/**
 * Physical execution target of a {@link DeviceOption}.
 */
public enum DeviceType {
    CPU,
    NVIDIA,
    AMD
}
