package io.surfworks.opforge.core.proto;

import java.util.Locale;
import java.util.Objects;

/**
 * Device placement annotation: where an operator, input or output lives.
 *
 * <p>Opaque to the schema engine beyond equality and copying.
 *
 * @param deviceType the device kind
 * @param deviceId   index of the device among devices of the same kind
 */
public record DeviceOption(DeviceType deviceType, int deviceId) {

    /**
     * The placement used when an operator declares none: host CPU 0.
     */
    public static final DeviceOption DEFAULT = new DeviceOption(DeviceType.CPU, 0);

    public DeviceOption {
        Objects.requireNonNull(deviceType, "deviceType cannot be null");
        if (deviceId < 0) {
            throw new IllegalArgumentException("deviceId must be non-negative, got " + deviceId);
        }
    }

    public static DeviceOption cpu() {
        return DEFAULT;
    }

    public static DeviceOption nvidia(int deviceId) {
        return new DeviceOption(DeviceType.NVIDIA, deviceId);
    }

    public static DeviceOption amd(int deviceId) {
        return new DeviceOption(DeviceType.AMD, deviceId);
    }

    /**
     * Returns the device name (e.g., "cpu", "nvidia:0", "amd:1").
     */
    public String deviceName() {
        if (deviceType == DeviceType.CPU) {
            return "cpu";
        }
        return deviceType.name().toLowerCase(Locale.ROOT) + ":" + deviceId;
    }

    @Override
    public String toString() {
        return deviceName();
    }
}
