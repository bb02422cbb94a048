package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.DeviceOption;

import java.util.Collections;
import java.util.List;

/**
 * Required device of each input and each output of an operator instance.
 *
 * @param inputDevices  one entry per input, in order
 * @param outputDevices one entry per output, in order
 */
public record DevicePlacement(
    List<DeviceOption> inputDevices,
    List<DeviceOption> outputDevices
) {
    public DevicePlacement {
        inputDevices = List.copyOf(inputDevices);
        outputDevices = List.copyOf(outputDevices);
    }

    /**
     * Every input and output on the same device.
     */
    public static DevicePlacement uniform(DeviceOption device, int inputCount, int outputCount) {
        return new DevicePlacement(
            Collections.nCopies(inputCount, device),
            Collections.nCopies(outputCount, device));
    }

    public DeviceOption inputDevice(int index) {
        return inputDevices.get(index);
    }

    public DeviceOption outputDevice(int index) {
        return outputDevices.get(index);
    }
}
