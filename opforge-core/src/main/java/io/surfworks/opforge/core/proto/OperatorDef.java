package io.surfworks.opforge.core.proto;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator descriptor: one use of an operator type with bound input/output
 * names, arguments and an optional device placement.
 *
 * <p>Inputs and outputs are referenced by blob name; two positions sharing a
 * name denote storage aliasing (in-place execution).
 *
 * @param type      operator type name (e.g., "Sum")
 * @param name      optional instance name, empty if none
 * @param inputs    input blob names, in order
 * @param outputs   output blob names, in order
 * @param arguments arguments, in declaration order
 * @param device    device placement, or null if none declared
 */
public record OperatorDef(
    String type,
    String name,
    List<String> inputs,
    List<String> outputs,
    List<Argument> arguments,
    DeviceOption device
) {
    public OperatorDef {
        Objects.requireNonNull(type, "type cannot be null");
        name = name == null ? "" : name;
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        arguments = List.copyOf(arguments);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public int inputCount() {
        return inputs.size();
    }

    public int outputCount() {
        return outputs.size();
    }

    public String input(int index) {
        return inputs.get(index);
    }

    public String output(int index) {
        return outputs.get(index);
    }

    /**
     * Get the device placement, if declared.
     */
    public Optional<DeviceOption> deviceOption() {
        return Optional.ofNullable(device);
    }

    public boolean hasDeviceOption() {
        return device != null;
    }

    /**
     * First argument with the given name.
     */
    public Optional<Argument> argument(String argName) {
        for (Argument arg : arguments) {
            if (arg.name().equals(argName)) {
                return Optional.of(arg);
            }
        }
        return Optional.empty();
    }

    public boolean hasArgument(String argName) {
        return argument(argName).isPresent();
    }

    public long getLong(String argName, long defaultValue) {
        return argument(argName).map(Argument::asLong).orElse(defaultValue);
    }

    public double getDouble(String argName, double defaultValue) {
        return argument(argName).map(Argument::asDouble).orElse(defaultValue);
    }

    public String getString(String argName, String defaultValue) {
        return argument(argName).map(Argument::asString).orElse(defaultValue);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type);
        if (!name.isEmpty()) {
            sb.append(" '").append(name).append("'");
        }
        sb.append(" inputs=").append(inputs);
        sb.append(" outputs=").append(outputs);
        if (!arguments.isEmpty()) {
            sb.append(" args=[");
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i).name()).append('=').append(arguments.get(i).value());
            }
            sb.append("]");
        }
        if (device != null) {
            sb.append(" device=").append(device);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final String type;
        private String name = "";
        private final List<String> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private final List<Argument> arguments = new ArrayList<>();
        private DeviceOption device;

        private Builder(String type) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder input(String input) {
            inputs.add(Objects.requireNonNull(input));
            return this;
        }

        public Builder inputs(String... names) {
            for (String input : names) {
                input(input);
            }
            return this;
        }

        public Builder output(String output) {
            outputs.add(Objects.requireNonNull(output));
            return this;
        }

        public Builder outputs(String... names) {
            for (String output : names) {
                output(output);
            }
            return this;
        }

        public Builder argument(Argument argument) {
            arguments.add(Objects.requireNonNull(argument));
            return this;
        }

        public Builder device(DeviceOption device) {
            this.device = device;
            return this;
        }

        public OperatorDef build() {
            return new OperatorDef(type, name, inputs, outputs, arguments, device);
        }
    }
}
