package io.surfworks.opforge.core.schema;

/**
 * An (input index, output index) pair that may or must share storage.
 */
public record InplacePair(int input, int output) {

    public InplacePair {
        if (input < 0 || output < 0) {
            throw new IllegalArgumentException(
                "In-place indices must be non-negative, got (" + input + ", " + output + ")");
        }
    }

    public static InplacePair of(int input, int output) {
        return new InplacePair(input, output);
    }

    @Override
    public String toString() {
        return "(" + input + ", " + output + ")";
    }
}
