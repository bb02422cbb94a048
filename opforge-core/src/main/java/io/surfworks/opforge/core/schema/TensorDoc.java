package io.surfworks.opforge.core.schema;

/**
 * Documentation of one input or output position.
 *
 * @param index       position among the inputs (or outputs)
 * @param name        display name
 * @param description free text
 */
public record TensorDoc(int index, String name, String description) {
}
