package io.surfworks.opforge.core.schema;

/**
 * Documentation of one operator argument.
 *
 * @param name        argument name
 * @param description free text
 * @param required    whether instances must supply the argument
 */
public record ArgumentDoc(String name, String description, boolean required) {
}
