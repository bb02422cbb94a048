package io.surfworks.opforge.core.docs;

import io.surfworks.opforge.core.schema.ArgumentDoc;
import io.surfworks.opforge.core.schema.OpSchema;
import io.surfworks.opforge.core.schema.OpSchemaRegistry;
import io.surfworks.opforge.core.schema.TensorDoc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Generates operator documentation as JSON.
 *
 * <p>Schemas marked private are left out. Output layout:
 * <pre>{@code
 * {
 *   "operators": [
 *     {
 *       "name": "Sum",
 *       "doc": "...",
 *       "source": "ElementwiseOpSchemas.java:42",
 *       "numInputs": "[1, inf]",
 *       "numOutputs": "1",
 *       "inplaceAllowed": "[(0, 0)]",
 *       "inplaceEnforced": "none",
 *       "inputsCanCrossDevices": true,
 *       "arguments": [ { "name": ..., "description": ..., "required": false } ],
 *       "inputs":  [ { "index": 0, "name": ..., "description": ... } ],
 *       "outputs": [ ... ]
 *     }
 *   ]
 * }
 * }</pre>
 */
public final class OpSchemaDocs {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private OpSchemaDocs() {} // Utility class

    /**
     * Documentation of every public schema in the registry, sorted by name.
     */
    public static JsonObject toJson() {
        return toJson(OpSchemaRegistry.schemas().values());
    }

    /**
     * Documentation of the public schemas among {@code schemas}, sorted by name.
     */
    public static JsonObject toJson(Collection<OpSchema> schemas) {
        List<OpSchema> visible = schemas.stream()
                .filter(schema -> !schema.isPrivate())
                .sorted(Comparator.comparing(OpSchema::name))
                .toList();

        JsonArray operators = new JsonArray();
        for (OpSchema schema : visible) {
            operators.add(describe(schema));
        }
        JsonObject root = new JsonObject();
        root.add("operators", operators);
        return root;
    }

    /**
     * Documentation of a single schema, whether private or not.
     */
    public static JsonObject describe(OpSchema schema) {
        JsonObject op = new JsonObject();
        op.addProperty("name", schema.name());
        op.addProperty("doc", schema.doc().strip());
        op.addProperty("source", schema.file() + ":" + schema.line());
        op.addProperty("numInputs", schema.inputRule().describe());
        op.addProperty("numOutputs", schema.outputRule().describe());
        op.addProperty("inplaceAllowed", schema.inplaceAllowedRule().describe());
        op.addProperty("inplaceEnforced", schema.inplaceEnforcedRule().describe());
        op.addProperty("inputsCanCrossDevices", schema.allowsInputsAcrossDevices());

        JsonArray args = new JsonArray();
        for (ArgumentDoc arg : schema.argumentDocs()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", arg.name());
            entry.addProperty("description", arg.description());
            entry.addProperty("required", arg.required());
            args.add(entry);
        }
        op.add("arguments", args);
        op.add("inputs", tensorDocs(schema.inputDocs()));
        op.add("outputs", tensorDocs(schema.outputDocs()));
        return op;
    }

    /**
     * Render the registry's documentation as pretty-printed JSON.
     */
    public static String render() {
        return GSON.toJson(toJson());
    }

    /**
     * Write the registry's documentation to {@code path}, creating parent directories.
     *
     * @throws IOException if writing fails
     */
    public static void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, render(), StandardCharsets.UTF_8);
    }

    private static JsonArray tensorDocs(List<TensorDoc> docs) {
        JsonArray array = new JsonArray();
        for (TensorDoc doc : docs) {
            JsonObject entry = new JsonObject();
            entry.addProperty("index", doc.index());
            entry.addProperty("name", doc.name());
            entry.addProperty("description", doc.description());
            array.add(entry);
        }
        return array;
    }
}
