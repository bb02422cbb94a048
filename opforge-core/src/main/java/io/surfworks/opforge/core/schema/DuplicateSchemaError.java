package io.surfworks.opforge.core.schema;

/**
 * Raised when a schema name is registered a second time.
 *
 * <p>This is an authoring bug in registration code, detected at load time.
 * It extends {@link Error} so that ordinary {@code catch (Exception e)} blocks
 * let it through: the host program is expected to terminate, since the
 * registry would otherwise hold whichever schema happened to win.
 */
public class DuplicateSchemaError extends Error {

    private final String schemaName;
    private final String file;
    private final int line;
    private final String existingFile;
    private final int existingLine;

    /**
     * @param schemaName   the conflicting operator type name
     * @param file         source file of the rejected registration
     * @param line         source line of the rejected registration
     * @param existingFile source file of the registration already present
     * @param existingLine source line of the registration already present
     */
    public DuplicateSchemaError(String schemaName, String file, int line, String existingFile, int existingLine) {
        super(String.format(
            "Trying to register schema with name %s from file %s line %d, "
                + "but it is already registered from file %s line %d",
            schemaName, file, line, existingFile, existingLine));
        this.schemaName = schemaName;
        this.file = file;
        this.line = line;
        this.existingFile = existingFile;
        this.existingLine = existingLine;
    }

    public String schemaName() {
        return schemaName;
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public String existingFile() {
        return existingFile;
    }

    public int existingLine() {
        return existingLine;
    }
}
