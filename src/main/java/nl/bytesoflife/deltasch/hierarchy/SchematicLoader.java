package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.Schematic;

/**
 * Supplies the schematics referenced by sheets.
 */
public interface SchematicLoader {

    /**
     * Loads {@code filename} as referenced from {@code parent}.
     *
     * @param parent the schematic holding the sheet, {@code null} for the root
     */
    Schematic load(String filename, Schematic parent) throws LoadException;

    /**
     * Key under which two references denote the same file. Used for cycle detection and reuse
     * grouping; the default compares the names as written.
     */
    default String identify(String filename, Schematic parent) {
        return filename;
    }
}
