package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.Sheet;

/**
 * One placement of a sheet. A file used by two sheets has two instances with different paths.
 */
public class SheetInstance {

    private final Sheet sheet;
    private final String path;
    private final String uuidPath;
    private final String parentPath;

    SheetInstance(Sheet sheet, String path, String uuidPath, String parentPath) {
        this.sheet = sheet;
        this.path = path;
        this.uuidPath = uuidPath;
        this.parentPath = parentPath;
    }

    public Sheet getSheet() {
        return sheet;
    }

    public String getSheetName() {
        return sheet.getName();
    }

    public String getSheetUuid() {
        return sheet.getUuid();
    }

    public String getFilename() {
        return sheet.getFilename();
    }

    public String getPath() {
        return path;
    }

    /**
     * Instance path made of uuids, the form KiCad stores in symbol instance records.
     */
    public String getUuidPath() {
        return uuidPath;
    }

    public String getParentPath() {
        return parentPath;
    }

    @Override
    public String toString() {
        return path + " [" + getFilename() + "]";
    }
}
