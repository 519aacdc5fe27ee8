package nl.bytesoflife.deltasch.validation.check;

import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.SheetPin;
import nl.bytesoflife.deltasch.validation.SchematicCheck;
import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sheets need a file name, and pin names must be unique per sheet.
 */
public class SheetFileCheck implements SchematicCheck {

    @Override
    public List<ValidationIssue> check(Schematic schematic) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Sheet sheet : schematic.sheets()) {
            if (sheet.getFilename().isBlank()) {
                issues.add(ValidationIssue.error("Sheet '" + sheet.getName() + "' has no file name",
                        "sheet", sheet.getUuid()));
            }
            Set<String> names = new HashSet<>();
            for (SheetPin pin : sheet.getPins()) {
                if (!names.add(pin.getName())) {
                    issues.add(ValidationIssue.error("Sheet '" + sheet.getName() + "' has more than one pin named "
                            + pin.getName(), "sheet_pin", pin.getUuid()));
                }
            }
        }
        return issues;
    }

    @Override
    public String getName() {
        return "sheet-file";
    }
}
