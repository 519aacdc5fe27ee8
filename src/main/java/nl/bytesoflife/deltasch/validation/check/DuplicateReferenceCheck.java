package nl.bytesoflife.deltasch.validation.check;

import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.validation.Severity;
import nl.bytesoflife.deltasch.validation.SchematicCheck;
import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Two placements with the same reference. Power symbols and unannotated references ending in
 * {@code ?} are exempt, and so are the units of one multi-unit part.
 */
public class DuplicateReferenceCheck implements SchematicCheck {

    @Override
    public List<ValidationIssue> check(Schematic schematic) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Map.Entry<String, List<Component>> entry : schematic.components().duplicateReferences().entrySet()) {
            String reference = entry.getKey();
            if (reference.endsWith("?") || reference.startsWith("#")) continue;
            List<Component> components = entry.getValue();
            long distinctUnits = components.stream().mapToInt(Component::getUnit).distinct().count();
            if (distinctUnits == components.size() && components.stream()
                    .map(Component::getLibId).distinct().count() == 1) {
                continue;
            }
            String next = schematic.components().generateReference(components.get(0).getLibId());
            issues.add(new ValidationIssue(Severity.ERROR,
                    "Reference " + reference + " is used by " + components.size() + " components",
                    "component", reference, null, List.of("rename one of them, e.g. to " + next)));
        }
        return issues;
    }

    @Override
    public String getName() {
        return "duplicate-reference";
    }
}
