package nl.bytesoflife.deltasch.validation.check;

import nl.bytesoflife.deltasch.collection.IndexedCollection;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.SchematicElement;
import nl.bytesoflife.deltasch.validation.SchematicCheck;
import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class DuplicateUuidCheck implements SchematicCheck {

    @Override
    public List<ValidationIssue> check(Schematic schematic) {
        Map<String, SchematicElement> seen = new HashMap<>();
        List<ValidationIssue> issues = new ArrayList<>();
        for (IndexedCollection<?> collection : schematic.collections()) {
            for (SchematicElement element : collection) {
                String uuid = element.getUuid();
                if (uuid == null) continue;
                SchematicElement first = seen.putIfAbsent(uuid, element);
                if (first != null) {
                    issues.add(ValidationIssue.error("uuid " + uuid + " of " + element.getTag()
                            + " is already used by " + first.getTag(), element.getTag(), uuid));
                }
            }
        }
        return issues;
    }

    @Override
    public String getName() {
        return "duplicate-uuid";
    }
}
