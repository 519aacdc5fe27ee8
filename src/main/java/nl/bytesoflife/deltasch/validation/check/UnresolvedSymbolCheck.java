package nl.bytesoflife.deltasch.validation.check;

import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.symbol.SymbolResolver;
import nl.bytesoflife.deltasch.validation.SchematicCheck;
import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

public class UnresolvedSymbolCheck implements SchematicCheck {

    private final SymbolResolver resolver;

    public UnresolvedSymbolCheck(SymbolResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public List<ValidationIssue> check(Schematic schematic) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Component component : schematic.components()) {
            if (resolver.find(component.getLibId()).isEmpty()) {
                issues.add(ValidationIssue.warning("Symbol " + component.getLibId() + " of "
                        + component.getReference() + " cannot be resolved", "component", component.getUuid()));
            }
        }
        return issues;
    }

    @Override
    public String getName() {
        return "unresolved-symbol";
    }
}
