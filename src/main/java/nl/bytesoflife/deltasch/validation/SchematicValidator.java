package nl.bytesoflife.deltasch.validation;

import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.symbol.SymbolResolver;
import nl.bytesoflife.deltasch.validation.check.DuplicateReferenceCheck;
import nl.bytesoflife.deltasch.validation.check.DuplicateUuidCheck;
import nl.bytesoflife.deltasch.validation.check.SheetFileCheck;
import nl.bytesoflife.deltasch.validation.check.UnresolvedSymbolCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class SchematicValidator {

    private static final Logger log = LoggerFactory.getLogger(SchematicValidator.class);

    private final List<SchematicCheck> checks = new ArrayList<>();

    /**
     * Validator with the standard checks. Symbols are checked only when a resolver is given.
     */
    public static SchematicValidator standard(SymbolResolver resolver) {
        SchematicValidator validator = new SchematicValidator()
                .registerCheck(new DuplicateReferenceCheck())
                .registerCheck(new DuplicateUuidCheck())
                .registerCheck(new SheetFileCheck());
        if (resolver != null) {
            validator.registerCheck(new UnresolvedSymbolCheck(resolver));
        }
        return validator;
    }

    public SchematicValidator registerCheck(SchematicCheck check) {
        checks.add(check);
        return this;
    }

    public ValidationReport run(Schematic schematic) {
        ValidationReport report = new ValidationReport();
        for (SchematicCheck check : checks) {
            List<ValidationIssue> issues = check.check(schematic);
            if (!issues.isEmpty()) {
                log.debug("Check {} reported {} issues", check.getName(), issues.size());
            }
            report.addAll(issues);
        }
        return report;
    }
}
