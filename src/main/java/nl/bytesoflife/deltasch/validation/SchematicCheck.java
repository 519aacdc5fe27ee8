package nl.bytesoflife.deltasch.validation;

import nl.bytesoflife.deltasch.model.Schematic;

import java.util.List;

public interface SchematicCheck {

    List<ValidationIssue> check(Schematic schematic);

    String getName();
}
