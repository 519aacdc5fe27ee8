package nl.bytesoflife.deltasch.model;

@FunctionalInterface
public interface ElementListener {

    void elementChanged(SchematicElement element);
}
