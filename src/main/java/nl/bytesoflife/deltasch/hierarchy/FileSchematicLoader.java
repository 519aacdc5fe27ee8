package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.parser.SchematicException;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads sheet files from disk relative to the directory of the referencing schematic. Each file
 * is parsed once; instances of a reused sheet share the same {@link Schematic}.
 */
public class FileSchematicLoader implements SchematicLoader {

    private static final Logger log = LoggerFactory.getLogger(FileSchematicLoader.class);

    private final SchematicParser parser;
    private final Path baseDirectory;
    private final Map<Path, Schematic> cache = new HashMap<>();

    public FileSchematicLoader(Path baseDirectory) {
        this(new SchematicParser(), baseDirectory);
    }

    public FileSchematicLoader(SchematicParser parser, Path baseDirectory) {
        this.parser = parser;
        this.baseDirectory = baseDirectory;
    }

    @Override
    public Schematic load(String filename, Schematic parent) throws LoadException {
        Path file = resolve(filename, parent);
        Schematic cached = cache.get(file);
        if (cached != null) {
            return cached;
        }
        if (!Files.isRegularFile(file)) {
            throw new LoadException(filename, "File not found: " + file);
        }
        try {
            Schematic schematic = parser.parse(file);
            cache.put(file, schematic);
            log.debug("Loaded sheet file {}", file);
            return schematic;
        } catch (IOException e) {
            throw new LoadException(filename, "Cannot read " + file + ": " + e.getMessage(), e);
        } catch (SchematicException e) {
            throw new LoadException(filename, "Cannot parse " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String identify(String filename, Schematic parent) {
        return resolve(filename, parent).toString();
    }

    public int cachedFiles() {
        return cache.size();
    }

    private Path resolve(String filename, Schematic parent) {
        Path directory = baseDirectory;
        if (parent != null && parent.getSourcePath() != null) {
            Path parentDirectory = parent.getSourcePath().toAbsolutePath().getParent();
            if (parentDirectory != null) {
                directory = parentDirectory;
            }
        }
        return directory.resolve(filename).toAbsolutePath().normalize();
    }
}
