package nl.bytesoflife.deltasch.writer;

import nl.bytesoflife.deltasch.config.SchematicConfig;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.sexpr.FormatMode;
import nl.bytesoflife.deltasch.sexpr.FormattingRules;
import nl.bytesoflife.deltasch.sexpr.SExpressionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Saves schematics, by default reproducing every untouched byte of the file they were read from.
 */
public class SchematicWriter {

    private static final Logger log = LoggerFactory.getLogger(SchematicWriter.class);

    private FormatMode mode;
    private FormattingRules rules = FormattingRules.kicad();
    private String backupSuffix;

    public SchematicWriter() {
        SchematicConfig config = SchematicConfig.defaults();
        this.mode = config.getEnum(SchematicConfig.WRITER_MODE, FormatMode.class);
        this.rules.withDecimals(config.getInt(SchematicConfig.WRITER_DECIMALS));
    }

    public SchematicWriter withMode(FormatMode mode) {
        this.mode = mode;
        return this;
    }

    public SchematicWriter withRules(FormattingRules rules) {
        this.rules = rules;
        return this;
    }

    /**
     * Copies an existing target file to {@code target + suffix} before overwriting it.
     */
    public SchematicWriter backup(String suffix) {
        this.backupSuffix = suffix;
        return this;
    }

    /**
     * Enables backups with the configured suffix, {@code .bak} unless overridden.
     */
    public SchematicWriter backup() {
        return backup(SchematicConfig.defaults().getString(SchematicConfig.WRITER_BACKUP_SUFFIX));
    }

    public String write(Schematic schematic) {
        return new SExpressionWriter(mode, rules).write(schematic.getDocument());
    }

    /**
     * Writes UTF-8 text to {@code file} and marks the schematic clean.
     */
    public void write(Schematic schematic, Path file) throws IOException {
        String text = write(schematic);
        if (backupSuffix != null && Files.exists(file)) {
            Path backup = file.resolveSibling(file.getFileName() + backupSuffix);
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Backed up {} to {}", file, backup);
        }
        Files.writeString(file, text, StandardCharsets.UTF_8);
        schematic.markClean();
        schematic.setSourcePath(file);
        log.info("Wrote {} ({} characters, mode {})", file, text.length(), mode);
    }
}
