package nl.bytesoflife.deltasch.parser;

import nl.bytesoflife.deltasch.config.SchematicConfig;

/**
 * Parser settings, starting from {@link SchematicConfig#defaults()}.
 */
public class ParserOptions {

    private boolean strict;
    private boolean comments;
    private int minVersion;
    private int maxVersion;

    private ParserOptions(SchematicConfig config) {
        this.strict = config.getBoolean(SchematicConfig.PARSER_STRICT);
        this.comments = config.getBoolean(SchematicConfig.PARSER_COMMENTS);
        this.minVersion = config.getInt(SchematicConfig.VERSION_MIN);
        this.maxVersion = config.getInt(SchematicConfig.VERSION_MAX);
    }

    public static ParserOptions defaults() {
        return new ParserOptions(SchematicConfig.defaults());
    }

    public static ParserOptions from(SchematicConfig config) {
        return new ParserOptions(config);
    }

    public static ParserOptions strict() {
        return defaults().withStrict(true);
    }

    /**
     * Unknown top-level elements are kept as opaque items instead of failing the parse.
     */
    public static ParserOptions permissive() {
        return defaults().withStrict(false);
    }

    public ParserOptions withStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public ParserOptions withComments(boolean comments) {
        this.comments = comments;
        return this;
    }

    public ParserOptions withVersionRange(int minVersion, int maxVersion) {
        if (minVersion > maxVersion) {
            throw new IllegalArgumentException("Empty version range " + minVersion + ".." + maxVersion);
        }
        this.minVersion = minVersion;
        this.maxVersion = maxVersion;
        return this;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isComments() {
        return comments;
    }

    public int getMinVersion() {
        return minVersion;
    }

    public int getMaxVersion() {
        return maxVersion;
    }
}
