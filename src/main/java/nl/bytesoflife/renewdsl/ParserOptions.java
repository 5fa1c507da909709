package nl.bytesoflife.renewdsl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Parser settings. Instances are immutable; the {@code with*} methods return copies.
 * <p>
 * {@link #defaults()} reads {@code /renewdsl/parser.properties} from the classpath and
 * lets {@code renewdsl.*} system properties override individual keys.
 */
public final class ParserOptions {

    static final String RESOURCE = "/renewdsl/parser.properties";

    static final String TAB_WIDTH = "renewdsl.tabWidth";
    static final String STRICT_DEDENT = "renewdsl.strictDedent";
    static final String VALIDATE_COORDINATES = "renewdsl.validateCoordinates";

    private static volatile ParserOptions cachedDefaults;

    private final int tabWidth;
    private final boolean strictDedent;
    private final boolean validateCoordinates;

    private ParserOptions(int tabWidth, boolean strictDedent, boolean validateCoordinates) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be >= 1, got " + tabWidth);
        }
        this.tabWidth = tabWidth;
        this.strictDedent = strictDedent;
        this.validateCoordinates = validateCoordinates;
    }

    public static ParserOptions defaults() {
        if (cachedDefaults == null) {
            synchronized (ParserOptions.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = fromProperties(loadResource(), System.getProperties());
                }
            }
        }
        return cachedDefaults;
    }

    /**
     * Builds options from a base property set, with {@code overrides} taking precedence.
     */
    static ParserOptions fromProperties(Properties base, Properties overrides) {
        return new ParserOptions(
                Integer.parseInt(lookup(TAB_WIDTH, base, overrides, "4").trim()),
                Boolean.parseBoolean(lookup(STRICT_DEDENT, base, overrides, "false").trim()),
                Boolean.parseBoolean(lookup(VALIDATE_COORDINATES, base, overrides, "false").trim()));
    }

    private static String lookup(String key, Properties base, Properties overrides, String fallback) {
        String value = overrides.getProperty(key);
        return value != null ? value : base.getProperty(key, fallback);
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream is = ParserOptions.class.getResourceAsStream(RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + RESOURCE);
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
        return props;
    }

    /** Width a leading tab advances indentation to: the next multiple of this value. */
    public int tabWidth() {
        return tabWidth;
    }

    /** Whether a dedent must land exactly on a previously opened indentation level. */
    public boolean strictDedent() {
        return strictDedent;
    }

    /** Whether coordinates outside |lat| &lt;= 90, |lon| &lt;= 180 are rejected. */
    public boolean validateCoordinates() {
        return validateCoordinates;
    }

    public ParserOptions withTabWidth(int tabWidth) {
        return new ParserOptions(tabWidth, strictDedent, validateCoordinates);
    }

    public ParserOptions withStrictDedent(boolean strictDedent) {
        return new ParserOptions(tabWidth, strictDedent, validateCoordinates);
    }

    public ParserOptions withValidateCoordinates(boolean validateCoordinates) {
        return new ParserOptions(tabWidth, strictDedent, validateCoordinates);
    }

    @Override
    public String toString() {
        return "ParserOptions{tabWidth=" + tabWidth + ", strictDedent=" + strictDedent
                + ", validateCoordinates=" + validateCoordinates + "}";
    }
}
