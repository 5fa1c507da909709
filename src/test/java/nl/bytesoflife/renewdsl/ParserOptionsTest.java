package nl.bytesoflife.renewdsl;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ParserOptionsTest {

    @Test
    void bundledDefaults() {
        ParserOptions options = ParserOptions.fromProperties(load(), new Properties());
        assertEquals(4, options.tabWidth());
        assertFalse(options.strictDedent());
        assertFalse(options.validateCoordinates());
    }

    @Test
    void overridesTakePrecedence() {
        Properties overrides = new Properties();
        overrides.setProperty("renewdsl.tabWidth", "8");
        overrides.setProperty("renewdsl.strictDedent", "true");
        ParserOptions options = ParserOptions.fromProperties(load(), overrides);
        assertEquals(8, options.tabWidth());
        assertTrue(options.strictDedent());
        assertFalse(options.validateCoordinates());
    }

    @Test
    void missingKeysFallBack() {
        ParserOptions options = ParserOptions.fromProperties(new Properties(), new Properties());
        assertEquals(4, options.tabWidth());
    }

    @Test
    void withersReturnCopies() {
        ParserOptions base = ParserOptions.fromProperties(new Properties(), new Properties());
        ParserOptions changed = base.withValidateCoordinates(true).withTabWidth(2);
        assertFalse(base.validateCoordinates());
        assertTrue(changed.validateCoordinates());
        assertEquals(2, changed.tabWidth());
        assertEquals(4, base.tabWidth());
    }

    @Test
    void rejectsInvalidTabWidth() {
        ParserOptions base = ParserOptions.fromProperties(new Properties(), new Properties());
        assertThrows(IllegalArgumentException.class, () -> base.withTabWidth(0));
    }

    @Test
    void defaultsAreCached() {
        assertSame(ParserOptions.defaults(), ParserOptions.defaults());
    }

    private static Properties load() {
        Properties props = new Properties();
        try (var is = ParserOptions.class.getResourceAsStream(ParserOptions.RESOURCE)) {
            assertNotNull(is);
            props.load(is);
        } catch (java.io.IOException e) {
            fail(e);
        }
        return props;
    }
}
