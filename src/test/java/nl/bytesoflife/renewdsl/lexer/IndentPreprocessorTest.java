package nl.bytesoflife.renewdsl.lexer;

import nl.bytesoflife.renewdsl.DslSyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndentPreprocessorTest {

    private final IndentPreprocessor preprocessor = new IndentPreprocessor();

    @Test
    void flatTextIsUnchanged() {
        assertEquals("a\nb\nc", preprocessor.process("a\nb\nc"));
    }

    @Test
    void indentPrefixesLineAndClosesAtEnd() {
        String out = preprocessor.process("site:\n    location: x\n");
        assertEquals("site:\n<INDENT>    location: x\n\n<DEDENT>", out);
    }

    @Test
    void closesAllOpenLevelsOnTrailingLine() {
        String out = preprocessor.process("a:\n    b:\n        c");
        assertEquals("a:\n<INDENT>    b:\n<INDENT>        c\n<DEDENT><DEDENT>", out);
    }

    @Test
    void dedentMarkersShareTheLineTheyClose() {
        String out = preprocessor.process("a:\n    b:\n        c\nd");
        assertEquals("a:\n<INDENT>    b:\n<INDENT>        c\n<DEDENT><DEDENT>d", out);
    }

    @Test
    void sameLevelLineKeepsItsWhitespace() {
        String out = preprocessor.process("a:\n    b\n    c");
        assertEquals("a:\n<INDENT>    b\n    c\n<DEDENT>", out);
    }

    @Test
    void deepJumpCountsAsSingleLevel() {
        String out = preprocessor.process("a:\n            b\nc");
        assertEquals("a:\n<INDENT>            b\n<DEDENT>c", out);
    }

    @Test
    void blankAndWhitespaceLinesPassThrough() {
        String out = preprocessor.process("a:\n    b\n\n   \n    c");
        assertEquals("a:\n<INDENT>    b\n\n   \n    c\n<DEDENT>", out);
    }

    @Test
    void commentOnlyLinesDoNotAffectIndentation() {
        String out = preprocessor.process("a:\n    b\n# note\n    c");
        assertEquals("a:\n<INDENT>    b\n# note\n    c\n<DEDENT>", out);
    }

    @Test
    void lineCountIsPreserved() {
        String text = "a:\n    b:\n        c\n\nd:\n    e\n";
        String out = preprocessor.process(text);
        // one extra line for the trailing dedent
        assertEquals(text.split("\n", -1).length + 1, out.split("\n", -1).length);
    }

    @Test
    void lenientDedentPopsPastUnmatchedLevel() {
        String out = preprocessor.process("a:\n        b\n    c");
        // width 4 was never opened: the level at 8 is popped and c stays at the base level
        assertEquals("a:\n<INDENT>        b\n<DEDENT>    c", out);
    }

    @Test
    void strictDedentRejectsUnmatchedLevel() {
        IndentPreprocessor strict = new IndentPreprocessor(4, true);
        DslSyntaxException e = assertThrows(DslSyntaxException.class,
                () -> strict.process("a:\n        b\n    c"));
        assertEquals(3, e.getLine());
    }

    @Test
    void strictDedentAcceptsMatchedLevels() {
        IndentPreprocessor strict = new IndentPreprocessor(4, true);
        assertEquals("a:\n<INDENT>    b:\n<INDENT>        c\n<DEDENT>    d\n<DEDENT>",
                strict.process("a:\n    b:\n        c\n    d"));
    }

    @Test
    void tabAdvancesToNextTabStop() {
        IndentPreprocessor pre = new IndentPreprocessor(4, false);
        assertEquals(4, pre.measureIndent("\tx", 1));
        assertEquals(4, pre.measureIndent("  \tx", 3));
        assertEquals(8, pre.measureIndent("\t\tx", 2));
        assertEquals(6, pre.measureIndent("\t  x", 3));
    }

    @Test
    void tabAndSpacesAtSameWidthAreSameLevel() {
        String out = preprocessor.process("a:\n\tb\n    c");
        assertEquals("a:\n<INDENT>\tb\n    c\n<DEDENT>", out);
    }

    @Test
    void rejectsNonPositiveTabWidth() {
        assertThrows(IllegalArgumentException.class, () -> new IndentPreprocessor(0, false));
    }
}
