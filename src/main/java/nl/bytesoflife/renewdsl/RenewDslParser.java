package nl.bytesoflife.renewdsl;

import nl.bytesoflife.renewdsl.lexer.IndentPreprocessor;
import nl.bytesoflife.renewdsl.lexer.RenewLexer;
import nl.bytesoflife.renewdsl.lexer.Token;
import nl.bytesoflife.renewdsl.model.Model;
import nl.bytesoflife.renewdsl.parser.ModelTransformer;
import nl.bytesoflife.renewdsl.parser.ParseNode;
import nl.bytesoflife.renewdsl.parser.SyntaxParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses site description documents into a {@link Model}.
 * <p>
 * The pipeline is preprocess, tokenize, parse, transform. Every call builds its own
 * stage instances, so one parser can be shared between threads. A document either
 * parses completely or fails with a {@link RenewDslException}.
 */
public class RenewDslParser {

    private static final Logger log = LoggerFactory.getLogger(RenewDslParser.class);

    private final ParserOptions options;

    public RenewDslParser() {
        this(ParserOptions.defaults());
    }

    public RenewDslParser(ParserOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Options must not be null");
        }
        this.options = options;
    }

    public Model parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Document text must not be null");
        }
        long start = System.currentTimeMillis();

        String marked = new IndentPreprocessor(options.tabWidth(), options.strictDedent()).process(text);
        List<Token> tokens = new RenewLexer().tokenize(marked);
        ParseNode.Branch tree = new SyntaxParser(tokens).parseDocument();
        Model model = new ModelTransformer(options).transform(tree);

        log.debug("Parsed document: {} tokens, {} equipment, {} layouts in {}ms",
                tokens.size(), model.equipment().size(), model.layouts().size(),
                System.currentTimeMillis() - start);
        return model;
    }

    public Model parse(InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(content);
    }

    public Model parse(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }
}
