package nl.bytesoflife.renewdsl.parser;

import nl.bytesoflife.renewdsl.lexer.Token;

import java.util.List;

/**
 * Concrete parse tree. Punctuation, newlines and block markers are dropped;
 * keywords that select an attribute are kept as the first leaf of the attribute node.
 */
public sealed interface ParseNode permits ParseNode.Branch, ParseNode.Leaf {

    int line();

    int column();

    record Leaf(Token token) implements ParseNode {
        public String text() {
            return token.text();
        }

        @Override
        public int line() {
            return token.line();
        }

        @Override
        public int column() {
            return token.column();
        }

        @Override
        public String toString() {
            return token.text();
        }
    }

    record Branch(Rule rule, List<ParseNode> children, int line, int column) implements ParseNode {
        public Branch {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(rule.name().toLowerCase());
            for (ParseNode child : children) {
                sb.append(' ').append(child);
            }
            return sb.append(')').toString();
        }
    }
}
