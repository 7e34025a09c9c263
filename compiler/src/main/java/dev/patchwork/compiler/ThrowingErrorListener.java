package dev.patchwork.compiler;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Turns the first ANTLR syntax error into a {@link LexException} or
 * {@link ParseException}. Replaces the console listener, so there is no recovery
 * and no multi-error report.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    private final String sourceName;

    ThrowingErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        if (recognizer instanceof Lexer) {
            Lexer lexer = (Lexer) recognizer;
            int size = lexer.getInputStream().size();
            int start = Math.min(lexer._tokenStartCharIndex, size);
            int end = Math.min(lexer.getInputStream().index() + 1, size);
            throw new LexException(sourceName, line, charPositionInLine + 1, start, Math.max(start, end), msg);
        }
        String found = "<unknown>";
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            found = token.getType() == Token.EOF ? "<EOF>" : token.getText();
        }
        throw new ParseException(sourceName, line, charPositionInLine + 1, found, msg);
    }
}
