package com.grapheasy.parser.gdl;

import com.grapheasy.parser.ErrorKind;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Aborts lexing or parsing on the first syntax error. */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    /** Carries the position and error kind out of the ANTLR runtime. */
    static final class SyntaxError extends ParseCancellationException {
        private final ErrorKind kind;
        private final int line;
        private final int column;

        SyntaxError(ErrorKind kind, int line, int column, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
            this.line = line;
            this.column = column;
        }

        ErrorKind kind() {
            return kind;
        }

        int line() {
            return line;
        }

        int column() {
            return column;
        }
    }

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        ErrorKind kind;
        if (recognizer instanceof Lexer) {
            kind = ErrorKind.UNEXPECTED_CHARACTER;
        } else if (offendingSymbol instanceof Token token && token.getType() == Token.EOF) {
            kind = ErrorKind.UNTERMINATED_BLOCK;
        } else {
            kind = ErrorKind.UNEXPECTED_TOKEN;
        }
        throw new SyntaxError(kind, line, charPositionInLine + 1, msg, e);
    }
}
