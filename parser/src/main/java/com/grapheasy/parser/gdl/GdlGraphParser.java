package com.grapheasy.parser.gdl;

import com.grapheasy.graph.Graph;
import com.grapheasy.parser.DebugFlags;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.GraphParser;
import com.grapheasy.parser.SourceLocation;
import com.grapheasy.parser.gdl.grammar.GdlLexer;
import com.grapheasy.parser.gdl.grammar.GdlParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parser for GDL/VCG {@code graph: { ... }} files. */
public final class GdlGraphParser implements GraphParser {
    private static final Logger LOG = LoggerFactory.getLogger(GdlGraphParser.class);

    @Override
    public Graph parse(String sourceName, String text) throws GraphParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");

        GdlLexer lexer = new GdlLexer(CharStreams.fromString(text, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        GdlParser parser = new GdlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens("gdl", describe(tokens.getTokens(), lexer));
                tokens.seek(0);
            }
            GdlParser.GraphFileContext context = parser.graphFile();
            Graph graph = new GdlGraphBuilder(sourceName).build(context);
            LOG.debug("Parsed GDL graph: {}", graph);
            return graph;
        } catch (ThrowingErrorListener.SyntaxError ex) {
            throw new GraphParseException(
                    ex.kind(), ex.getMessage(), new SourceLocation(sourceName, ex.line(), ex.column()), ex);
        }
    }

    private static List<String> describe(List<Token> tokens, GdlLexer lexer) {
        List<String> lines = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            String type = token.getType() == Token.EOF
                    ? "EOF"
                    : lexer.getVocabulary().getSymbolicName(token.getType());
            lines.add(String.format(Locale.ROOT, "%-8s @ %4d:%-3d -> %s",
                    type, token.getLine(), token.getCharPositionInLine() + 1, token.getText()));
        }
        return lines;
    }
}
