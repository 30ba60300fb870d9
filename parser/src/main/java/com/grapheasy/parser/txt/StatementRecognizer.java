package com.grapheasy.parser.txt;

import com.grapheasy.parser.GraphParseException;
import java.util.Optional;

/** Claims a logical line as one kind of {@link Statement}, or declines it. */
@FunctionalInterface
interface StatementRecognizer {

    /**
     * @param line the logical line with comments cut and surrounding whitespace removed
     * @return the statement, or empty to let the next recognizer try
     */
    Optional<Statement> recognize(String line, TxtParseState state) throws GraphParseException;
}
