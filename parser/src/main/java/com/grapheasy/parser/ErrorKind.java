package com.grapheasy.parser;

/** Discriminates the ways a parse can fail. Every kind aborts the parse. */
public enum ErrorKind {
    /** A bracket, brace or parenthesis opened but never closed. */
    UNTERMINATED_BLOCK,
    UNEXPECTED_TOKEN,
    UNEXPECTED_CHARACTER,
    /** An edge operator at end of input with no target node. */
    DANGLING_EDGE,
    UNMATCHED_GROUP_CLOSE,
    UNCLOSED_GROUP,
    /** A GDL node or edge block lacking {@code title}, {@code source} or {@code target}. */
    MISSING_REQUIRED_FIELD,
    MISSING_EDGE_OPERATOR,
    /** A {@code key: value} entry that does not parse. */
    INVALID_ATTRIBUTE,
    NESTING_TOO_DEEP,
    UNSUPPORTED_STATEMENT
}
