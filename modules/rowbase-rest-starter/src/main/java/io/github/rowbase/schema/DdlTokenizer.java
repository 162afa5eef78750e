package io.github.rowbase.schema;

import io.github.rowbase.exception.SchemaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits DDL text into tokens. Understands the identifier quoting of the supported
 * databases, string literals with doubled or backslash escaped quotes, and SQL comments.
 */
final class DdlTokenizer {

    private final String text;
    private int pos;

    private DdlTokenizer(String text) {
        this.text = text;
    }

    static List<DdlToken> tokenize(String text) {
        return new DdlTokenizer(text).run();
    }

    private List<DdlToken> run() {
        List<DdlToken> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && peek(1) == '-') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '"' || c == '`') {
                tokens.add(new DdlToken(DdlToken.Type.QUOTED, readQuoted(c, c)));
            } else if (c == '[') {
                if (peek(1) == ']') {
                    tokens.add(new DdlToken(DdlToken.Type.SYMBOL, "[]"));
                    pos += 2;
                } else {
                    tokens.add(new DdlToken(DdlToken.Type.QUOTED, readQuoted('[', ']')));
                }
            } else if (c == '\'') {
                tokens.add(new DdlToken(DdlToken.Type.STRING, readString()));
            } else if (c == '(') {
                tokens.add(new DdlToken(DdlToken.Type.OPEN, "("));
                pos++;
            } else if (c == ')') {
                tokens.add(new DdlToken(DdlToken.Type.CLOSE, ")"));
                pos++;
            } else if (c == ',') {
                tokens.add(new DdlToken(DdlToken.Type.COMMA, ","));
                pos++;
            } else if (isWordChar(c)) {
                int start = pos;
                while (pos < text.length() && isWordChar(text.charAt(pos))) {
                    pos++;
                }
                tokens.add(new DdlToken(DdlToken.Type.WORD, text.substring(start, pos)));
            } else {
                tokens.add(new DdlToken(DdlToken.Type.SYMBOL, String.valueOf(c)));
                pos++;
            }
        }
        return tokens;
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private void skipLineComment() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment() {
        int end = text.indexOf("*/", pos + 2);
        pos = end < 0 ? text.length() : end + 2;
    }

    private String readQuoted(char open, char close) {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == close) {
                if (close != ']' && peek(1) == close) {
                    sb.append(c);
                    pos += 2;
                    continue;
                }
                pos++;
                return sb.toString();
            }
            sb.append(c);
            pos++;
        }
        throw new SchemaParseException("Unterminated quoted identifier at offset " + start + " (" + open + ")");
    }

    private String readString() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                sb.append(text.charAt(pos + 1));
                pos += 2;
            } else if (c == '\'') {
                if (peek(1) == '\'') {
                    sb.append(c);
                    pos += 2;
                } else {
                    pos++;
                    return sb.toString();
                }
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw new SchemaParseException("Unterminated string literal at offset " + start);
    }
}
