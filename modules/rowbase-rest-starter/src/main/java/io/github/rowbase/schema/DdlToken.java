package io.github.rowbase.schema;

/**
 * Token of a {@code CREATE TABLE} statement.
 */
final class DdlToken {

    enum Type {
        /** Bare word: keyword, unquoted identifier or number */
        WORD,
        /** Identifier in double quotes, back quotes or brackets, text without the quotes */
        QUOTED,
        /** Single quoted string literal, text without the quotes */
        STRING,
        OPEN,
        CLOSE,
        COMMA,
        SYMBOL
    }

    private final Type type;
    private final String text;

    DdlToken(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    boolean isWord(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    boolean isIdentifier() {
        return type == Type.WORD || type == Type.QUOTED;
    }

    @Override
    public String toString() {
        return switch (type) {
            case QUOTED -> "\"" + text + "\"";
            case STRING -> "'" + text + "'";
            default -> text;
        };
    }
}
