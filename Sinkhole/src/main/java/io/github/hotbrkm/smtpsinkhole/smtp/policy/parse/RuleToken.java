package io.github.hotbrkm.smtpsinkhole.smtp.policy.parse;

/**
 * A lexical token of a rule file.
 *
 * @param type kind of token
 * @param text word or unescaped string contents; empty for punctuation
 * @param line line the token starts on
 */
public record RuleToken(Type type, String text, int line) {

    public enum Type {
        WORD,
        STRING,
        LPAREN,
        RPAREN,
        SEMICOLON,
        NEWLINE,
        EOF
    }

    public boolean isWord(String word) {
        return type == Type.WORD && text.equals(word);
    }

    /**
     * @return how the token reads in an error message
     */
    public String describe() {
        return switch (type) {
            case WORD -> "'" + text + "'";
            case STRING -> "quoted string";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case SEMICOLON -> "';'";
            case NEWLINE -> "end of line";
            case EOF -> "end of file";
        };
    }
}
