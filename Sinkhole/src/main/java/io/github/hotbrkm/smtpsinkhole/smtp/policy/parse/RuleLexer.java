package io.github.hotbrkm.smtpsinkhole.smtp.policy.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits rule file text into tokens.
 * <p>
 * Lines whose first non-blank character is {@code #} are comments. A
 * backslash followed only by blanks up to the end of the line joins the next
 * line to this one. Double-quoted strings may span lines and use {@code \"} and
 * {@code \\} escapes. Every line end outside a string is a NEWLINE token.
 * </p>
 */
public class RuleLexer {

    private final String source;
    private final String text;
    private int pos;
    private int line = 1;
    private boolean lineStart = true;

    public RuleLexer(String source, String text) {
        this.source = source;
        this.text = text;
    }

    public List<RuleToken> tokenize() throws RuleParseException {
        List<RuleToken> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                tokens.add(new RuleToken(RuleToken.Type.NEWLINE, "", line));
                pos++;
                line++;
                lineStart = true;
            } else if (c == '\\' && isContinuation(pos)) {
                skipContinuation();
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' && lineStart) {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                lineStart = false;
                tokens.add(nextToken(c));
            }
        }
        tokens.add(new RuleToken(RuleToken.Type.EOF, "", line));
        return tokens;
    }

    private RuleToken nextToken(char c) throws RuleParseException {
        switch (c) {
            case '(':
                pos++;
                return new RuleToken(RuleToken.Type.LPAREN, "", line);
            case ')':
                pos++;
                return new RuleToken(RuleToken.Type.RPAREN, "", line);
            case ';':
                pos++;
                return new RuleToken(RuleToken.Type.SEMICOLON, "", line);
            case '"':
                return readString();
            default:
                return readWord();
        }
    }

    private RuleToken readString() throws RuleParseException {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()
                    && (text.charAt(pos + 1) == '"' || text.charAt(pos + 1) == '\\')) {
                sb.append(text.charAt(pos + 1));
                pos += 2;
            } else if (c == '"') {
                pos++;
                if (pos < text.length() && isWordChar(text.charAt(pos))) {
                    throw new RuleParseException(source, line, "quoted string is followed by text");
                }
                return new RuleToken(RuleToken.Type.STRING, sb.toString(), startLine);
            } else {
                if (c == '\n') {
                    line++;
                }
                sb.append(c);
                pos++;
            }
        }
        throw new RuleParseException(source, startLine, "unterminated quoted string");
    }

    private RuleToken readWord() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (!isWordChar(c) || (c == '\\' && isContinuation(pos))) {
                break;
            }
            pos++;
        }
        return new RuleToken(RuleToken.Type.WORD, text.substring(start, pos), line);
    }

    private boolean isContinuation(int backslash) {
        int i = backslash + 1;
        while (i < text.length() && text.charAt(i) != '\n') {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
            i++;
        }
        return true;
    }

    private void skipContinuation() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
        if (pos < text.length()) {
            pos++;
            line++;
        }
    }

    private static boolean isWordChar(char c) {
        return !Character.isWhitespace(c) && c != '(' && c != ')' && c != ';' && c != '"';
    }
}
