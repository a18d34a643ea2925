package com.pineparser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Turns comment-free Pine Script text into tokens, including the NEWLINE, INDENT and
 * DEDENT tokens that carry the block structure.
 *
 * <p>Lexical problems never throw here. They become {@link TokenType#ERROR} tokens with
 * the message in {@link Token#literal()}, and the parser reports them when (and if) it
 * reaches them.</p>
 */
public class Lexer {

    // Block indentation unit. A deeper line indented by something else wraps the previous line.
    private static final int BLOCK_INDENT = 4;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("and", TokenType.AND),
        Map.entry("or", TokenType.OR),
        Map.entry("not", TokenType.NOT),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("for", TokenType.FOR),
        Map.entry("to", TokenType.TO),
        Map.entry("by", TokenType.BY),
        Map.entry("in", TokenType.IN),
        Map.entry("while", TokenType.WHILE),
        Map.entry("switch", TokenType.SWITCH),
        Map.entry("var", TokenType.VAR),
        Map.entry("varip", TokenType.VARIP),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("as", TokenType.AS),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("break", TokenType.BREAK),
        Map.entry("continue", TokenType.CONTINUE)
    );

    private final String source;
    private final int length;
    private final int tabWidth;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;
    private int nesting = 0;     // open ( and [

    public Lexer(String source, int tabWidth) {
        this.source = source;
        this.length = source.length();
        this.tabWidth = tabWidth;
    }

    public List<Token> tokenize() {
        indents.push(0);
        boolean atLineStart = true;

        while (pos < length) {
            if (atLineStart && nesting == 0) {
                if (!scanIndentation()) {
                    continue;
                }
                atLineStart = false;
            }

            char c = source.charAt(pos);
            if (c == '\n') {
                if (nesting == 0) {
                    addNewline();
                    atLineStart = true;
                }
                nextLine();
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
                continue;
            }
            scanToken(c);
        }

        if (!tokens.isEmpty() && last().type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, column()));
        }
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, column()));
        }
        tokens.add(new Token(TokenType.EOF, "", line, column()));
        return tokens;
    }

    /**
     * Measures the indentation of the line starting at {@code pos} and emits the layout
     * tokens it implies. Returns false when the line is blank and has been skipped.
     */
    private boolean scanIndentation() {
        int width = 0;
        int p = pos;
        while (p < length) {
            char c = source.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / tabWidth + 1) * tabWidth;
            } else if (c != '\r' && c != '\f') {
                break;
            }
            p++;
        }

        if (p >= length) {
            pos = p;
            return false;
        }
        if (source.charAt(p) == '\n') {
            pos = p;
            nextLine();
            return false;
        }

        pos = p;
        int top = indents.peek();
        if (width > top) {
            if ((width - top) % BLOCK_INDENT != 0 && !tokens.isEmpty() && last().type() == TokenType.NEWLINE) {
                // Wrapped line: continue the previous logical line.
                tokens.remove(tokens.size() - 1);
            } else {
                indents.push(width);
                tokens.add(new Token(TokenType.INDENT, "", line, column()));
            }
        } else if (width < top) {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, column()));
            }
            if (width != indents.peek()) {
                tokens.add(new Token(TokenType.ERROR, "", "Unindent does not match any outer indentation level",
                    line, column()));
            }
        }
        return true;
    }

    private void scanToken(char c) {
        if (Character.isLetter(c) || c == '_') {
            scanIdentifier();
        } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekAt(1)))) {
            scanNumber();
        } else if (c == '"' || c == '\'') {
            scanString(c);
        } else if (c == '#') {
            scanColor();
        } else {
            scanOperator(c);
        }
    }

    private void scanIdentifier() {
        int start = pos;
        int col = column();
        while (pos < length && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        tokens.add(new Token(type, text, line, col));
    }

    private void scanNumber() {
        int start = pos;
        int col = column();
        boolean isFloat = false;

        while (pos < length && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (peekAt(0) == '.' && Character.isDigit(peekAt(1))) {
            isFloat = true;
            pos++;
            while (pos < length && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        char e = peekAt(0);
        if (e == 'e' || e == 'E') {
            char next = peekAt(1);
            boolean signed = (next == '+' || next == '-') && Character.isDigit(peekAt(2));
            if (Character.isDigit(next) || signed) {
                isFloat = true;
                pos += signed ? 2 : 1;
                while (pos < length && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
        }

        String text = source.substring(start, pos);
        if (isFloat) {
            tokens.add(new Token(TokenType.FLOAT, text, Double.parseDouble(text), line, col));
            return;
        }
        try {
            tokens.add(new Token(TokenType.INT, text, Long.parseLong(text), line, col));
        } catch (NumberFormatException ex) {
            tokens.add(new Token(TokenType.ERROR, text, "Integer literal out of range: " + text, line, col));
        }
    }

    private void scanString(char quote) {
        int start = pos;
        int col = column();
        StringBuilder value = new StringBuilder();
        pos++;

        while (pos < length) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                tokens.add(new Token(TokenType.STRING, source.substring(start, pos), value.toString(), line, col));
                return;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < length && source.charAt(pos + 1) != '\n') {
                char escaped = source.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(TokenType.ERROR, source.substring(start, pos), "Unterminated string literal", line, col));
    }

    private void scanColor() {
        int start = pos;
        int col = column();
        pos++;
        while (pos < length && Character.digit(source.charAt(pos), 16) >= 0) {
            pos++;
        }
        String text = source.substring(start, pos);
        int digits = text.length() - 1;
        if (digits == 6 || digits == 8) {
            tokens.add(new Token(TokenType.COLOR, text, line, col));
        } else {
            tokens.add(new Token(TokenType.ERROR, text, "Invalid color literal '" + text + "'", line, col));
        }
    }

    private void scanOperator(char c) {
        int col = column();
        char next = peekAt(1);

        TokenType twoChar = switch (c) {
            case ':' -> next == '=' ? TokenType.COLON_ASSIGN : null;
            case '=' -> next == '>' ? TokenType.ARROW : next == '=' ? TokenType.EQ : null;
            case '!' -> next == '=' ? TokenType.NE : null;
            case '<' -> next == '=' ? TokenType.LE : null;
            case '>' -> next == '=' ? TokenType.GE : null;
            case '+' -> next == '=' ? TokenType.PLUS_ASSIGN : null;
            case '-' -> next == '=' ? TokenType.MINUS_ASSIGN : null;
            case '*' -> next == '=' ? TokenType.STAR_ASSIGN : null;
            case '/' -> next == '=' ? TokenType.SLASH_ASSIGN : null;
            case '%' -> next == '=' ? TokenType.PERCENT_ASSIGN : null;
            default -> null;
        };
        if (twoChar != null) {
            tokens.add(new Token(twoChar, source.substring(pos, pos + 2), line, col));
            pos += 2;
            return;
        }

        TokenType type = switch (c) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '=' -> TokenType.ASSIGN;
            case '<' -> TokenType.LT;
            case '>' -> TokenType.GT;
            case '?' -> TokenType.QUESTION;
            case ':' -> TokenType.COLON;
            case '.' -> TokenType.DOT;
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            default -> TokenType.ERROR;
        };

        if (type == TokenType.LPAREN || type == TokenType.LBRACKET) {
            nesting++;
        } else if ((type == TokenType.RPAREN || type == TokenType.RBRACKET) && nesting > 0) {
            nesting--;
        }

        String text = String.valueOf(c);
        if (type == TokenType.ERROR) {
            tokens.add(new Token(type, text, "Unexpected character '" + c + "'", line, col));
        } else {
            tokens.add(new Token(type, text, line, col));
        }
        pos++;
    }

    private void addNewline() {
        if (!tokens.isEmpty() && last().type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "\n", line, column()));
        }
    }

    private void nextLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private char peekAt(int offset) {
        int p = pos + offset;
        return p < length ? source.charAt(p) : '\0';
    }

    private Token last() {
        return tokens.get(tokens.size() - 1);
    }
}
