package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits signature and definition text into tokens. Text continued over several
 * lines is scanned as one stream while every token keeps its own source span.
 */
public class TokenScanner {

    /** A piece of source text starting at a known line and column. */
    public static final class Segment {
        final int line;
        final int column;
        final String text;

        public Segment(int line, int column, String text) {
            this.line = line;
            this.column = column;
            this.text = text;
        }
    }

    private final String source;
    private final int[] lines;
    private final int[] columns;
    private final List<Token> tokens = new ArrayList<>();
    private int position;

    public static TokenScanner of(int line, int column, String text) {
        return new TokenScanner(List.of(new Segment(line, column, text)));
    }

    public TokenScanner(List<Segment> segments) {
        StringBuilder builder = new StringBuilder();
        List<int[]> positions = new ArrayList<>();
        for (Segment segment : segments) {
            if (builder.length() > 0) {
                int[] last = positions.get(positions.size() - 1);
                builder.append(' ');
                positions.add(new int[]{last[0], last[1] + 1});
            }
            for (int i = 0; i < segment.text.length(); i++) {
                builder.append(segment.text.charAt(i));
                positions.add(new int[]{segment.line, segment.column + i});
            }
        }
        Segment lastSegment = segments.get(segments.size() - 1);
        int[] end = positions.isEmpty()
                ? new int[]{lastSegment.line, lastSegment.column}
                : new int[]{positions.get(positions.size() - 1)[0], positions.get(positions.size() - 1)[1] + 1};
        positions.add(end);

        this.source = builder.toString();
        this.lines = new int[positions.size()];
        this.columns = new int[positions.size()];
        for (int i = 0; i < positions.size(); i++) {
            lines[i] = positions.get(i)[0];
            columns[i] = positions.get(i)[1];
        }
        tokenize();
    }

    public Token peek() {
        return tokens.get(position);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(position + ahead, tokens.size() - 1));
    }

    public Token next() {
        Token token = tokens.get(position);
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean accept(TokenType type) {
        if (check(type)) {
            next();
            return true;
        }
        return false;
    }

    public Token expect(TokenType type, String what) throws RuneSyntaxException {
        Token token = peek();
        if (!token.is(type)) {
            throw new RuneSyntaxException("expected " + what + " but found " + token, token.span);
        }
        return next();
    }

    public void expectEnd() throws RuneSyntaxException {
        Token token = peek();
        if (!token.is(TokenType.END)) {
            throw new RuneSyntaxException("unexpected " + token + " after the end of the expression", token.span);
        }
    }

    /** Span of everything consumed since {@code first}, inclusive. */
    public SourceSpan spanFrom(Token first) {
        Token last = position > 0 ? tokens.get(position - 1) : first;
        return first.span.to(last.span);
    }

    private void tokenize() {
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                add(TokenType.IDENTIFIER, start, i);
            } else if (c == '"') {
                int start = i++;
                while (i < length && source.charAt(i) != '"') {
                    i++;
                }
                if (i < length) {
                    add(TokenType.STRING, start, ++i);
                } else {
                    add(TokenType.UNKNOWN, start, i);
                }
            } else if (c == ':' && i + 1 < length && source.charAt(i + 1) == ':') {
                add(TokenType.DOUBLE_COLON, i, i + 2);
                i += 2;
            } else {
                add(punctuation(c), i, i + 1);
                i++;
            }
        }
        tokens.add(new Token(TokenType.END, "", span(length, length)));
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            case '<' -> TokenType.LESS;
            case '>' -> TokenType.GREATER;
            case ',' -> TokenType.COMMA;
            case '|' -> TokenType.PIPE;
            case ':' -> TokenType.COLON;
            case '.' -> TokenType.DOT;
            case '?' -> TokenType.QUESTION;
            default -> TokenType.UNKNOWN;
        };
    }

    private void add(TokenType type, int start, int end) {
        tokens.add(new Token(type, source.substring(start, end), span(start, end)));
    }

    private SourceSpan span(int start, int end) {
        if (end <= start) {
            return new SourceSpan(lines[start], columns[start], lines[start], columns[start]);
        }
        return new SourceSpan(lines[start], columns[start], lines[end - 1], columns[end - 1] + 1);
    }
}
