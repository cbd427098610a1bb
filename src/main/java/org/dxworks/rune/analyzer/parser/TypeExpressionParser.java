package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.SourceSpan;
import org.dxworks.rune.model.TypeExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code a | b}, {@code name[]}, {@code Generic<a, b>}, tuples {@code [a, b]}
 * and string enumerations {@code "a" | "b"}.
 */
public final class TypeExpressionParser {

    private TypeExpressionParser() {}

    /** One or more types joined by {@code |}. */
    public static TypeExpression parseUnion(TokenScanner scanner) throws RuneSyntaxException {
        Token first = scanner.peek();
        List<TypeExpression> members = new ArrayList<>();
        members.add(parseSingle(scanner));
        while (scanner.accept(TokenType.PIPE)) {
            members.add(parseSingle(scanner));
        }
        if (members.size() == 1) {
            return members.get(0);
        }
        return TypeExpression.union(members, scanner.spanFrom(first));
    }

    public static TypeExpression parseSingle(TokenScanner scanner) throws RuneSyntaxException {
        Token first = scanner.peek();
        TypeExpression type;
        if (first.is(TokenType.STRING)) {
            return parseEnumeration(scanner);
        } else if (scanner.accept(TokenType.LEFT_BRACKET)) {
            List<TypeExpression> elements = new ArrayList<>();
            do {
                elements.add(parseSingle(scanner));
            } while (scanner.accept(TokenType.COMMA));
            scanner.expect(TokenType.RIGHT_BRACKET, "']' closing the tuple");
            type = TypeExpression.tuple(elements, scanner.spanFrom(first));
        } else {
            Token name = scanner.expect(TokenType.IDENTIFIER, "a type name");
            if (scanner.accept(TokenType.LESS)) {
                List<TypeExpression> arguments = new ArrayList<>();
                do {
                    arguments.add(parseSingle(scanner));
                } while (scanner.accept(TokenType.COMMA));
                scanner.expect(TokenType.GREATER, "'>' closing the type arguments");
                type = TypeExpression.generic(name.text, arguments, scanner.spanFrom(first));
            } else {
                type = TypeExpression.named(name.text, name.span);
            }
        }
        while (scanner.check(TokenType.LEFT_BRACKET) && scanner.peek(1).is(TokenType.RIGHT_BRACKET)) {
            scanner.next();
            scanner.next();
            type = TypeExpression.array(type, scanner.spanFrom(first));
        }
        return type;
    }

    private static TypeExpression parseEnumeration(TokenScanner scanner) throws RuneSyntaxException {
        Token first = scanner.peek();
        List<String> literals = new ArrayList<>();
        literals.add(unquote(scanner.expect(TokenType.STRING, "a string literal")));
        while (scanner.check(TokenType.PIPE) && scanner.peek(1).is(TokenType.STRING)) {
            scanner.next();
            literals.add(unquote(scanner.next()));
        }
        SourceSpan span = scanner.spanFrom(first);
        return TypeExpression.enumeration(literals, span);
    }

    private static String unquote(Token token) {
        return token.text.substring(1, token.text.length() - 1);
    }
}
