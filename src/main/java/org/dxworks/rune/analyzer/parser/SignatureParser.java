package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.Identifier;
import org.dxworks.rune.model.Parameter;
import org.dxworks.rune.model.Signature;
import org.dxworks.rune.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses call signatures ({@code subject.verb(params): returnType},
 * {@code Type::verb(...)}) and requirement headers, which may also use the
 * {@code verbNoun(params): returnType} form.
 */
public final class SignatureParser {

    private SignatureParser() {}

    public static Signature parseCall(TokenScanner scanner) throws RuneSyntaxException {
        Token first = scanner.peek();
        Signature signature = new Signature();
        signature.subject = identifier(scanner.expect(TokenType.IDENTIFIER, "a subject"));
        signature.separator = separator(scanner);
        signature.verb = identifier(scanner.expect(TokenType.IDENTIFIER, "a verb"));
        finish(scanner, first, signature);
        return signature;
    }

    public static Signature parseRequirementHeader(TokenScanner scanner) throws RuneSyntaxException {
        if (!scanner.peek(1).is(TokenType.LEFT_PAREN)) {
            return parseCall(scanner);
        }
        Token first = scanner.expect(TokenType.IDENTIFIER, "a function name");
        Signature signature = new Signature();
        signature.functionName = first.text;
        int split = splitIndex(first.text);
        if (split < 0) {
            throw new RuneSyntaxException("function name '" + first.text
                    + "' must read verbNoun, e.g. registerRecording", first.span);
        }
        String noun = first.text.substring(split);
        SourceSpan span = first.span;
        signature.verb = new Identifier(first.text.substring(0, split),
                SourceSpan.onLine(span.startLine, span.startColumn, span.startColumn + split));
        signature.subject = new Identifier(Character.toLowerCase(noun.charAt(0)) + noun.substring(1),
                SourceSpan.onLine(span.startLine, span.startColumn + split, span.endColumn));
        signature.separator = Signature.INSTANCE;
        finish(scanner, first, signature);
        return signature;
    }

    /** Index of the first upper-case letter after the first character, or -1. */
    static int splitIndex(String functionName) {
        for (int i = 1; i < functionName.length(); i++) {
            if (Character.isUpperCase(functionName.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static void finish(TokenScanner scanner, Token first, Signature signature) throws RuneSyntaxException {
        signature.parameters.addAll(parseParameters(scanner));
        scanner.expect(TokenType.COLON, "':' and a return type");
        signature.returnType = TypeExpressionParser.parseUnion(scanner);
        scanner.expectEnd();
        signature.span = scanner.spanFrom(first);
    }

    private static String separator(TokenScanner scanner) throws RuneSyntaxException {
        if (scanner.accept(TokenType.DOT)) {
            return Signature.INSTANCE;
        }
        scanner.expect(TokenType.DOUBLE_COLON, "'.' or '::'");
        return Signature.STATIC;
    }

    static List<Parameter> parseParameters(TokenScanner scanner) throws RuneSyntaxException {
        scanner.expect(TokenType.LEFT_PAREN, "'(' opening the parameter list");
        List<Parameter> parameters = new ArrayList<>();
        if (scanner.accept(TokenType.RIGHT_PAREN)) {
            return parameters;
        }
        do {
            parameters.add(parseParameter(scanner));
        } while (scanner.accept(TokenType.COMMA));
        scanner.expect(TokenType.RIGHT_PAREN, "')' closing the parameter list");
        return parameters;
    }

    private static Parameter parseParameter(TokenScanner scanner) throws RuneSyntaxException {
        Token first = scanner.peek();
        if (scanner.accept(TokenType.LEFT_BRACE)) {
            List<Identifier> properties = new ArrayList<>();
            if (!scanner.check(TokenType.RIGHT_BRACE)) {
                do {
                    properties.add(identifier(scanner.expect(TokenType.IDENTIFIER, "a property name")));
                } while (scanner.accept(TokenType.COMMA));
            }
            scanner.expect(TokenType.RIGHT_BRACE, "'}' closing the contract literal");
            return Parameter.contractLiteral(properties, scanner.spanFrom(first));
        }
        Identifier name = identifier(scanner.expect(TokenType.IDENTIFIER, "a parameter"));
        if (scanner.accept(TokenType.COLON)) {
            return Parameter.typed(name, TypeExpressionParser.parseSingle(scanner));
        }
        return Parameter.bare(name);
    }

    static Identifier identifier(Token token) {
        return new Identifier(token.text, token.span);
    }
}
