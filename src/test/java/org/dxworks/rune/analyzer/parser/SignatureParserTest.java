package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.Parameter;
import org.dxworks.rune.model.Signature;
import org.dxworks.rune.model.SourceSpan;
import org.dxworks.rune.model.TypeExpression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignatureParserTest {

    private static Signature call(String text) throws RuneSyntaxException {
        return SignatureParser.parseCall(TokenScanner.of(0, 4, text));
    }

    private static TypeExpression type(String text) throws RuneSyntaxException {
        TokenScanner scanner = TokenScanner.of(0, 0, text);
        TypeExpression type = TypeExpressionParser.parseUnion(scanner);
        scanner.expectEnd();
        return type;
    }

    @Test
    void instanceCall() throws RuneSyntaxException {
        Signature signature = call("recording.toDto(): IdDto");
        assertEquals("recording", signature.subject.name);
        assertEquals(".", signature.separator);
        assertEquals("toDto", signature.verb.name);
        assertFalse(signature.isStatic());
        assertTrue(signature.parameters.isEmpty());
        assertEquals("IdDto", signature.returnType.text);
        assertEquals(new SourceSpan(0, 4, 0, 28), signature.span);
    }

    @Test
    void staticCallWithEveryParameterForm() throws RuneSyntaxException {
        Signature signature = call("id::create(providerName, data: Uint8Array, {a, b}, MetadataDto): id");
        assertTrue(signature.isStatic());
        assertEquals("id::create", signature.callKey());
        List<Parameter> parameters = signature.parameters;
        assertEquals(4, parameters.size());
        assertEquals(Parameter.NAME, parameters.get(0).kind);
        assertEquals(Parameter.TYPED, parameters.get(1).kind);
        assertEquals("Uint8Array", parameters.get(1).type.text);
        assertEquals(Parameter.CONTRACT_LITERAL, parameters.get(2).kind);
        assertEquals("{a, b}", parameters.get(2).shapeText());
        assertTrue(parameters.get(3).isContractReference());
        assertEquals(List.of("providerName", "Uint8Array", "{a, b}", "MetadataDto"), signature.parameterShapes());
    }

    @Test
    void hyphenatedVerbsAreAllowed() throws RuneSyntaxException {
        assertEquals("set-metadata", call("recording.set-metadata(id): void").verb.name);
    }

    @Test
    void requirementHeaderWithBareFunctionName() throws RuneSyntaxException {
        Signature signature = SignatureParser.parseRequirementHeader(
                TokenScanner.of(0, 6, "registerRecording(GetRecordingDto): IdDto"));
        assertEquals("registerRecording", signature.functionName);
        assertEquals("register", signature.verb.name);
        assertEquals("recording", signature.subject.name);
        assertEquals(new SourceSpan(0, 6, 0, 14), signature.verb.span);
        assertEquals(new SourceSpan(0, 14, 0, 23), signature.subject.span);
    }

    @Test
    void functionNameWithoutNounIsRejected() {
        RuneSyntaxException e = assertThrows(RuneSyntaxException.class, () ->
                SignatureParser.parseRequirementHeader(TokenScanner.of(0, 6, "register(GetDto): IdDto")));
        assertTrue(e.getMessage().contains("verbNoun"));
    }

    @Test
    void missingReturnTypeIsASyntaxError() {
        RuneSyntaxException e = assertThrows(RuneSyntaxException.class, () -> call("recording.get(id)"));
        assertEquals("expected ':' and a return type but found end of line", e.getMessage());
        assertEquals(new SourceSpan(0, 21, 0, 21), e.getSpan());
    }

    @Test
    void unclosedParameterListIsASyntaxError() {
        assertThrows(RuneSyntaxException.class, () -> call("recording.get(id: data"));
    }

    @Test
    void trailingTextIsASyntaxError() {
        assertThrows(RuneSyntaxException.class, () -> call("recording.get(id): data extra"));
    }

    @Test
    void multiLineSignatureKeepsSourcePositions() throws RuneSyntaxException {
        TokenScanner scanner = new TokenScanner(List.of(
                new TokenScanner.Segment(3, 7, "storage.save("),
                new TokenScanner.Segment(4, 8, "id,"),
                new TokenScanner.Segment(5, 8, "data): void")));
        Signature signature = SignatureParser.parseCall(scanner);
        assertEquals(2, signature.parameters.size());
        assertEquals(new SourceSpan(4, 8, 4, 10), signature.parameters.get(0).span);
        assertEquals(new SourceSpan(5, 8, 5, 12), signature.parameters.get(1).span);
        assertEquals(new SourceSpan(3, 7, 5, 19), signature.span);
    }

    @Test
    void typeExpressions() throws RuneSyntaxException {
        assertEquals(TypeExpression.NAMED, type("string").kind);
        assertEquals("url[]", type("url[]").text);
        assertEquals(TypeExpression.ARRAY, type("url[]").kind);
        assertEquals("Map<string, Array<id>>", type("Map<string,Array<id>>").text);
        assertEquals("[number, number]", type("[number,number]").text);
        assertEquals(TypeExpression.TUPLE, type("[number, number]").kind);
        TypeExpression enumeration = type("\"draft\" | \"published\"");
        assertEquals(TypeExpression.ENUM, enumeration.kind);
        assertEquals(List.of("draft", "published"), enumeration.literals);
        TypeExpression union = type("RecordingDto | void");
        assertEquals(TypeExpression.UNION, union.kind);
        assertEquals(2, union.members().size());
        assertTrue(union.members().get(1).isVoid());
    }

    @Test
    void splitIndexFindsFirstUpperCaseLetter() {
        assertEquals(3, SignatureParser.splitIndex("getRecording"));
        assertEquals(-1, SignatureParser.splitIndex("get"));
        assertEquals(-1, SignatureParser.splitIndex("G"));
    }
}
