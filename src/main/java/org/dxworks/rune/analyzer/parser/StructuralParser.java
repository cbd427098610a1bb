package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.RuneConfig;
import org.dxworks.rune.analyzer.AnalyzerHelper;
import org.dxworks.rune.analyzer.DiagnosticReporter;
import org.dxworks.rune.analyzer.line.ExpectedLine;
import org.dxworks.rune.analyzer.line.LineCategory;
import org.dxworks.rune.analyzer.line.LineClassification;
import org.dxworks.rune.analyzer.line.LineClassifier;
import org.dxworks.rune.analyzer.line.SourceLine;
import org.dxworks.rune.model.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the document tree in one pass over classified lines.
 *
 * <p>Blocks have no terminators. Open requirements, polymorphic steps and cases
 * live on an indentation stack and each line pops the frames its column closes.
 * A line that cannot be classified is reported and everything indented deeper
 * than it is skipped until the parser is back at that line's level or above.
 */
public class StructuralParser {

    private static final Pattern BOUNDARY_PREFIX = Pattern.compile("^([a-z]{2}):(?!:)");
    private static final String KNOWN_PREFIXES = Arrays.stream(Boundary.values())
            .map(b -> b.getPrefix() + ":")
            .collect(Collectors.joining(", "));

    private final RuneConfig config;
    private final LineClassifier classifier = new LineClassifier();

    public StructuralParser(RuneConfig config) {
        this.config = config;
    }

    public Document parse(String source, DiagnosticReporter reporter) {
        return new ParseRun(SourceLine.split(source), reporter).parse();
    }

    private enum SignatureKind { REQUIREMENT, POLYMORPHIC, CALL }

    /** A signature whose parentheses are still open at the end of its first line. */
    private static final class PendingSignature {
        final SignatureKind kind;
        final SourceLine line;
        final Boundary boundary;
        final List<TokenScanner.Segment> segments = new ArrayList<>();
        int depth;

        PendingSignature(SignatureKind kind, SourceLine line, Boundary boundary) {
            this.kind = kind;
            this.line = line;
            this.boundary = boundary;
        }
    }

    private final class ParseRun {
        private final List<SourceLine> lines;
        private final DiagnosticReporter reporter;
        private final Document document = new Document();
        private final Deque<BlockFrame> frames = new ArrayDeque<>();

        private Definition openDefinition;
        private ExpectedLine descriptionKind = ExpectedLine.NONE;
        private CallStep lastCallStep;
        private PendingSignature pending;
        private int skipDeeperThan = -1;
        private int blankRun;
        private boolean sawTopLevel;

        ParseRun(List<SourceLine> lines, DiagnosticReporter reporter) {
            this.lines = lines;
            this.reporter = reporter;
        }

        Document parse() {
            for (SourceLine line : lines) {
                checkWidth(line);
                accept(line);
            }
            if (pending != null) {
                reportUnterminated();
            }
            closeDefinition();
            closeAllFrames();
            document.lineCount = lines.size();
            return document;
        }

        private void accept(SourceLine line) {
            if (pending != null && continuePending(line)) {
                return;
            }
            if (line.commentOnly) {
                return;
            }
            if (line.isBlank()) {
                blankRun++;
                return;
            }
            if (skipDeeperThan >= 0) {
                if (line.indent > skipDeeperThan) {
                    return;
                }
                skipDeeperThan = -1;
            }

            ExpectedLine expected = openDefinition != null ? descriptionKind : ExpectedLine.NONE;
            LineClassification classification = classifier.classify(line, expected);
            if (classification.is(LineCategory.DESCRIPTION)) {
                appendDescription(line);
                blankRun = 0;
                return;
            }

            closeDefinition();
            int blanksBefore = blankRun;
            blankRun = 0;

            switch (classification.category) {
                case FAULT_LIST -> attachFaults(line);
                case STRUCTURAL -> {
                    lastCallStep = null;
                    structural(line, blanksBefore);
                }
                default -> {
                    lastCallStep = null;
                    reporter.report(classification.failure, line.span(), classification.reason);
                    skip(line);
                }
            }
        }

        private void structural(SourceLine line, int blanksBefore) {
            String text = line.text;
            if (!text.startsWith("[")) {
                step(line, null);
                return;
            }
            String tag = text.substring(0, 5);
            switch (tag) {
                case "[REQ]", "[TYP]", "[DTO]", "[NON]" -> topLevel(line, tag, blanksBefore);
                default -> step(line, tag);
            }
        }

        // ---- top-level blocks ----

        private void topLevel(SourceLine line, String tag, int blanksBefore) {
            if (line.indent != 0) {
                reporter.report(DiagnosticCode.MISPLACED_TAG, tagSpan(line),
                        tag + " must start at column 0, found at column " + line.indent);
                skip(line);
                return;
            }
            closeAllFrames();
            if ("[REQ]".equals(tag) && sawTopLevel && blanksBefore < config.getRequirementSeparatorLines()) {
                reporter.report(DiagnosticCode.MISSING_SEPARATOR, tagSpan(line),
                        "requirement should be preceded by " + config.getRequirementSeparatorLines()
                                + " blank lines, found " + blanksBefore);
            }
            sawTopLevel = true;

            int column = restColumn(line);
            String rest = line.text.substring(column - line.indent);
            if ("[REQ]".equals(tag)) {
                startSignature(SignatureKind.REQUIREMENT, line, column, rest, null);
            } else {
                definition(line, tag, column, rest);
            }
        }

        private void definition(SourceLine line, String tag, int column, String rest) {
            TokenScanner scanner = TokenScanner.of(line.number, column, rest);
            try {
                Definition definition = switch (tag) {
                    case "[TYP]" -> parseTypeDefinition(scanner);
                    case "[DTO]" -> parseContractDefinition(scanner);
                    default -> parseNounDefinition(scanner);
                };
                definition.span = SourceSpan.onLine(line.number, 0, line.endColumn());
                document.blocks.add(definition);
                openDefinition = definition;
                descriptionKind = switch (tag) {
                    case "[TYP]" -> ExpectedLine.TYPE_DESCRIPTION;
                    case "[DTO]" -> ExpectedLine.CONTRACT_DESCRIPTION;
                    default -> ExpectedLine.NOUN_DESCRIPTION;
                };
            } catch (RuneSyntaxException e) {
                reporter.report(DiagnosticCode.MALFORMED_DEFINITION, e.getSpan(), tag + " " + e.getMessage());
                skip(line);
            }
        }

        private TypeDefinition parseTypeDefinition(TokenScanner scanner) throws RuneSyntaxException {
            Identifier name = SignatureParser.identifier(scanner.expect(TokenType.IDENTIFIER, "a type name"));
            scanner.expect(TokenType.COLON, "':' and a type");
            TypeExpression type = TypeExpressionParser.parseUnion(scanner);
            scanner.expectEnd();
            return new TypeDefinition(name, type);
        }

        private DataContractDefinition parseContractDefinition(TokenScanner scanner) throws RuneSyntaxException {
            Identifier name = SignatureParser.identifier(scanner.expect(TokenType.IDENTIFIER, "a contract name"));
            if (!name.name.endsWith("Dto")) {
                reporter.report(DiagnosticCode.INVALID_CONTRACT_NAME, name.span,
                        "data contract '" + name.name + "' must end in Dto");
            }
            scanner.expect(TokenType.COLON, "':' and a property list");
            DataContractDefinition contract = new DataContractDefinition(name);
            Set<String> seen = new HashSet<>();
            do {
                Token first = scanner.expect(TokenType.IDENTIFIER, "a property");
                String pluralSuffix = null;
                if (scanner.accept(TokenType.LEFT_PAREN)) {
                    pluralSuffix = scanner.expect(TokenType.IDENTIFIER, "a plural suffix such as (s)").text;
                    scanner.expect(TokenType.RIGHT_PAREN, "')' closing the plural suffix");
                }
                boolean optional = scanner.accept(TokenType.QUESTION);
                Property property = new Property(SignatureParser.identifier(first), pluralSuffix, optional,
                        scanner.spanFrom(first));
                if (seen.add(property.name)) {
                    contract.properties.add(property);
                } else {
                    reporter.report(DiagnosticCode.DUPLICATE_PROPERTY, property.span,
                            "property '" + property.name + "' is listed twice in " + name.name);
                }
            } while (scanner.accept(TokenType.COMMA));
            scanner.expectEnd();
            return contract;
        }

        private NounDefinition parseNounDefinition(TokenScanner scanner) throws RuneSyntaxException {
            Identifier name = SignatureParser.identifier(scanner.expect(TokenType.IDENTIFIER, "a noun"));
            scanner.expectEnd();
            return new NounDefinition(name);
        }

        private void appendDescription(SourceLine line) {
            openDefinition.description = openDefinition.description == null
                    ? AnalyzerHelper.normalizeInline(line.text)
                    : AnalyzerHelper.normalizeInline(openDefinition.description + " " + line.text);
            SourceSpan span = openDefinition.span;
            span.endLine = line.number;
            span.endColumn = line.endColumn();
        }

        private void closeDefinition() {
            if (openDefinition == null) {
                return;
            }
            if (openDefinition.description == null && descriptionRequired(openDefinition)) {
                String what = openDefinition instanceof DataContractDefinition ? "data contract" : "type";
                reporter.report(DiagnosticCode.MISSING_DESCRIPTION, openDefinition.name.span,
                        what + " '" + openDefinition.name.name + "' needs a description line");
            }
            openDefinition = null;
            descriptionKind = ExpectedLine.NONE;
        }

        private boolean descriptionRequired(Definition definition) {
            if (definition instanceof DataContractDefinition) return true;
            if (definition instanceof TypeDefinition) return config.isRequireTypeDescriptions();
            return false;
        }

        // ---- steps ----

        private void step(SourceLine line, String tag) {
            boolean caseOpener = "[CSE]".equals(tag);
            popClosedFrames(line.indent, caseOpener);
            if (frames.isEmpty()) {
                reporter.report(DiagnosticCode.STEP_OUTSIDE_REQUIREMENT, line.span(),
                        "step outside of any requirement");
                skip(line);
                return;
            }

            BlockFrame top = frames.peek();
            if (caseOpener) {
                openCase(line, top);
                return;
            }
            if (top.kind == BlockFrame.Kind.POLYMORPHIC) {
                reporter.report(DiagnosticCode.MISSING_CASE, line.span(),
                        "steps of a [PLY] block must follow a [CSE] case opener");
                skip(line);
                return;
            }
            int expected = top.childIndent();
            if (line.indent != expected) {
                if (tag != null) {
                    reporter.report(DiagnosticCode.MISPLACED_TAG, tagSpan(line),
                            tag + " indented by " + line.indent + " columns, expected " + expected);
                } else {
                    reporter.report(DiagnosticCode.INDENTATION, line.span(),
                            "step indented by " + line.indent + " columns, expected " + expected);
                }
                skip(line);
                return;
            }

            if (tag == null) {
                callStep(line);
                return;
            }
            int column = restColumn(line);
            String rest = line.text.substring(column - line.indent);
            switch (tag) {
                case "[PLY]" -> startSignature(SignatureKind.POLYMORPHIC, line, column, rest, null);
                case "[NEW]", "[RET]" -> namedStep(line, tag, column, rest);
                default -> {
                    reporter.report(DiagnosticCode.MISPLACED_TAG, tagSpan(line), tag + " is not allowed inside a requirement");
                    skip(line);
                }
            }
        }

        private void openCase(SourceLine line, BlockFrame top) {
            if (top.kind != BlockFrame.Kind.POLYMORPHIC) {
                reporter.report(DiagnosticCode.CASE_OUTSIDE_POLYMORPHIC, tagSpan(line),
                        "[CSE] is only allowed inside a [PLY] block");
                skip(line);
                return;
            }
            int expected = top.column + 4;
            if (line.indent != expected) {
                reporter.report(DiagnosticCode.MISPLACED_TAG, tagSpan(line),
                        "[CSE] indented by " + line.indent + " columns, expected " + expected);
                skip(line);
                return;
            }
            int column = restColumn(line);
            TokenScanner scanner = TokenScanner.of(line.number, column, line.text.substring(column - line.indent));
            try {
                Identifier name = SignatureParser.identifier(scanner.expect(TokenType.IDENTIFIER, "a case name"));
                scanner.expectEnd();
                Case c = new Case(name, line.span());
                top.polymorphic.cases.add(c);
                extendOpenFrames(line.span());
                frames.push(BlockFrame.ofCase(c, line.indent));
            } catch (RuneSyntaxException e) {
                reporter.report(DiagnosticCode.MALFORMED_SIGNATURE, e.getSpan(), "[CSE] " + e.getMessage());
                skip(line);
            }
        }

        private void namedStep(SourceLine line, String tag, int column, String rest) {
            TokenScanner scanner = TokenScanner.of(line.number, column, rest);
            try {
                String what = "[NEW]".equals(tag) ? "a class name" : "a value";
                Identifier name = SignatureParser.identifier(scanner.expect(TokenType.IDENTIFIER, what));
                scanner.expectEnd();
                Step step = "[NEW]".equals(tag) ? new ConstructorStep(name) : new ReturnStep(name);
                addStep(step, line, line.span());
            } catch (RuneSyntaxException e) {
                reporter.report(DiagnosticCode.MALFORMED_SIGNATURE, e.getSpan(), tag + " " + e.getMessage());
                skip(line);
            }
        }

        private void callStep(SourceLine line) {
            String text = line.text;
            Boundary boundary = null;
            int offset = 0;
            Matcher prefix = BOUNDARY_PREFIX.matcher(text);
            if (prefix.find()) {
                offset = prefix.end();
                boundary = Boundary.fromPrefix(prefix.group(1)).orElse(null);
                if (boundary == null) {
                    reporter.report(DiagnosticCode.INVALID_BOUNDARY_PREFIX,
                            SourceSpan.onLine(line.number, line.indent, line.indent + offset),
                            "unknown boundary prefix '" + prefix.group() + "', expected one of " + KNOWN_PREFIXES);
                }
            }
            startSignature(SignatureKind.CALL, line, line.indent + offset, text.substring(offset), boundary);
        }

        private void addStep(Step step, SourceLine line, SourceSpan span) {
            step.indent = line.indent;
            step.span = span;
            BlockFrame top = frames.peek();
            top.steps.add(step);
            extendOpenFrames(span);
        }

        private void attachFaults(SourceLine line) {
            if (lastCallStep == null) {
                reporter.report(DiagnosticCode.FAULT_WITHOUT_STEP, line.span(),
                        "fault list without a preceding call step");
                return;
            }
            int expected = lastCallStep.indent + 2;
            if (line.indent != expected) {
                reporter.report(DiagnosticCode.INDENTATION, line.span(),
                        "fault list indented by " + line.indent + " columns, expected " + expected);
                return;
            }
            FaultSet faults = lastCallStep.faults;
            if (faults == null) {
                faults = new FaultSet();
                faults.span = line.span();
                lastCallStep.faults = faults;
            }
            String text = line.text;
            int i = 0;
            while (i < text.length()) {
                if (text.charAt(i) == ' ') {
                    i++;
                    continue;
                }
                int start = i;
                while (i < text.length() && text.charAt(i) != ' ') {
                    i++;
                }
                String fault = text.substring(start, i);
                SourceSpan span = SourceSpan.onLine(line.number, line.indent + start, line.indent + i);
                if (faults.contains(fault)) {
                    reporter.report(DiagnosticCode.DUPLICATE_FAULT, span,
                            "fault '" + fault + "' is already listed for this step");
                } else {
                    faults.faults.add(new Identifier(fault, span));
                }
            }
            faults.span.endLine = line.number;
            faults.span.endColumn = line.endColumn();
            extendOpenFrames(line.span());
        }

        // ---- signatures, possibly spanning lines ----

        private void startSignature(SignatureKind kind, SourceLine line, int column, String text, Boundary boundary) {
            PendingSignature signature = new PendingSignature(kind, line, boundary);
            signature.segments.add(new TokenScanner.Segment(line.number, column, text));
            signature.depth = parenDepth(text);
            if (signature.depth > 0) {
                pending = signature;
            } else {
                finishSignature(signature);
            }
        }

        /** @return true when the line was consumed as part of the open signature */
        private boolean continuePending(SourceLine line) {
            if (line.commentOnly) {
                return true;
            }
            if (line.isBlank() || line.text.startsWith("[")) {
                reportUnterminated();
                return false;
            }
            if (line.indent < pending.line.indent) {
                reporter.report(DiagnosticCode.CONTINUATION_INDENTATION, line.span(),
                        "continuation indented by " + line.indent + " columns, expected at least "
                                + pending.line.indent);
                skipDeeperThan = pending.line.indent;
                pending = null;
                return true;
            }
            if (!classifier.classify(line, ExpectedLine.SIGNATURE_CONTINUATION).is(LineCategory.CONTINUATION)) {
                reportUnterminated();
                return false;
            }
            pending.segments.add(new TokenScanner.Segment(line.number, line.indent, line.text));
            pending.depth += parenDepth(line.text);
            if (pending.depth <= 0) {
                PendingSignature done = pending;
                pending = null;
                finishSignature(done);
            }
            return true;
        }

        private void reportUnterminated() {
            SourceLine start = pending.line;
            reporter.report(DiagnosticCode.UNTERMINATED_SIGNATURE, start.span(),
                    "signature is missing its closing parenthesis");
            skipDeeperThan = start.indent;
            pending = null;
        }

        private void finishSignature(PendingSignature signature) {
            TokenScanner scanner = new TokenScanner(signature.segments);
            SourceLine line = signature.line;
            try {
                switch (signature.kind) {
                    case REQUIREMENT -> {
                        RequirementBlock requirement = new RequirementBlock(SignatureParser.parseRequirementHeader(scanner));
                        requirement.span = new SourceSpan(line.number, 0,
                                requirement.signature.span.endLine, requirement.signature.span.endColumn);
                        document.blocks.add(requirement);
                        frames.push(BlockFrame.requirement(requirement));
                    }
                    case POLYMORPHIC -> {
                        PolymorphicStep step = new PolymorphicStep(SignatureParser.parseCall(scanner));
                        addStep(step, line, stepSpan(line, step.signature));
                        frames.push(BlockFrame.polymorphic(step));
                    }
                    case CALL -> {
                        Signature parsed = SignatureParser.parseCall(scanner);
                        CallStep step = signature.boundary != null
                                ? new BoundaryStep(signature.boundary, parsed)
                                : new PlainStep(parsed);
                        addStep(step, line, stepSpan(line, parsed));
                        lastCallStep = step;
                    }
                }
            } catch (RuneSyntaxException e) {
                reporter.report(DiagnosticCode.MALFORMED_SIGNATURE, e.getSpan(), e.getMessage());
                skip(line);
            }
        }

        private SourceSpan stepSpan(SourceLine line, Signature signature) {
            return new SourceSpan(line.number, line.indent, signature.span.endLine, signature.span.endColumn);
        }

        // ---- indentation stack ----

        private void popClosedFrames(int indent, boolean caseOpener) {
            while (!frames.isEmpty() && frames.peek().closedBy(indent, caseOpener)) {
                popFrame();
            }
        }

        private void closeAllFrames() {
            while (!frames.isEmpty()) {
                popFrame();
            }
        }

        private void popFrame() {
            BlockFrame frame = frames.pop();
            if (frame.kind == BlockFrame.Kind.POLYMORPHIC && frame.polymorphic.cases.isEmpty()) {
                reporter.report(DiagnosticCode.EMPTY_POLYMORPHIC, frame.polymorphic.signature.span,
                        "[PLY] " + frame.polymorphic.signature.callKey() + " has no [CSE] cases");
            }
        }

        private void extendOpenFrames(SourceSpan span) {
            for (BlockFrame frame : frames) {
                frame.extend(span);
            }
        }

        // ---- helpers ----

        private void skip(SourceLine line) {
            skipDeeperThan = line.indent;
        }

        private void checkWidth(SourceLine line) {
            int width = line.width();
            if (width > config.getMaxLineLength()) {
                reporter.report(DiagnosticCode.LINE_TOO_LONG,
                        SourceSpan.onLine(line.number, config.getMaxLineLength(), width),
                        "line is " + width + " characters long, the limit is " + config.getMaxLineLength());
            }
        }

        private SourceSpan tagSpan(SourceLine line) {
            return SourceSpan.onLine(line.number, line.indent, line.indent + 5);
        }

        /** Column of the first non-space character after a five-character tag. */
        private int restColumn(SourceLine line) {
            int i = 5;
            while (i < line.text.length() && line.text.charAt(i) == ' ') {
                i++;
            }
            return line.indent + i;
        }

        private int parenDepth(String text) {
            int depth = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(') depth++;
                else if (c == ')') depth--;
            }
            return depth;
        }
    }
}
