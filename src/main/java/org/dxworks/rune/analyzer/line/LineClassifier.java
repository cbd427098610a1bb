package org.dxworks.rune.analyzer.line;

import org.dxworks.rune.model.DiagnosticCode;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Categorizes a line from its indentation and character shape. Prose and code can
 * look alike at four columns, so the parser passes in what it currently expects.
 */
public class LineClassifier {

    public static final int DESCRIPTION_INDENT = 4;
    public static final int MIN_FAULT_INDENT = 6;
    public static final int STEP_INDENT = 4;

    private static final Set<String> TAGS = Set.of(
            "[REQ]", "[TYP]", "[DTO]", "[NON]", "[PLY]", "[CSE]", "[RET]", "[NEW]");

    private static final Pattern TAG = Pattern.compile("^\\[[A-Za-z]{3}]");
    private static final Pattern CALL_SHAPE = Pattern.compile(
            "^(?:[a-z]{2}:(?!:))?[A-Za-z_][A-Za-z0-9_]*(?:\\.|::)[A-Za-z][A-Za-z0-9_-]*\\s*\\(");
    private static final Pattern CALL_WITHOUT_PARAMETERS = Pattern.compile(
            "^(?:[a-z]{2}:(?!:))?[A-Za-z_][A-Za-z0-9_]*(?:\\.|::)[A-Za-z][A-Za-z0-9_-]*\\s*(?::.*)?$");

    private static final LineClassification BLANK = LineClassification.of(LineCategory.BLANK);
    private static final LineClassification COMMENT = LineClassification.of(LineCategory.COMMENT);
    private static final LineClassification CONTINUATION = LineClassification.of(LineCategory.CONTINUATION);
    private static final LineClassification FAULT_LIST = LineClassification.of(LineCategory.FAULT_LIST);
    private static final LineClassification STRUCTURAL = LineClassification.of(LineCategory.STRUCTURAL);

    public LineClassification classify(SourceLine line, ExpectedLine expected) {
        if (line.commentOnly) return COMMENT;
        if (line.text.isEmpty()) return BLANK;
        if (expected == ExpectedLine.SIGNATURE_CONTINUATION) return CONTINUATION;

        String text = line.text;
        if (line.indent >= MIN_FAULT_INDENT && isFaultContent(text)) {
            return FAULT_LIST;
        }
        if (line.indent == DESCRIPTION_INDENT && startsLowerCase(text) && !looksLikeCode(text)) {
            if (expected.isDescription()) {
                return LineClassification.description(expected);
            }
            return LineClassification.unclassified(DiagnosticCode.UNCLASSIFIED_LINE,
                    "prose is only allowed as the description of a type, contract or noun");
        }

        Matcher tag = TAG.matcher(text);
        if (tag.find()) {
            if (TAGS.contains(tag.group())) {
                return STRUCTURAL;
            }
            return LineClassification.unclassified(DiagnosticCode.UNCLASSIFIED_LINE, "unknown tag " + tag.group());
        }

        if (CALL_SHAPE.matcher(text).find()) {
            if (line.indent == 0) {
                return LineClassification.unclassified(DiagnosticCode.INDENTATION,
                        "step at column 0, steps belong inside a requirement");
            }
            if (line.indent % STEP_INDENT != 0) {
                return LineClassification.unclassified(DiagnosticCode.INDENTATION,
                        "step indented by " + line.indent + " columns, expected a multiple of " + STEP_INDENT);
            }
            return STRUCTURAL;
        }

        return explainFailure(line, expected);
    }

    private LineClassification explainFailure(SourceLine line, ExpectedLine expected) {
        String text = line.text;
        if (expected.isDescription() && !looksLikeCode(text)) {
            if (line.indent != DESCRIPTION_INDENT && startsLowerCase(text)) {
                return LineClassification.unclassified(DiagnosticCode.INDENTATION,
                        "description indented by " + line.indent + " columns, expected exactly " + DESCRIPTION_INDENT);
            }
            if (line.indent == DESCRIPTION_INDENT) {
                return LineClassification.unclassified(DiagnosticCode.UNCLASSIFIED_LINE,
                        "description must start with a lower-case letter");
            }
        }
        if (isFaultContent(text) && line.indent < MIN_FAULT_INDENT && line.indent > 0) {
            return LineClassification.unclassified(DiagnosticCode.INDENTATION,
                    "fault list indented by " + line.indent + " columns, expected at least " + MIN_FAULT_INDENT);
        }
        if (CALL_WITHOUT_PARAMETERS.matcher(text).matches()) {
            return LineClassification.unclassified(DiagnosticCode.MALFORMED_SIGNATURE, "call without a parameter list");
        }
        return LineClassification.unclassified(DiagnosticCode.UNCLASSIFIED_LINE, "unexpected text '" + text + "'");
    }

    /** Only lower-case letters, digits, hyphens and spaces, with at least one letter. */
    public static boolean isFaultContent(String text) {
        boolean hasLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= 'a' && c <= 'z') {
                hasLetter = true;
            } else if (!(c >= '0' && c <= '9') && c != '-' && c != ' ') {
                return false;
            }
        }
        return hasLetter;
    }

    /**
     * A two-letter prefix followed by a colon, the {@code return(} marker, a colon
     * before any dot, or a dot eventually followed by an opening parenthesis.
     */
    public static boolean looksLikeCode(String text) {
        if (text.length() >= 3 && text.charAt(2) == ':') return true;
        if (text.startsWith("return(")) return true;

        boolean seenDot = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.') {
                seenDot = true;
            } else if (c == '(' && seenDot) {
                return true;
            } else if (c == ':' && !seenDot) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsLowerCase(String text) {
        char first = text.charAt(0);
        return first >= 'a' && first <= 'z';
    }
}
