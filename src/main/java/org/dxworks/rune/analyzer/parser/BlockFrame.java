package org.dxworks.rune.analyzer.parser;

import org.dxworks.rune.model.Case;
import org.dxworks.rune.model.PolymorphicStep;
import org.dxworks.rune.model.RequirementBlock;
import org.dxworks.rune.model.SourceSpan;
import org.dxworks.rune.model.Step;

import java.util.List;

/**
 * One open block on the parser's indentation stack.
 */
final class BlockFrame {

    enum Kind { REQUIREMENT, POLYMORPHIC, CASE }

    final Kind kind;
    final int column;
    final List<Step> steps;             // null for polymorphic frames, which only hold cases
    final SourceSpan span;
    final PolymorphicStep polymorphic;

    private BlockFrame(Kind kind, int column, List<Step> steps, SourceSpan span, PolymorphicStep polymorphic) {
        this.kind = kind;
        this.column = column;
        this.steps = steps;
        this.span = span;
        this.polymorphic = polymorphic;
    }

    static BlockFrame requirement(RequirementBlock requirement) {
        return new BlockFrame(Kind.REQUIREMENT, 0, requirement.steps, requirement.span, null);
    }

    static BlockFrame polymorphic(PolymorphicStep step) {
        return new BlockFrame(Kind.POLYMORPHIC, step.indent, null, step.span, step);
    }

    static BlockFrame ofCase(Case c, int column) {
        return new BlockFrame(Kind.CASE, column, c.steps, c.span, null);
    }

    /** Column at which steps of this block sit; cases sit one level below their [PLY]. */
    int childIndent() {
        return kind == Kind.CASE ? column : column + 4;
    }

    /**
     * True when a line at {@code indent} ends this block. A [CSE] line also ends a
     * sibling case at the same column.
     */
    boolean closedBy(int indent, boolean caseOpener) {
        return switch (kind) {
            case REQUIREMENT -> false;
            case POLYMORPHIC -> indent <= column;
            case CASE -> indent < column || (caseOpener && indent == column);
        };
    }

    void extend(SourceSpan end) {
        if (end.endLine > span.endLine || (end.endLine == span.endLine && end.endColumn > span.endColumn)) {
            span.endLine = end.endLine;
            span.endColumn = end.endColumn;
        }
    }
}
