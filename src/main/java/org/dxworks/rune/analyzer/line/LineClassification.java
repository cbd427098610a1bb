package org.dxworks.rune.analyzer.line;

import org.dxworks.rune.model.DiagnosticCode;

public final class LineClassification {

    public final LineCategory category;
    public final ExpectedLine descriptionKind;
    public final DiagnosticCode failure;
    public final String reason;

    private LineClassification(LineCategory category, ExpectedLine descriptionKind,
                               DiagnosticCode failure, String reason) {
        this.category = category;
        this.descriptionKind = descriptionKind;
        this.failure = failure;
        this.reason = reason;
    }

    public static LineClassification of(LineCategory category) {
        return new LineClassification(category, null, null, null);
    }

    public static LineClassification description(ExpectedLine kind) {
        return new LineClassification(LineCategory.DESCRIPTION, kind, null, null);
    }

    public static LineClassification unclassified(DiagnosticCode failure, String reason) {
        return new LineClassification(LineCategory.UNCLASSIFIED, null, failure, reason);
    }

    public boolean is(LineCategory other) {
        return category == other;
    }

    @Override
    public String toString() {
        if (category == LineCategory.DESCRIPTION) return "DESCRIPTION(" + descriptionKind + ")";
        if (category == LineCategory.UNCLASSIFIED) return "UNCLASSIFIED(" + reason + ")";
        return category.name();
    }
}
