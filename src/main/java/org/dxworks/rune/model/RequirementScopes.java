package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scope checkpoints of one requirement, covering lines {@code startLine}
 * (inclusive) to {@code endLine} (exclusive).
 */
public class RequirementScopes {
    public String requirement;
    public int startLine;
    public int endLine;
    public List<ScopeCheckpoint> checkpoints = new ArrayList<>();

    public RequirementScopes(String requirement, int startLine, int endLine) {
        this.requirement = requirement;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public boolean covers(int line) {
        return line >= startLine && line < endLine;
    }

    public Optional<ScopeCheckpoint> checkpointAt(int line) {
        ScopeCheckpoint found = null;
        for (ScopeCheckpoint checkpoint : checkpoints) {
            if (checkpoint.line <= line && (found == null || checkpoint.line >= found.line)) {
                found = checkpoint;
            }
        }
        return Optional.ofNullable(found);
    }
}
