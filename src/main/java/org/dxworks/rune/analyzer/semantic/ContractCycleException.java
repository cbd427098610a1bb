package org.dxworks.rune.analyzer.semantic;

import java.util.List;

/**
 * Signals that flattening reached a contract already on the current path.
 */
class ContractCycleException extends Exception {

    private final List<String> path;

    ContractCycleException(List<String> path) {
        super("data contract cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /** The contracts on the cycle, starting and ending with the same name. */
    List<String> getPath() {
        return path;
    }
}
