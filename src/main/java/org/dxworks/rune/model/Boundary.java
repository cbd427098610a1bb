package org.dxworks.rune.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * System edges a boundary step may cross, keyed by their two-letter prefix.
 */
public enum Boundary {
    DB("db", "database"),
    FS("fs", "filesystem"),
    MQ("mq", "message queue"),
    EX("ex", "external service"),
    OS("os", "object store"),
    LG("lg", "log");

    private final String prefix;
    private final String description;

    Boundary(String prefix, String description) {
        this.prefix = prefix;
        this.description = description;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<Boundary> fromPrefix(String prefix) {
        return Arrays.stream(values()).filter(b -> b.prefix.equals(prefix)).findFirst();
    }
}
