package org.dxworks.rune.model;

import java.util.ArrayList;
import java.util.List;

public class Document {
    public List<TopLevelBlock> blocks = new ArrayList<>();
    public int lineCount;

    public <T extends TopLevelBlock> List<T> blocksOf(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (TopLevelBlock block : blocks) {
            if (type.isInstance(block)) {
                result.add(type.cast(block));
            }
        }
        return result;
    }
}
