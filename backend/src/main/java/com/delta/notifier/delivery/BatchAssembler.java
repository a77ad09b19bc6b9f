package com.delta.notifier.delivery;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs formatted blocks, in order, into messages no longer than the size ceiling.
 * Blocks are never split. A single block longer than the ceiling is sent on its own.
 */
public final class BatchAssembler {
    private BatchAssembler() {
    }

    public static List<String> assemble(List<String> blocks, int maxChars) {
        int ceiling = Math.max(1, maxChars);
        List<String> batches = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String block : blocks) {
            if (block == null || block.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + block.length() > ceiling) {
                batches.add(current.toString());
                current.setLength(0);
            }
            current.append(block);
        }
        if (current.length() > 0) {
            batches.add(current.toString());
        }
        return batches;
    }
}
