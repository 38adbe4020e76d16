package com.othello.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved placement: the target square, the player placing the disc and, per direction,
 * the opponent squares that flip, ordered closest first.
 * Instances are produced by {@link CaptureResolver} and always capture at least one square.
 */
public record Move(int targetIndex, Player player, Map<Direction, List<Integer>> captures) {

    public Move {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(captures, "captures");
        if (targetIndex < 0) {
            throw new IllegalArgumentException("targetIndex must not be negative");
        }
        Map<Direction, List<Integer>> copy = new EnumMap<>(Direction.class);
        captures.forEach((direction, line) -> {
            if (!line.isEmpty()) {
                copy.put(direction, List.copyOf(line));
            }
        });
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("A move must capture at least one square");
        }
        captures = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns every captured index, grouped by direction in declaration order.
     */
    public List<Integer> capturedIndices() {
        List<Integer> indices = new ArrayList<>();
        captures.values().forEach(indices::addAll);
        return Collections.unmodifiableList(indices);
    }

    /**
     * Returns the number of discs this move flips.
     */
    public int captureCount() {
        return captures.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns the board changes this move commits: the placement followed by every flip.
     */
    public Map<Integer, SquareStatus> changes() {
        Map<Integer, SquareStatus> changes = new LinkedHashMap<>();
        changes.put(targetIndex, player.status());
        for (int index : capturedIndices()) {
            changes.put(index, player.status());
        }
        return changes;
    }
}
