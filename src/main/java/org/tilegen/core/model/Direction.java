package org.tilegen.core.model;

/**
 * Grid directions. Rows grow southwards (y = 0 is the top row).
 */
public enum Direction {
    NORTH(0, -1),
    EAST(1, 0),
    SOUTH(0, 1),
    WEST(-1, 0);

    public static final int COUNT = 4;

    private static final Direction[] VALUES = values();

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public Direction opposite() {
        return VALUES[(ordinal() + 2) % COUNT];
    }

    public static Direction byIndex(int index) {
        return VALUES[index];
    }

    /**
     * Case-insensitive lookup that also accepts the single-letter and
     * up/down/left/right spellings used by sample extractors.
     */
    public static Direction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Direction is empty");
        }
        return switch (raw.trim().toUpperCase()) {
            case "N", "NORTH", "UP" -> NORTH;
            case "E", "EAST", "RIGHT" -> EAST;
            case "S", "SOUTH", "DOWN" -> SOUTH;
            case "W", "WEST", "LEFT" -> WEST;
            default -> throw new IllegalArgumentException("Unknown direction: " + raw);
        };
    }
}
