package com.vidnyan.causeway.domain.syntax;

/**
 * Inclusive source line range of a statement block.
 */
public record LineRange(int start, int end) {

    /**
     * Range used for an empty block that follows the given line.
     */
    public static LineRange emptyAfter(int line) {
        return new LineRange(line + 1, line + 1);
    }

    public boolean contains(int line) {
        return line >= start && line <= end;
    }
}
