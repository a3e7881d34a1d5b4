package io.auditchain.core.storage;

/** Location of a committed event: block index plus position within that block. */
public record EventPosition(long blockIndex, int position) implements Comparable<EventPosition> {

    public EventPosition {
        if (blockIndex < 0) throw new IllegalArgumentException("blockIndex must be >= 0");
        if (position < 0) throw new IllegalArgumentException("position must be >= 0");
    }

    @Override
    public int compareTo(EventPosition other) {
        int cmp = Long.compare(blockIndex, other.blockIndex);
        return cmp != 0 ? cmp : Integer.compare(position, other.position);
    }
}
