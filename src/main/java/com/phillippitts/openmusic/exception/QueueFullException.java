package com.phillippitts.openmusic.exception;

/**
 * Thrown when an item is enqueued into a queue whose pending list is already at capacity.
 */
public class QueueFullException extends OpenMusicException {

    private final int maxSize;

    public QueueFullException(int maxSize) {
        super("Queue is full (max " + maxSize + " items)");
        this.maxSize = maxSize;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
