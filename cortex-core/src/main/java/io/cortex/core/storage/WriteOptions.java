package io.cortex.core.storage;

/**
 * Controls the index maintenance that follows a memory write.
 *
 * @param allowIndexCreate when {@code false}, the write fails if the memory's category index does not exist yet
 * @param allowIndexUpdate when {@code false}, no index is touched at all
 */
public record WriteOptions(boolean allowIndexCreate, boolean allowIndexUpdate) {

    public static WriteOptions defaults() {
        return new WriteOptions(true, true);
    }

    public static WriteOptions withoutIndexUpdate() {
        return new WriteOptions(true, false);
    }
}
