package io.cortex.core.index;

/**
 * A memory listed in the index of its immediate category.
 *
 * @param path full slug path of the memory, e.g. {@code project/cortex/alpha}
 * @param tokenEstimate token estimate of the memory content
 * @param summary optional short summary, may be {@code null}
 */
public record IndexMemoryEntry(String path, int tokenEstimate, String summary) {

    public IndexMemoryEntry(String path, int tokenEstimate) {
        this(path, tokenEstimate, null);
    }
}
