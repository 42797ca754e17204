package io.cortex.core.memory;

import io.cortex.core.error.Result;

/**
 * Converts between the raw text of a memory file and a {@link Memory}.
 */
public interface MemorySerializer {

    Result<Memory> parse(String raw);

    Result<String> serialize(Memory memory);
}
