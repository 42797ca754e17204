package io.cortex.core.index;

import io.cortex.core.error.Result;

public interface IndexSerializer {

    Result<CategoryIndex> parse(String raw);

    Result<String> serialize(CategoryIndex index);
}
