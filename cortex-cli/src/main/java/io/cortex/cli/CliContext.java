package io.cortex.cli;

import io.cortex.core.category.CategoryService;
import io.cortex.core.config.ConfigService;
import io.cortex.core.memory.MemoryService;
import java.io.InputStream;
import java.nio.file.Path;

public record CliContext(
    MemoryService memoryService,
    CategoryService categoryService,
    ConfigService configService,
    Path configPath,
    InputStream stdin
) {
    public CliContext(
        MemoryService memoryService,
        CategoryService categoryService,
        ConfigService configService,
        Path configPath
    ) {
        this(memoryService, categoryService, configService, configPath, System.in);
    }
}
