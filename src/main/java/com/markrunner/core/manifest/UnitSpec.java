package com.markrunner.core.manifest;

import java.nio.file.Path;

/**
 * A planned unit before it is assigned an ordinal.
 */
public record UnitSpec(String key, String command, Path expectedOutput) {}
