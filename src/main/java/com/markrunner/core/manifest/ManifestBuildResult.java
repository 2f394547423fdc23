package com.markrunner.core.manifest;

import com.markrunner.core.model.Manifest;
import com.markrunner.core.model.ManifestCounts;

public record ManifestBuildResult(Manifest manifest, ManifestCounts counts) {}
