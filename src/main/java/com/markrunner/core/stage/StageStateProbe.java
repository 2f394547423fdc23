package com.markrunner.core.stage;

import com.markrunner.core.manifest.UnitSpec;
import com.markrunner.core.model.StageState;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives stage state from the filesystem: a unit is complete when its expected output exists.
 */
public class StageStateProbe {

    public StageState probe(String stageId, List<UnitSpec> specs) {
        Set<String> completed = new LinkedHashSet<>();
        for (UnitSpec spec : specs) {
            if (Files.exists(spec.expectedOutput())) {
                completed.add(spec.key());
            }
        }
        return new StageState(stageId, specs.size(), completed);
    }

    public List<String> missingKeys(List<UnitSpec> specs, StageState state) {
        var missing = new ArrayList<String>();
        for (UnitSpec spec : specs) {
            if (!state.completedKeys().contains(spec.key())) missing.add(spec.key());
        }
        return missing;
    }

    public List<String> placeholderKeys(List<UnitSpec> specs) {
        var keys = new ArrayList<String>();
        for (UnitSpec spec : specs) {
            if (PlaceholderArtifactWriter.isPlaceholder(spec.expectedOutput())) keys.add(spec.key());
        }
        return keys;
    }
}
