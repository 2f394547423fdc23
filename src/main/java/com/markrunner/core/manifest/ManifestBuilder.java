package com.markrunner.core.manifest;

import com.markrunner.core.model.Manifest;
import com.markrunner.core.model.ManifestCounts;
import com.markrunner.core.model.StageState;
import com.markrunner.core.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Turns planned unit specs into a manifest, omitting units whose output already exists.
 *
 * <p>Skipped units are absent from the manifest, not marked. Ordinals are assigned densely
 * from 1 over the units that remain, so line N of the task file is unit N.
 */
public class ManifestBuilder {

    private static final Logger log = LoggerFactory.getLogger(ManifestBuilder.class);

    /**
     * @param name  manifest name, normally the stage id
     * @param specs every unit the stage expects, in planning order
     * @param state probed state; pass {@link StageState#fresh} to run everything
     */
    public ManifestBuildResult build(String name, List<UnitSpec> specs, StageState state) {
        if (state.expectedTotal() != specs.size()) {
            throw new IllegalArgumentException("State for " + name + " expects " + state.expectedTotal()
                    + " units but " + specs.size() + " were planned");
        }
        validateDisjoint(name, specs);

        var units = new ArrayList<WorkUnit>();
        int alreadyDone = 0;
        for (UnitSpec spec : specs) {
            if (state.completedKeys().contains(spec.key())) {
                alreadyDone++;
                continue;
            }
            units.add(new WorkUnit(units.size() + 1, spec.key(), spec.command(), spec.expectedOutput()));
        }

        var counts = new ManifestCounts(specs.size(), units.size(), alreadyDone);
        log.info("Manifest {}: {} expected, {} to run, {} already done",
                name, counts.expectedTotal(), counts.toRun(), counts.alreadyDone());
        return new ManifestBuildResult(new Manifest(name, units), counts);
    }

    /**
     * Keys and output paths must be unique: each unit writes only to its own path.
     */
    static void validateDisjoint(String name, List<UnitSpec> specs) {
        var keys = new HashSet<String>();
        var outputs = new HashSet<Path>();
        for (UnitSpec spec : specs) {
            if (!keys.add(spec.key())) {
                throw new InputCollectionException("Manifest " + name + ": duplicate unit key " + spec.key());
            }
            if (spec.expectedOutput() != null && !outputs.add(spec.expectedOutput())) {
                throw new InputCollectionException(
                        "Manifest " + name + ": units share expected output " + spec.expectedOutput());
            }
        }
    }
}
