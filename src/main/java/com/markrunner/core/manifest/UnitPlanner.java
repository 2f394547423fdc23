package com.markrunner.core.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands subjects (and optional sub-items) into unit specs.
 *
 * <p>Expected output paths are a pure function of subject identity: no randomness, no
 * timestamps. That determinism is what lets a later run find earlier work on disk.
 *
 * <p>Variables available to both templates: {@code {key}}, {@code {item}} (when items are
 * given), {@code {stage}}, {@code {workDir}}, every subject attribute and any caller-supplied
 * global. The command template additionally sees {@code {output}}, the absolute expected path.
 */
public class UnitPlanner {

    public List<UnitSpec> plan(String stageId,
                               List<Subject> subjects,
                               List<String> items,
                               CommandTemplate command,
                               CommandTemplate output,
                               Map<String, String> globals,
                               Path baseDir) {
        var specs = new ArrayList<UnitSpec>();
        boolean perItem = items != null && !items.isEmpty();

        for (Subject subject : subjects) {
            List<String> subjectItems = perItem ? items : Collections.singletonList(null);
            for (String item : subjectItems) {
                var vars = new HashMap<String, String>(globals);
                vars.putAll(subject.attributes());
                vars.put("stage", stageId);
                vars.put("workDir", baseDir.toString());
                vars.put("key", subject.key());
                if (item != null) {
                    vars.put("item", item);
                }
                String unitKey = item == null ? subject.key() : subject.key() + "_" + item;

                try {
                    Path expected = baseDir.resolve(output.renderPath(vars)).toAbsolutePath().normalize();
                    vars.put("output", expected.toString());
                    specs.add(new UnitSpec(unitKey, command.renderCommand(vars), expected));
                } catch (IllegalArgumentException e) {
                    throw new InputCollectionException(
                            "Stage " + stageId + ", unit " + unitKey + ": " + e.getMessage(), e);
                }
            }
        }
        return specs;
    }
}
