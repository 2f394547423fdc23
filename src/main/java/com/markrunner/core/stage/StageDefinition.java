package com.markrunner.core.stage;

import java.util.ArrayList;
import java.util.List;

/**
 * One configured pipeline stage. Bound from {@code markrunner.pipeline.stages[n]}.
 *
 * <p>A stage without an {@code input} is a single-unit stage keyed by its id; its completion
 * is still the presence of its output artifact.
 */
public class StageDefinition {

    private String id;
    private String name;
    private String input;
    private String keyField = "key";
    private List<String> items = new ArrayList<>();
    private String itemsGlob;
    private String command;
    private String output;
    private boolean allowDegraded = true;
    private Integer maxParallel;

    public StageDefinition() {}

    public StageDefinition(String id, String command, String output) {
        this.id = id;
        this.command = command;
        this.output = output;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getInput() { return input; }
    public void setInput(String input) { this.input = input; }
    public String getKeyField() { return keyField; }
    public void setKeyField(String keyField) { this.keyField = keyField; }
    public List<String> getItems() { return items; }
    public void setItems(List<String> items) { this.items = items; }
    public String getItemsGlob() { return itemsGlob; }
    public void setItemsGlob(String itemsGlob) { this.itemsGlob = itemsGlob; }
    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }
    public boolean isAllowDegraded() { return allowDegraded; }
    public void setAllowDegraded(boolean allowDegraded) { this.allowDegraded = allowDegraded; }
    public Integer getMaxParallel() { return maxParallel; }
    public void setMaxParallel(Integer maxParallel) { this.maxParallel = maxParallel; }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean isBatch() {
        return input != null && !input.isBlank();
    }
}
