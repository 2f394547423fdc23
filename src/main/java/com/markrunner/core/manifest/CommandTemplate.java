package com.markrunner.core.manifest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A command or path template with {@code {name}} placeholders.
 *
 * <p>The bare token {@code {}} stands for the unit's payload (variable {@value #PAYLOAD}).
 * Placeholders preceded by {@code $} are left alone so shell expansions such as
 * {@code ${HOME}} survive. Substitution is a single left-to-right pass: text inserted for a
 * placeholder is never scanned again, so a payload containing {@code {key}} stays literal.
 */
public final class CommandTemplate {

    public static final String PAYLOAD = "";

    private static final Pattern PLACEHOLDER = Pattern.compile("(?<!\\$)\\{([A-Za-z0-9_.-]*)}");

    private final String template;
    private final Set<String> placeholders;

    private CommandTemplate(String template, Set<String> placeholders) {
        this.template = template;
        this.placeholders = placeholders;
    }

    public static CommandTemplate of(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Template must not be blank");
        }
        if (template.indexOf('\n') >= 0 || template.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Template must be a single line: " + template);
        }
        var names = new LinkedHashSet<String>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            names.add(m.group(1));
        }
        return new CommandTemplate(template, Set.copyOf(names));
    }

    public String template() {
        return template;
    }

    public Set<String> placeholders() {
        return placeholders;
    }

    public boolean usesPayload() {
        return placeholders.contains(PAYLOAD);
    }

    /**
     * Renders the template as a shell command; every substituted value is shell-quoted.
     */
    public String renderCommand(Map<String, String> variables) {
        return render(variables, true);
    }

    /**
     * Renders the template verbatim, for filesystem paths.
     */
    public String renderPath(Map<String, String> variables) {
        return render(variables, false);
    }

    /**
     * Convenience for the engine's {@code --command "cmd {}"} form.
     */
    public String renderPayload(String payload) {
        return renderCommand(Map.of(PAYLOAD, payload));
    }

    private String render(Map<String, String> variables, boolean quote) {
        List<String> unknown = new ArrayList<>();
        for (String name : placeholders) {
            if (!variables.containsKey(name)) {
                unknown.add(name.isEmpty() ? "{}" : "{" + name + "}");
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown placeholder(s) " + unknown + " in template: " + template);
        }

        Matcher m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            if (value == null) value = "";
            if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                throw new IllegalArgumentException(
                        "Value for {" + m.group(1) + "} contains a line break; commands must stay on one line");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(quote ? ShellQuoting.quote(value) : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return template;
    }
}
