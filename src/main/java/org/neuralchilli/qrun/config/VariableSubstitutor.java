package org.neuralchilli.qrun.config;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${NAME}} and {@code $NAME} references in configuration strings.
 * <p>
 * Besides user variables, {@code ENV_<NAME>} is bound for every environment
 * variable and {@code PWD} to the configuration directory. User variables
 * shadow built-ins. Unknown references are left as written.
 */
public class VariableSubstitutor {

    private static final Pattern BRACED = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final Pattern BARE = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)\\b");

    private final Map<String, String> variables;

    public VariableSubstitutor(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    /**
     * Variables for a configuration file: built-ins first, then the user's table on top.
     */
    public static VariableSubstitutor forConfig(Path configDirectory,
                                                Map<String, String> userVariables,
                                                Map<String, String> environment) {
        Map<String, String> all = new HashMap<>();
        environment.forEach((name, value) -> all.put("ENV_" + name, value));
        all.put("PWD", configDirectory.toString());
        userVariables.forEach((name, value) -> {
            if (value != null) {
                all.put(name, value);
            }
        });
        return new VariableSubstitutor(all);
    }

    public String substitute(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        return replace(BARE, replace(BRACED, text));
    }

    public List<String> substituteAll(List<String> values) {
        return values.stream().map(this::substitute).toList();
    }

    private String replace(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public Map<String, String> variables() {
        return variables;
    }
}
