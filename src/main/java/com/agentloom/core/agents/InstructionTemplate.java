package com.agentloom.core.agents;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {key}} placeholders of an instruction with session state.
 * <p>
 * {@code {key?}} marks an optional key and resolves to an empty string when absent.
 * Keys may carry a scope prefix ({@code {user:name}}). Braces around anything that is not
 * a state key are left as they are.
 */
final class InstructionTemplate {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{((?:app:|user:|temp:)?[A-Za-z_][A-Za-z0-9_]*)(\\?)?}");

    private InstructionTemplate() {}

    /**
     * @throws AgentExecutionException if a required key is missing from state
     */
    static String resolve(String agentName, String template, Map<String, Object> state) {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            boolean optional = m.group(2) != null;
            Object value = state.get(key);
            if (value == null && !optional) {
                throw new AgentExecutionException("Instruction of agent '" + agentName
                        + "' references state key '" + key + "' which is not set");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
