package com.testconductor.intervention;

import com.testconductor.model.InterventionAction;
import com.testconductor.model.InterventionResponse;

import java.util.Locale;

/**
 * Parses one line of the operator command grammar.
 *
 * <pre>
 *   continue              re-run the current step
 *   skip                  move on to the next step
 *   retry                 retry the current step
 *   hint "&lt;text&gt;"         re-run the current step with extra guidance
 *   modify "&lt;text&gt;"       replace the step's actions with this instruction and re-run
 *   status                report the current page status
 *   goto &lt;n&gt;              jump to step n
 *   help                  show the command list
 * </pre>
 *
 * Arguments may be wrapped in single or double quotes; the quotes are stripped.
 * {@code hint} and {@code modify} need a non-empty argument, {@code goto} a positive
 * integer. Anything else is invalid and the operator is asked again.
 */
public class InterventionCommandParser {

    public static final String HELP_TEXT = String.join("\n",
        "Commands:",
        "  continue            - re-run the current step",
        "  skip                - skip the current step and move on",
        "  retry               - retry the current step",
        "  hint \"<text>\"       - give the agent extra guidance for the current step",
        "  modify \"<text>\"     - replace the current step's actions with a new instruction",
        "  status              - report the current page status",
        "  goto <step>         - jump to the given step number",
        "  help                - show this list");

    /**
     * Outcome of parsing one line.
     *
     * @param response the response, or null when the operator must be asked again
     * @param feedback text to show when no response was produced
     */
    public record ParsedCommand(InterventionResponse response, String feedback) {

        static ParsedCommand of(InterventionResponse response) { return new ParsedCommand(response, null); }
        static ParsedCommand reprompt(String feedback)        { return new ParsedCommand(null, feedback); }

        public boolean isResponse() { return response != null; }
    }

    public ParsedCommand parse(String line) {
        if (line == null || line.isBlank()) {
            return ParsedCommand.reprompt("Invalid command; type 'help' for the command list");
        }

        String trimmed = line.strip();
        int space = indexOfWhitespace(trimmed);
        String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? null : stripQuotes(trimmed.substring(space + 1).strip());

        switch (command) {
            case "continue":
                return ParsedCommand.of(InterventionResponse.of(InterventionAction.CONTINUE));
            case "skip":
                return ParsedCommand.of(InterventionResponse.of(InterventionAction.SKIP));
            case "retry":
                return ParsedCommand.of(InterventionResponse.of(InterventionAction.RETRY));
            case "status":
                return ParsedCommand.of(InterventionResponse.of(InterventionAction.STATUS));
            case "hint":
                if (argument == null || argument.isEmpty()) {
                    return ParsedCommand.reprompt("Provide guidance, e.g. hint \"Click the settings icon top right\"");
                }
                return ParsedCommand.of(InterventionResponse.hint(argument));
            case "modify":
                if (argument == null || argument.isEmpty()) {
                    return ParsedCommand.reprompt("Provide the new instruction, e.g. modify \"Use the menu on the left\"");
                }
                return ParsedCommand.of(InterventionResponse.modify(argument));
            case "goto":
                Integer target = parseStepNumber(argument);
                if (target == null) {
                    return ParsedCommand.reprompt("Provide a valid step number, e.g. goto 3");
                }
                return ParsedCommand.of(InterventionResponse.jumpTo(target));
            case "help":
                return ParsedCommand.reprompt(HELP_TEXT);
            default:
                return ParsedCommand.reprompt("Invalid command; type 'help' for the command list");
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isQuote(s.charAt(start))) start++;
        while (end > start && isQuote(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static Integer parseStepNumber(String argument) {
        if (argument == null || argument.isEmpty()) return null;
        for (int i = 0; i < argument.length(); i++) {
            if (!Character.isDigit(argument.charAt(i))) return null;
        }
        try {
            int n = Integer.parseInt(argument);
            return n >= 1 ? n : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
