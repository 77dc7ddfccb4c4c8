package me.golemcore.scheduler.domain.scheduler;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the "did you mean" message for tool names the registry does not know.
 */
public final class ToolNameSuggester {

    private static final int MAX_SUGGESTIONS = 3;

    private ToolNameSuggester() {
    }

    public static String unknownToolMessage(String toolName, Collection<String> knownNames) {
        String message = "Tool \"" + toolName + "\" could not be loaded.";
        List<String> suggestions = suggest(toolName, knownNames);
        if (suggestions.isEmpty()) {
            return message;
        }
        String quoted = suggestions.stream()
                .map(name -> "\"" + name + "\"")
                .collect(Collectors.joining(", "));
        return suggestions.size() > 1
                ? message + " Did you mean one of: " + quoted + "?"
                : message + " Did you mean " + quoted + "?";
    }

    static List<String> suggest(String toolName, Collection<String> knownNames) {
        if (toolName == null || knownNames == null || knownNames.isEmpty()) {
            return List.of();
        }
        return knownNames.stream()
                .sorted(Comparator.<String>comparingInt(name -> distance(toolName, name))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    static int distance(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
