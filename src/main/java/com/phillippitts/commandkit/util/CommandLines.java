package com.phillippitts.commandkit.util;

import java.util.List;
import java.util.StringJoiner;

/** Renders argument lists as readable command lines for logs and error messages. */
public final class CommandLines {

    private CommandLines() {}

    /**
     * Joins arguments with spaces. Arguments containing whitespace are double-quoted with
     * {@code \} and {@code "} escaped.
     *
     * @param arguments executable followed by its arguments
     * @return single-line rendering, empty for an empty list
     */
    public static String format(List<String> arguments) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String argument : arguments) {
            joiner.add(needsQuoting(argument) ? quote(argument) : argument);
        }
        return joiner.toString();
    }

    private static boolean needsQuoting(String argument) {
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }

    private static String quote(String argument) {
        StringBuilder sb = new StringBuilder(argument.length() + 2).append('"');
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
