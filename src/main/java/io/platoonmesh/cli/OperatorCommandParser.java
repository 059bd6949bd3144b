package io.platoonmesh.cli;

import io.platoonmesh.session.LeadScript;
import io.platoonmesh.session.OperatorCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class OperatorCommandParser {
    static final String USAGE = "commands: join | leave | set-gap <meters> | set-speed <m/s>"
            + " | run-script <" + LeadScript.FIRST + "-" + LeadScript.LAST + "> | stop-script | status | help";

    private OperatorCommandParser() {
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (token != null && !token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    static String normalizeOp(String op) {
        return op == null ? "" : op.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Console-only commands answered without touching the session's command queue.
     */
    static boolean isLocalCommand(String op) {
        String value = normalizeOp(op);
        return "status".equals(value) || "help".equals(value);
    }

    static OperatorCommand parse(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("empty command; " + USAGE);
        }
        String op = normalizeOp(tokens.get(0));
        return switch (op) {
            case "join" -> {
                expectArity(tokens, 1);
                yield OperatorCommand.join();
            }
            case "leave" -> {
                expectArity(tokens, 1);
                yield OperatorCommand.leave();
            }
            case "set-gap" -> {
                expectArity(tokens, 2);
                double meters = parseNumber(tokens.get(1), "gap");
                if (meters <= 0.0) {
                    throw new IllegalArgumentException("gap must be positive: " + tokens.get(1));
                }
                yield OperatorCommand.setGap(meters);
            }
            case "set-speed" -> {
                expectArity(tokens, 2);
                double speed = parseNumber(tokens.get(1), "speed");
                if (speed < 0.0) {
                    throw new IllegalArgumentException("speed must not be negative: " + tokens.get(1));
                }
                yield OperatorCommand.setSpeed(speed);
            }
            case "run-script" -> {
                expectArity(tokens, 2);
                int number;
                try {
                    number = Integer.parseInt(tokens.get(1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("script must be a whole number: " + tokens.get(1));
                }
                if (number < LeadScript.FIRST || number > LeadScript.LAST) {
                    throw new IllegalArgumentException("script must be between " + LeadScript.FIRST
                            + " and " + LeadScript.LAST + ": " + tokens.get(1));
                }
                yield OperatorCommand.runScript(number);
            }
            case "stop-script" -> {
                expectArity(tokens, 1);
                yield OperatorCommand.stopScript();
            }
            default -> throw new IllegalArgumentException("unknown command '" + tokens.get(0) + "'; " + USAGE);
        };
    }

    private static void expectArity(List<String> tokens, int expected) {
        if (tokens.size() != expected) {
            throw new IllegalArgumentException("'" + tokens.get(0) + "' takes " + (expected - 1)
                    + " argument(s); " + USAGE);
        }
    }

    private static double parseNumber(String raw, String label) {
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(label + " must be a number: " + raw);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(label + " must be finite: " + raw);
        }
        return value;
    }
}
