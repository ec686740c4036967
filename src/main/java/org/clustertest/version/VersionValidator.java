package org.clustertest.version;

import java.util.Objects;

/**
 * Parsed version compatibility expression.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code 3.0}: exact match</li>
 *   <li>{@code <=1.0.0}: upper bound, inclusive</li>
 *   <li>{@code 2.0.0..2.5}: closed range</li>
 * </ul>
 */
public final class VersionValidator {
    private static final String RANGE_SEPARATOR = "..";
    private static final String AT_MOST_OPERATOR = "<=";

    private final String expression;
    private final Condition condition;

    public VersionValidator(final String expression) {
        this.expression = expression;
        this.condition = parseCondition(expression);
    }

    public String expression() {
        return expression;
    }

    public boolean validate(final String version) {
        return validate(Version.parse(version));
    }

    public boolean validate(final Version version) {
        Objects.requireNonNull(version, "version");
        return condition.test(version);
    }

    @Override
    public String toString() {
        return "VersionValidator{" + expression + "}";
    }

    private static Condition parseCondition(final String expression) {
        if (expression == null || expression.isBlank()) {
            throw new VersionFormatException(expression, "version condition must not be blank");
        }
        final String normalized = expression.trim();
        if (normalized.contains(RANGE_SEPARATOR)) {
            return parseRange(expression, normalized);
        }
        if (normalized.startsWith(AT_MOST_OPERATOR)) {
            final String operand = normalized.substring(AT_MOST_OPERATOR.length()).trim();
            if (operand.isEmpty()) {
                throw new VersionFormatException(expression, "missing version operand: '" + expression + "'");
            }
            final Version bound = parseOperand(expression, operand);
            return candidate -> candidate.isAtMost(bound);
        }
        final Version exact = parseOperand(expression, normalized);
        return exact::equals;
    }

    private static Condition parseRange(final String expression, final String normalized) {
        final String[] bounds = normalized.split("\\.\\.", -1);
        if (bounds.length != 2) {
            throw new VersionFormatException(expression, "invalid version range: '" + expression + "'");
        }
        final String lower = bounds[0].trim();
        final String upper = bounds[1].trim();
        if (lower.isEmpty() || upper.isEmpty()) {
            throw new VersionFormatException(expression, "missing bound in version range: '" + expression + "'");
        }
        final Version min = parseOperand(expression, lower);
        final Version max = parseOperand(expression, upper);
        return candidate -> min.isAtMost(candidate) && candidate.isAtMost(max);
    }

    private static Version parseOperand(final String expression, final String operand) {
        if (containsOperatorCharacter(operand)) {
            throw new VersionFormatException(expression, "unsupported version operator: '" + expression + "'");
        }
        try {
            return Version.parse(operand);
        } catch (VersionFormatException e) {
            throw new VersionFormatException(expression,
                    "invalid version condition '" + expression + "': " + e.getMessage());
        }
    }

    private static boolean containsOperatorCharacter(final String operand) {
        for (int i = 0; i < operand.length(); i++) {
            final char c = operand.charAt(i);
            if (c == '<' || c == '>' || c == '=' || c == '!') {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface Condition {
        boolean test(Version candidate);
    }
}
