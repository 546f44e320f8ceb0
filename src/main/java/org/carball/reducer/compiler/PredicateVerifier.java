package org.carball.reducer.compiler;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.HexValue;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.parser.TokenMgrException;
import org.carball.reducer.model.filter.CompiledPredicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-parses a compiled predicate before it may be executed. The clause must be one complete
 * condition, carry no literal values, and hold exactly one placeholder per parameter.
 * A failure here means the compiler produced something it never should, so it is reported
 * as an {@link IllegalStateException} rather than as a caller error.
 *
 * <p>Identifiers are dataset column names and may hold any character, so the parser sees
 * them renamed to {@code "c1"}, {@code "c2"}, and so on.
 */
@Slf4j
public class PredicateVerifier {

    public void verify(CompiledPredicate predicate) {
        if (predicate.isUnconditional()) {
            if (!predicate.parameters().isEmpty()) {
                throw new IllegalStateException("Unconditional predicate must not carry parameters");
            }
            return;
        }

        String clause = predicate.clauseTemplate();
        int placeholders = countPlaceholders(clause);
        if (placeholders != predicate.parameters().size()) {
            throw new IllegalStateException(String.format(
                    "Predicate has %d placeholders but %d parameters", placeholders, predicate.parameters().size()));
        }

        Expression expression;
        try {
            expression = CCJSqlParserUtil.parseCondExpression(maskIdentifiers(clause), false);
        } catch (JSQLParserException | TokenMgrException e) {
            log.error("Compiled predicate does not parse: {}", clause);
            throw new IllegalStateException("Compiled predicate is not a valid condition", e);
        }

        LiteralCollector literals = new LiteralCollector();
        expression.accept(literals);
        if (!literals.found.isEmpty()) {
            throw new IllegalStateException("Compiled predicate contains literal values: " + literals.found);
        }
    }

    /**
     * Counts {@code ?} outside quoted identifiers, rejecting statement separators and comments.
     */
    static int countPlaceholders(String clause) {
        int count = 0;
        boolean inIdentifier = false;

        for (int i = 0; i < clause.length(); i++) {
            char c = clause.charAt(i);
            if (inIdentifier) {
                if (c == '"') {
                    if (i + 1 < clause.length() && clause.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inIdentifier = false;
                    }
                }
                continue;
            }

            switch (c) {
                case '"':
                    inIdentifier = true;
                    break;
                case '?':
                    count++;
                    break;
                case '\'':
                case ';':
                    throw new IllegalStateException("Unexpected '" + c + "' outside an identifier");
                case '-':
                    if (i + 1 < clause.length() && clause.charAt(i + 1) == '-') {
                        throw new IllegalStateException("Comment outside an identifier");
                    }
                    break;
                case '/':
                    if (i + 1 < clause.length() && clause.charAt(i + 1) == '*') {
                        throw new IllegalStateException("Comment outside an identifier");
                    }
                    break;
                default:
                    break;
            }
        }

        if (inIdentifier) {
            throw new IllegalStateException("Unterminated identifier");
        }
        return count;
    }

    static String maskIdentifiers(String clause) {
        StringBuilder masked = new StringBuilder(clause.length());
        int identifiers = 0;
        boolean inIdentifier = false;

        for (int i = 0; i < clause.length(); i++) {
            char c = clause.charAt(i);
            if (inIdentifier) {
                if (c == '"') {
                    if (i + 1 < clause.length() && clause.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inIdentifier = false;
                        masked.append("\"c").append(++identifiers).append('"');
                    }
                }
                continue;
            }
            if (c == '"') {
                inIdentifier = true;
            } else {
                masked.append(c);
            }
        }
        return masked.toString();
    }

    private static final class LiteralCollector extends ExpressionVisitorAdapter {

        private final List<String> found = new ArrayList<>();

        @Override
        public void visit(StringValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(LongValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(DoubleValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(HexValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(DateValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(TimeValue value) {
            found.add(value.toString());
        }

        @Override
        public void visit(TimestampValue value) {
            found.add(value.toString());
        }
    }
}
