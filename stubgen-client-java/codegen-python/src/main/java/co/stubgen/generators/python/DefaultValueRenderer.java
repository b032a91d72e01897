package co.stubgen.generators.python;

import co.stubgen.core.model.Expression;
import co.stubgen.core.model.Expression.BytesLiteral;
import co.stubgen.core.model.Expression.FloatLiteral;
import co.stubgen.core.model.Expression.IntLiteral;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.Expression.StrLiteral;
import co.stubgen.core.model.Expression.UnaryExpr;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Renders a parameter default as a literal of the same kind.
 *
 * <pre>
 *   3         → 3
 *   'text'    → ''
 *   b'text'   → b''
 *   2.5       → 0.0
 *   -5, -2.5  → -5, -2.5
 *   None      → None
 * </pre>
 *
 * Any other shape has no literal rendering; the generator substitutes its placeholder.
 */
final class DefaultValueRenderer {

    static final String NONE = "None";

    private DefaultValueRenderer() {}

    static Optional<String> literalText(Expression value) {
        if (value instanceof IntLiteral i) {
            return Optional.of(i.value().toString());
        }
        if (value instanceof StrLiteral) {
            return Optional.of("''");
        }
        if (value instanceof BytesLiteral) {
            return Optional.of("b''");
        }
        if (value instanceof FloatLiteral) {
            return Optional.of("0.0");
        }
        if (value instanceof UnaryExpr u && "-".equals(u.operator())) {
            if (u.operand() instanceof IntLiteral i) {
                return Optional.of("-" + i.value());
            }
            if (u.operand() instanceof FloatLiteral f) {
                return Optional.of("-" + floatText(f.value()));
            }
        }
        if (value instanceof NameExpr n && NONE.equals(n.name())) {
            return Optional.of(n.name());
        }
        return Optional.empty();
    }

    /**
     * Shortest round-trip text of a float the way the stub language prints it:
     * positional between 1e-4 and 1e16, otherwise {@code 1e+16} / {@code 1e-05}.
     */
    static String floatText(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("No literal form for " + value);
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return value < 0 || 1 / value < 0 ? "-0.0" : "0.0";
        }
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < -4 || exponent >= 16) {
            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder text = new StringBuilder();
            if (decimal.signum() < 0) {
                text.append('-');
            }
            text.append(digits.charAt(0));
            if (digits.length() > 1) {
                text.append('.').append(digits, 1, digits.length());
            }
            text.append('e').append(exponent < 0 ? '-' : '+');
            int magnitude = Math.abs(exponent);
            if (magnitude < 10) {
                text.append('0');
            }
            return text.append(magnitude).toString();
        }
        String plain = decimal.toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }
}
