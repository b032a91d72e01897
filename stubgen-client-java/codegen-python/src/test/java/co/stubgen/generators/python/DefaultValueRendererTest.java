package co.stubgen.generators.python;

import co.stubgen.core.model.Expression;
import co.stubgen.core.model.Expression.BytesLiteral;
import co.stubgen.core.model.Expression.CallExpr;
import co.stubgen.core.model.Expression.FloatLiteral;
import co.stubgen.core.model.Expression.IntLiteral;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.Expression.StrLiteral;
import co.stubgen.core.model.Expression.TupleExpr;
import co.stubgen.core.model.Expression.UnaryExpr;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class DefaultValueRendererTest {

    @Test
    void keepsIntegerText() {
        assertThat(DefaultValueRenderer.literalText(IntLiteral.of(3))).contains("3");
        assertThat(DefaultValueRenderer.literalText(new IntLiteral(new BigInteger("18446744073709551616"))))
            .contains("18446744073709551616");
    }

    @Test
    void emptiesStringsAndBytes() {
        assertThat(DefaultValueRenderer.literalText(new StrLiteral("s"))).contains("''");
        assertThat(DefaultValueRenderer.literalText(new BytesLiteral("s"))).contains("b''");
    }

    @Test
    void zeroesFloats() {
        assertThat(DefaultValueRenderer.literalText(new FloatLiteral(2.5))).contains("0.0");
    }

    @Test
    void keepsNegatedNumbers() {
        assertThat(DefaultValueRenderer.literalText(new UnaryExpr("-", IntLiteral.of(5)))).contains("-5");
        assertThat(DefaultValueRenderer.literalText(new UnaryExpr("-", new FloatLiteral(2.5)))).contains("-2.5");
        assertThat(DefaultValueRenderer.literalText(new UnaryExpr("-", new FloatLiteral(1e-5)))).contains("-1e-05");
    }

    @Test
    void keepsNone() {
        assertThat(DefaultValueRenderer.literalText(new NameExpr("None"))).contains("None");
    }

    @Test
    void hasNoLiteralForOtherShapes() {
        List<Expression> shapes = List.of(
            new NameExpr("DEFAULT"),
            new NameExpr("True"),
            new CallExpr(new NameExpr("object"), List.of()),
            new TupleExpr(List.of()),
            new UnaryExpr("not", new NameExpr("flag")),
            new UnaryExpr("-", new NameExpr("x")),
            new UnaryExpr("+", IntLiteral.of(1)));

        for (Expression shape : shapes) {
            assertThat(DefaultValueRenderer.literalText(shape)).as(shape.toString()).isEmpty();
        }
    }

    @Test
    void formatsFloatsLikeTheirSourceRepr() {
        assertThat(DefaultValueRenderer.floatText(2.5)).isEqualTo("2.5");
        assertThat(DefaultValueRenderer.floatText(100.0)).isEqualTo("100.0");
        assertThat(DefaultValueRenderer.floatText(0.0)).isEqualTo("0.0");
        assertThat(DefaultValueRenderer.floatText(0.0001)).isEqualTo("0.0001");
        assertThat(DefaultValueRenderer.floatText(0.00001)).isEqualTo("1e-05");
        assertThat(DefaultValueRenderer.floatText(1.5e-10)).isEqualTo("1.5e-10");
        assertThat(DefaultValueRenderer.floatText(1e16)).isEqualTo("1e+16");
        assertThat(DefaultValueRenderer.floatText(123456789.0)).isEqualTo("123456789.0");
    }

    @Test
    void rejectsNonFiniteFloats() {
        assertThatThrownBy(() -> DefaultValueRenderer.floatText(Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
