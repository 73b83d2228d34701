/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.lumata.asCompiler.compiler.backend.as;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.CompilerOptions;
import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.ir.LumParameter;
import org.lumata.asCompiler.ir.expression.LumApplyExpression;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumClosureExpression;
import org.lumata.asCompiler.ir.expression.LumConstructorExpression;
import org.lumata.asCompiler.ir.expression.LumDoExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumFieldExpression;
import org.lumata.asCompiler.ir.expression.LumFieldValue;
import org.lumata.asCompiler.ir.expression.LumFilterExpression;
import org.lumata.asCompiler.ir.expression.LumFoldExpression;
import org.lumata.asCompiler.ir.expression.LumIfExpression;
import org.lumata.asCompiler.ir.expression.LumIndexExpression;
import org.lumata.asCompiler.ir.expression.LumLetExpression;
import org.lumata.asCompiler.ir.expression.LumMapExpression;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.asCompiler.ir.expression.LumQualifiedIdentifier;
import org.lumata.asCompiler.ir.expression.LumRecordCreationExpression;
import org.lumata.asCompiler.ir.expression.LumRecordUpdateExpression;
import org.lumata.asCompiler.ir.expression.LumTypeAnnotationExpression;
import org.lumata.asCompiler.ir.expression.LumUnaryExpression;
import org.lumata.asCompiler.ir.expression.literal.LumBoolLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumListLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumRecordLiteral;
import org.lumata.asCompiler.ir.statement.LumExpressionStatement;
import org.lumata.asCompiler.ir.statement.LumLetStatement;

import java.util.List;

/** Tests for the rendering of expressions to AssemblyScript */
public class ToAsInnerVisitorTests extends BaseAsTests {
    static LumBinaryExpression binary(LumOpcode opcode, LumExpression left, LumExpression right) {
        return new LumBinaryExpression(opcode, left, right);
    }

    static LumUnaryExpression unary(LumOpcode opcode, LumExpression source) {
        return new LumUnaryExpression(opcode, source);
    }

    @Test
    public void testLiterals() {
        Assert.assertEquals("42", render(lit(42)));
        Assert.assertEquals("-7", render(lit(-7)));
        Assert.assertEquals("true", render(new LumBoolLiteral(true)));
        Assert.assertEquals("false", render(new LumBoolLiteral(false)));
        Assert.assertEquals("\"hello\"", render(str("hello")));
        Assert.assertEquals("[1, 2, 3]", render(new LumListLiteral(lit(1), lit(2), lit(3))));
        Assert.assertEquals("[]", render(new LumListLiteral()));
        Assert.assertEquals("{ \"a\": 1, \"b\": \"s\" }", render(new LumRecordLiteral(List.of(
                new LumFieldValue("a", lit(1)),
                new LumFieldValue("b", str("s"))))));
        Assert.assertEquals("{}", render(new LumRecordLiteral(List.of())));
    }

    @Test
    public void testStringEscaping() {
        Assert.assertEquals("\"say \\\"hi\\\"\\n\"", render(str("say \"hi\"\n")));
        Assert.assertEquals("\"a\\\\b\\tc\"", render(str("a\\b\tc")));
        Assert.assertEquals("\"\\u0001\"", render(str("\u0001")));
    }

    @Test
    public void testNames() {
        Assert.assertEquals("x", render(var("x")));
        Assert.assertEquals("Math.max", render(new LumQualifiedIdentifier("Math", "max")));
        Assert.assertEquals("max", render(new LumQualifiedIdentifier(null, "max")));
    }

    @Test
    public void testAdd() {
        Assert.assertEquals("(1 + 2)", render(binary(LumOpcode.ADD, lit(1), lit(2))));
    }

    @Test
    public void testBinaryOperators() {
        LumExpression a = var("a");
        LumExpression b = var("b");
        Assert.assertEquals("(a - b)", render(binary(LumOpcode.SUBTRACT, a, b)));
        Assert.assertEquals("(a * b)", render(binary(LumOpcode.MULTIPLY, a, b)));
        Assert.assertEquals("(a / b)", render(binary(LumOpcode.DIVIDE, a, b)));
        Assert.assertEquals("(a % b)", render(binary(LumOpcode.MODULO, a, b)));
        Assert.assertEquals("Math.pow(a, b)", render(binary(LumOpcode.POWER, a, b)));
        Assert.assertEquals("(a === b)", render(binary(LumOpcode.EQUAL, a, b)));
        Assert.assertEquals("(a !== b)", render(binary(LumOpcode.NOT_EQUAL, a, b)));
        Assert.assertEquals("(a < b)", render(binary(LumOpcode.LESS_THAN, a, b)));
        Assert.assertEquals("(a <= b)", render(binary(LumOpcode.LESS_THAN_OR_EQUAL, a, b)));
        Assert.assertEquals("(a > b)", render(binary(LumOpcode.GREATER_THAN, a, b)));
        Assert.assertEquals("(a >= b)", render(binary(LumOpcode.GREATER_THAN_OR_EQUAL, a, b)));
        Assert.assertEquals("(a && b)", render(binary(LumOpcode.AND, a, b)));
        Assert.assertEquals("(a || b)", render(binary(LumOpcode.OR, a, b)));
        Assert.assertEquals("[a].concat(b)", render(binary(LumOpcode.CONS, a, b)));
        Assert.assertEquals("(a).concat(b)", render(binary(LumOpcode.APPEND, a, b)));
    }

    @Test
    public void testComposition() {
        LumExpression f = var("f");
        LumExpression g = var("g");
        Assert.assertEquals("((composeArg: any) => f(g(composeArg)))",
                render(binary(LumOpcode.COMPOSE, f, g)));
        Assert.assertEquals("((composeArg: any) => g(f(composeArg)))",
                render(binary(LumOpcode.PIPE, f, g)));
    }

    @Test
    public void testUnaryOperators() {
        LumExpression x = var("x");
        Assert.assertEquals("(-x)", render(unary(LumOpcode.NEGATE, x)));
        Assert.assertEquals("(!x)", render(unary(LumOpcode.NOT, x)));
        Assert.assertEquals("(x.length)", render(unary(LumOpcode.LENGTH, x)));
        Assert.assertEquals("(x[0])", render(unary(LumOpcode.HEAD, x)));
        Assert.assertEquals("(x.slice(1))", render(unary(LumOpcode.TAIL, x)));
        Assert.assertEquals("(Array.from(x).reverse())", render(unary(LumOpcode.REVERSE, x)));
        Assert.assertEquals("(-(a + 1))", render(unary(LumOpcode.NEGATE, binary(LumOpcode.ADD, var("a"), lit(1)))));
    }

    @Test
    public void testNegateNegativeLiteral() {
        Assert.assertEquals("(- -1)", render(unary(LumOpcode.NEGATE, lit(-1))));
        Assert.assertEquals("(-1)", render(unary(LumOpcode.NEGATE, lit(1))));
        Assert.assertEquals("(-(-x))", render(unary(LumOpcode.NEGATE, unary(LumOpcode.NEGATE, var("x")))));
    }

    @Test
    public void testUnknownBinaryOperator() {
        LumExpression expression = binary(LumOpcode.NEGATE, lit(1), lit(2));
        UnsupportedException ex = Assert.assertThrows(UnsupportedException.class, () -> render(expression));
        Assert.assertTrue(ex.getMessage().contains("Unknown binary operator 'Negate'"));
    }

    @Test
    public void testUnknownUnaryOperator() {
        LumExpression expression = unary(LumOpcode.ADD, lit(1));
        UnsupportedException ex = Assert.assertThrows(UnsupportedException.class, () -> render(expression));
        Assert.assertTrue(ex.getMessage().contains("Unknown unary operator 'Add'"));
    }

    @Test
    public void testCallsAndRecords() {
        Assert.assertEquals("f(1, x)", render(new LumApplyExpression(var("f"), lit(1), var("x"))));
        Assert.assertEquals("f()", render(new LumApplyExpression(var("f"))));
        Assert.assertEquals("new Some(1)", render(new LumConstructorExpression("Some", lit(1))));
        Assert.assertEquals("new None()", render(new LumConstructorExpression("None")));
        Assert.assertEquals("new Point({ \"x\": 1, \"y\": 2 })", render(new LumRecordCreationExpression(
                "Point", List.of(new LumFieldValue("x", lit(1)), new LumFieldValue("y", lit(2))))));
        Assert.assertEquals("({ ...p, \"x\": 3 })", render(new LumRecordUpdateExpression(
                var("p"), List.of(new LumFieldValue("x", lit(3))))));
        Assert.assertEquals("p.x", render(new LumFieldExpression(var("p"), "x")));
        Assert.assertEquals("xs[0]", render(new LumIndexExpression(var("xs"), lit(0))));
        Assert.assertEquals("(x as i32)", render(new LumTypeAnnotationExpression(var("x"), "i32")));
    }

    @Test
    public void testCollections() {
        Assert.assertEquals("xs.map((x) => (x * 2))", render(new LumMapExpression(
                var("xs"), "x", binary(LumOpcode.MULTIPLY, var("x"), lit(2)))));
        Assert.assertEquals("xs.filter((x) => (x > 0))", render(new LumFilterExpression(
                var("xs"), "x", binary(LumOpcode.GREATER_THAN, var("x"), lit(0)))));
        // The accumulator is the first parameter of the callback
        Assert.assertEquals("xs.reduce((acc, x) => (acc + x), 0)", render(new LumFoldExpression(
                var("xs"), lit(0), "acc", "x", binary(LumOpcode.ADD, var("acc"), var("x")))));
    }

    @Test
    public void testIf() {
        String expected = """
                (() => {
                  if (true) {
                    return 1;
                  } else {
                    return 2;
                  }
                })()""";
        Assert.assertEquals(expected, render(new LumIfExpression(new LumBoolLiteral(true), lit(1), lit(2))));
    }

    @Test
    public void testLet() {
        LumLetExpression let = new LumLetExpression(List.of(
                new LumLetExpression.Binding("x", lit(1)),
                new LumLetExpression.Binding("y", lit(2))),
                binary(LumOpcode.ADD, var("x"), var("y")));
        String expected = """
                (() => {
                  const x = 1;
                  const y = 2;
                  return (x + y);
                })()""";
        Assert.assertEquals(expected, render(let));
    }

    @Test
    public void testLambda() {
        LumClosureExpression lambda = new LumClosureExpression(
                binary(LumOpcode.ADD, var("a"), var("b")),
                new LumParameter("a", "i32"), new LumParameter("b", null));
        String expected = """
                (a: i32, b) => {
                  return (a + b);
                }""";
        Assert.assertEquals(expected, render(lambda));
    }

    @Test
    public void testLambdaCalled() {
        LumClosureExpression identity = new LumClosureExpression(var("a"), new LumParameter("a", "i32"));
        String expected = """
                ((a: i32) => {
                  return a;
                })(1)""";
        Assert.assertEquals(expected, render(new LumApplyExpression(identity, lit(1))));

        String composed = """
                ((composeArg: any) => ((a: i32) => {
                  return a;
                })(g(composeArg)))""";
        Assert.assertEquals(composed, render(binary(LumOpcode.COMPOSE, identity, var("g"))));
        String piped = """
                ((composeArg: any) => g(((a: i32) => {
                  return a;
                })(composeArg)))""";
        Assert.assertEquals(piped, render(binary(LumOpcode.PIPE, identity, var("g"))));
    }

    @Test
    public void testDo() {
        LumDoExpression block = new LumDoExpression(List.of(
                new LumLetStatement("x", new LumApplyExpression(var("f"))),
                new LumExpressionStatement(new LumApplyExpression(var("log"), var("x")))),
                var("x"));
        String expected = """
                (() => {
                  const x = f();
                  log(x);
                  return x;
                })()""";
        Assert.assertEquals(expected, render(block));
    }

    @Test
    public void testNestedClosures() {
        LumLetExpression let = new LumLetExpression(List.of(
                new LumLetExpression.Binding("x",
                        new LumIfExpression(var("c"), lit(1), lit(2)))),
                var("x"));
        String expected = """
                (() => {
                  const x = (() => {
                    if (c) {
                      return 1;
                    } else {
                      return 2;
                    }
                  })();
                  return x;
                })()""";
        Assert.assertEquals(expected, render(let));
    }

    @Test
    public void testNoIndentation() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.indent = 0;
        LumCompiler compiler = new LumCompiler(options);
        String result = compiler.render(new LumIfExpression(var("c"), lit(1), lit(2)));
        Assert.assertEquals("(() => {if (c) {return 1;} else {return 2;}})()", result);
    }

    @Test
    public void testDeterminism() {
        LumExpression expression = new LumLetExpression(List.of(
                new LumLetExpression.Binding("x", new LumMapExpression(var("xs"), "e",
                        new LumIfExpression(var("e"), lit(1), lit(0))))),
                new LumUnaryExpression(LumOpcode.LENGTH, var("x")));
        LumCompiler compiler = testCompiler();
        String first = compiler.render(expression);
        String second = compiler.render(expression);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first, render(expression));
    }

    @Test
    public void testCompositionality() {
        LumExpression child = new LumIfExpression(var("c"), lit(1), lit(2));
        LumExpression parent = binary(LumOpcode.ADD, child, lit(3));
        Assert.assertEquals("(" + render(child) + " + 3)", render(parent));
        LumExpression call = new LumApplyExpression(var("f"), child, var("y"));
        Assert.assertEquals("f(" + render(child) + ", y)", render(call));
    }
}
