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
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.errors.UnimplementedException;
import org.lumata.asCompiler.ir.expression.LumApplyExpression;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.asCompiler.ir.expression.LumTryExpression;
import org.lumata.asCompiler.ir.expression.literal.LumBoolLiteral;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumLiteralPattern;
import org.lumata.asCompiler.ir.pattern.LumOrPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;

import java.util.List;

/** Tests for the code generated for case and try expressions */
public class CaseAssemblyTests extends BaseAsTests {
    @Test
    public void testOptionCase() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(
                        new LumConstructorPattern("Some", new LumIdentifierPattern("v")), var("v")),
                new LumCaseExpression.Arm(new LumWildcardPattern(), lit(0)));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch instanceof Some && true) {
                    const v = valueToMatch.value;
                    return v;
                  } else {
                    return 0;
                  }
                })(x)""";
        String result = render(expression);
        Assert.assertEquals(expected, result);
        Assert.assertFalse(result.contains("throw"));
    }

    @Test
    public void testFirstMatchWins() {
        LumCaseExpression expression = new LumCaseExpression(lit(1),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(1)), str("a")),
                new LumCaseExpression.Arm(new LumIdentifierPattern("x"), str("b")));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch === 1) {
                    return "a";
                  } else {
                    const x = valueToMatch;
                    return "b";
                  }
                })(1)""";
        String result = render(expression);
        Assert.assertEquals(expected, result);
        Assert.assertTrue(result.indexOf("\"a\"") < result.indexOf("\"b\""));
    }

    @Test
    public void testNoMatch() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(1)), str("one")),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(2)), str("two")));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch === 1) {
                    return "one";
                  } else if (valueToMatch === 2) {
                    return "two";
                  } else {
                    throw new Error("No match found for value: " + String(valueToMatch));
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testSingleIrrefutableArm() {
        LumCaseExpression expression = new LumCaseExpression(new LumApplyExpression(var("f")),
                new LumCaseExpression.Arm(new LumIdentifierPattern("y"), var("y")));
        String expected = """
                ((valueToMatch: any) => {
                  const y = valueToMatch;
                  return y;
                })(f())""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testScrutineeEvaluatedOnce() {
        LumCaseExpression expression = new LumCaseExpression(new LumApplyExpression(var("next")),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(1)), str("one")),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(2)), str("two")),
                new LumCaseExpression.Arm(new LumWildcardPattern(), str("many")));
        String result = render(expression);
        Assert.assertEquals(result.indexOf("next()"), result.lastIndexOf("next()"));
    }

    @Test
    public void testGuardWithBindings() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumIdentifierPattern("n"),
                        new LumBinaryExpression(LumOpcode.GREATER_THAN, var("n"), lit(0)), var("n")),
                new LumCaseExpression.Arm(new LumWildcardPattern(), lit(0)));
        String expected = """
                ((valueToMatch: any) => {
                  if (true && (() => {
                    const n = valueToMatch;
                    return ((n > 0));
                  })()) {
                    const n = valueToMatch;
                    return n;
                  } else {
                    return 0;
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testGuardedOrArm() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(
                        new LumOrPattern(new LumLiteralPattern(lit(1)), new LumLiteralPattern(lit(2))),
                        var("ok"), lit(10)),
                new LumCaseExpression.Arm(new LumWildcardPattern(), lit(0)));
        String expected = """
                ((valueToMatch: any) => {
                  if (((valueToMatch === 1) || (valueToMatch === 2)) && (ok)) {
                    return 10;
                  } else {
                    return 0;
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testOrInsideConstructorArm() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumConstructorPattern("Some",
                        new LumOrPattern(new LumLiteralPattern(lit(1)), new LumLiteralPattern(lit(2)))), lit(10)),
                new LumCaseExpression.Arm(new LumWildcardPattern(), lit(0)));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch instanceof Some && ((valueToMatch.value === 1) || (valueToMatch.value === 2))) {
                    return 10;
                  } else {
                    return 0;
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testGuardWithoutBindings() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(1)), var("b"), str("a")),
                new LumCaseExpression.Arm(new LumWildcardPattern(), str("z")));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch === 1 && (b)) {
                    return "a";
                  } else {
                    return "z";
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testGuardedLastArmIsNotFinal() {
        // A guarded catch-all may fail, so the fallback is still needed
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumWildcardPattern(), var("ok"), lit(1)));
        String expected = """
                ((valueToMatch: any) => {
                  if (true && (ok)) {
                    return 1;
                  } else {
                    throw new Error("No match found for value: " + String(valueToMatch));
                  }
                })(x)""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testNestedCase() {
        LumCaseExpression inner = new LumCaseExpression(var("y"),
                new LumCaseExpression.Arm(new LumLiteralPattern(lit(0)), str("zero")),
                new LumCaseExpression.Arm(new LumWildcardPattern(), str("other")));
        LumCaseExpression outer = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumLiteralPattern(new LumBoolLiteral(true)), inner),
                new LumCaseExpression.Arm(new LumWildcardPattern(), str("no")));
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch === true) {
                    return ((valueToMatch: any) => {
                      if (valueToMatch === 0) {
                        return "zero";
                      } else {
                        return "other";
                      }
                    })(y);
                  } else {
                    return "no";
                  }
                })(x)""";
        Assert.assertEquals(expected, render(outer));
    }

    @Test
    public void testTry() {
        LumTryExpression expression = new LumTryExpression(new LumApplyExpression(var("f")),
                new LumTryExpression.CatchArm(new LumConstructorPattern("Timeout"), lit(0)));
        String expected = """
                (() => {
                  try {
                    return f();
                  } catch (caught: any) {
                    if (caught instanceof Timeout) {
                      return 0;
                    } else {
                      throw caught;
                    }
                  }
                })()""";
        Assert.assertEquals(expected, render(expression));
    }

    @Test
    public void testTryCatchAll() {
        LumTryExpression expression = new LumTryExpression(new LumApplyExpression(var("f")),
                new LumTryExpression.CatchArm(new LumConstructorPattern("Timeout"), lit(0)),
                new LumTryExpression.CatchArm(new LumIdentifierPattern("e"),
                        new LumApplyExpression(var("report"), var("e"))));
        String expected = """
                (() => {
                  try {
                    return f();
                  } catch (caught: any) {
                    if (caught instanceof Timeout) {
                      return 0;
                    } else {
                      const e = caught;
                      return report(e);
                    }
                  }
                })()""";
        String result = render(expression);
        Assert.assertEquals(expected, result);
        Assert.assertFalse(result.contains("throw"));
    }

    @Test
    public void testEmptyArms() {
        Assert.assertThrows(InternalCompilerError.class,
                () -> new LumCaseExpression(var("x"), List.of()));
        Assert.assertThrows(InternalCompilerError.class,
                () -> new LumTryExpression(var("x"), List.of()));
    }

    @Test
    public void testOrPatternBindingRejected() {
        LumCaseExpression expression = new LumCaseExpression(var("x"),
                new LumCaseExpression.Arm(new LumOrPattern(
                        new LumConstructorPattern("Left", new LumIdentifierPattern("v")),
                        new LumConstructorPattern("Right", new LumIdentifierPattern("v"))), var("v")));
        Assert.assertThrows(UnimplementedException.class, () -> render(expression));
    }
}
