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

package org.lumata.asCompiler.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.CompilerOptions;
import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.expression.LumApplyExpression;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumIfExpression;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.asCompiler.ir.expression.LumVariablePath;
import org.lumata.asCompiler.ir.expression.literal.LumIntLiteral;
import org.lumata.asCompiler.ir.pattern.LumAsPattern;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumListPattern;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.pattern.LumRecordPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;

import java.util.ArrayList;
import java.util.List;

/** Tests for the traversal performed by inner visitors */
public class InnerVisitorTests {
    static LumCompiler compiler() {
        return new LumCompiler(new CompilerOptions());
    }

    /** Records the variables referenced, in visit order. */
    static class VariableReferences extends InnerVisitor {
        final List<String> variables = new ArrayList<>();
        final List<Integer> depths = new ArrayList<>();

        VariableReferences(LumCompiler compiler) {
            super(compiler);
        }

        @Override
        public VisitDecision preorder(LumVariablePath expression) {
            this.variables.add(expression.variable);
            this.depths.add(this.context.size());
            return VisitDecision.CONTINUE;
        }
    }

    /** Does not descend into conditionals. */
    static class SkipIf extends VariableReferences {
        SkipIf(LumCompiler compiler) {
            super(compiler);
        }

        @Override
        public VisitDecision preorder(LumIfExpression expression) {
            return VisitDecision.STOP;
        }
    }

    @Test
    public void testOrder() {
        LumExpression expression = new LumApplyExpression(new LumVariablePath("f"),
                new LumBinaryExpression(LumOpcode.ADD, new LumVariablePath("a"), new LumVariablePath("b")),
                new LumVariablePath("c"));
        VariableReferences visitor = new VariableReferences(compiler());
        visitor.apply(expression);
        Assert.assertEquals(List.of("f", "a", "b", "c"), visitor.variables);
        Assert.assertEquals(List.of(1, 2, 2, 1), visitor.depths);
        Assert.assertNull(visitor.getParent());
    }

    @Test
    public void testStop() {
        LumExpression expression = new LumBinaryExpression(LumOpcode.ADD,
                new LumIfExpression(new LumVariablePath("c"), new LumVariablePath("t"), new LumVariablePath("e")),
                new LumVariablePath("x"));
        VariableReferences visitor = new SkipIf(compiler());
        visitor.apply(expression);
        Assert.assertEquals(List.of("x"), visitor.variables);
    }

    @Test
    public void testCaseArms() {
        LumExpression expression = new LumCaseExpression(new LumVariablePath("s"),
                new LumCaseExpression.Arm(new LumWildcardPattern(), new LumVariablePath("g"), new LumVariablePath("r")));
        VariableReferences visitor = new VariableReferences(compiler());
        visitor.apply(expression);
        Assert.assertEquals(List.of("s", "g", "r"), visitor.variables);
    }

    @Test
    public void testCorruptedContext() {
        VariableReferences visitor = new VariableReferences(compiler());
        ILumNode first = new LumIntLiteral(1);
        ILumNode second = new LumIntLiteral(2);
        visitor.push(first);
        Assert.assertEquals(first, visitor.getParent());
        Assert.assertThrows(InternalCompilerError.class, () -> visitor.pop(second));
    }

    @Test
    public void testPatternVariables() {
        LumPattern pattern = new LumAsPattern("all", new LumConstructorPattern("Pair",
                new LumIdentifierPattern("a"),
                new LumRecordPattern(new LumRecordPattern.Field("f", new LumIdentifierPattern("b"))),
                new LumListPattern(List.of(new LumWildcardPattern()), new LumIdentifierPattern("rest"))));
        Assert.assertEquals(List.of("all", "a", "b", "rest"), PatternVariables.of(compiler(), pattern));
        Assert.assertTrue(PatternVariables.of(compiler(), new LumWildcardPattern()).isEmpty());
    }
}
