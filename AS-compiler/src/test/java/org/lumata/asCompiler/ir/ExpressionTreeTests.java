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

package org.lumata.asCompiler.ir;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.ir.expression.ExpressionTree;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.asCompiler.ir.expression.LumVariablePath;
import org.lumata.asCompiler.ir.expression.literal.LumIntLiteral;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;

/** Tests for the textual display of trees */
public class ExpressionTreeTests {
    @Test
    public void testAsTree() {
        LumExpression expression = new LumBinaryExpression(LumOpcode.MULTIPLY,
                new LumVariablePath("x"), new LumIntLiteral(3));
        String tree = ExpressionTree.asTree(expression);
        String[] lines = tree.split("\n");
        Assert.assertTrue(lines[0].endsWith("LumBinaryExpression opcode=*"));
        Assert.assertTrue(lines[1].startsWith("  "));
        Assert.assertTrue(tree.contains("LumVariablePath variable=x"));
        Assert.assertTrue(tree.contains("LumIntLiteral value=3"));
    }

    @Test
    public void testHelpersAreShown() {
        LumExpression expression = new LumCaseExpression(new LumVariablePath("x"),
                new LumCaseExpression.Arm(new LumConstructorPattern("Some", new LumIdentifierPattern("v")),
                        new LumVariablePath("v")));
        String tree = ExpressionTree.asTree(expression);
        Assert.assertTrue(tree.contains("Arm"));
        Assert.assertTrue(tree.contains("LumConstructorPattern constructor=Some"));
        Assert.assertTrue(tree.contains("LumIdentifierPattern identifier=v"));
    }

    @Test
    public void testToString() {
        LumExpression expression = new LumBinaryExpression(LumOpcode.ADD,
                new LumVariablePath("x"), new LumIntLiteral(3));
        Assert.assertEquals("(x + 3)", expression.toString());
    }
}
