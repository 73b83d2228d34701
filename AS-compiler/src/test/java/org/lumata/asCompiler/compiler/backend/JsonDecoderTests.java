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

package org.lumata.asCompiler.compiler.backend;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.asCompiler.ir.expression.LumQualifiedIdentifier;
import org.lumata.asCompiler.ir.expression.literal.LumIntLiteral;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumListPattern;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Tests for decoding trees from JSON */
public class JsonDecoderTests {
    public static String readResource(String name) throws IOException {
        try (InputStream stream = Objects.requireNonNull(
                JsonDecoderTests.class.getResourceAsStream("/trees/" + name), name)) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static LumExpression decode(String json) {
        return new JsonDecoder().decode(json, LumExpression.class);
    }

    @Test
    public void testBinary() throws IOException {
        LumExpression expression = decode(readResource("add.json"));
        LumBinaryExpression binary = expression.to(LumBinaryExpression.class);
        Assert.assertEquals(LumOpcode.ADD, binary.opcode);
        Assert.assertEquals(1, binary.left.to(LumIntLiteral.class).value);
        Assert.assertEquals(2, binary.right.to(LumIntLiteral.class).value);
    }

    @Test
    public void testCase() throws IOException {
        LumCaseExpression expression = decode(readResource("option_case.json")).to(LumCaseExpression.class);
        Assert.assertEquals(2, expression.arms.size());
        LumCaseExpression.Arm first = expression.arms.get(0);
        Assert.assertNull(first.guard);
        LumConstructorPattern pattern = first.pattern.to(LumConstructorPattern.class);
        Assert.assertEquals("Some", pattern.constructor);
        Assert.assertEquals("v", pattern.arguments.get(0).to(LumIdentifierPattern.class).identifier);
        Assert.assertTrue(expression.arms.get(1).pattern.is(LumWildcardPattern.class));
    }

    @Test
    public void testOptionalFields() {
        LumQualifiedIdentifier bare = decode("{ \"class\": \"LumQualifiedIdentifier\", \"name\": \"f\" }")
                .to(LumQualifiedIdentifier.class);
        Assert.assertNull(bare.namespace);
        LumPattern list = new JsonDecoder().decode(
                "{ \"class\": \"LumListPattern\", \"elements\": [], \"tail\": null }", LumPattern.class);
        Assert.assertNull(list.to(LumListPattern.class).tail);
    }

    @Test
    public void testUnknownClass() {
        UnsupportedException ex = Assert.assertThrows(UnsupportedException.class,
                () -> decode("{ \"class\": \"LumXorExpression\" }"));
        Assert.assertTrue(ex.getMessage().contains("LumXorExpression"));
    }

    @Test
    public void testUnknownOperator() throws IOException {
        String json = readResource("unknown_operator.json");
        UnsupportedException ex = Assert.assertThrows(UnsupportedException.class, () -> decode(json));
        Assert.assertTrue(ex.getMessage().contains("Unknown operator: 'Xor'"));
    }

    @Test
    public void testMalformed() throws IOException {
        String json = readResource("malformed.json");
        Assert.assertThrows(CompilationError.class, () -> decode(json));
        Assert.assertThrows(CompilationError.class, () -> decode(""));
        Assert.assertThrows(CompilationError.class, () -> decode("[1, 2]"));
        Assert.assertThrows(CompilationError.class, () -> decode("{ \"value\": 1 }"));
        // Missing property
        Assert.assertThrows(CompilationError.class, () -> decode("{ \"class\": \"LumIntLiteral\" }"));
    }

    @Test
    public void testWrongNodeKind() {
        CompilationError ex = Assert.assertThrows(CompilationError.class,
                () -> decode("{ \"class\": \"LumWildcardPattern\" }"));
        Assert.assertTrue(ex.getMessage().contains("LumExpression"));
    }

    @Test
    public void testEmptyArms() {
        String json = "{ \"class\": \"LumCaseExpression\", " +
                "\"scrutinee\": { \"class\": \"LumVariablePath\", \"variable\": \"x\" }, " +
                "\"arms\": [] }";
        Assert.assertThrows(InternalCompilerError.class, () -> decode(json));
    }
}
