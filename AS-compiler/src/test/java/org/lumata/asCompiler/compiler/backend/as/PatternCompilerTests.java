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
import org.lumata.asCompiler.compiler.errors.UnimplementedException;
import org.lumata.asCompiler.ir.pattern.LumAsPattern;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumListPattern;
import org.lumata.asCompiler.ir.pattern.LumLiteralPattern;
import org.lumata.asCompiler.ir.pattern.LumOrPattern;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.pattern.LumRecordPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;

import java.util.List;

/** Tests for the compilation of patterns into conditions and bindings */
public class PatternCompilerTests extends BaseAsTests {
    static CompiledPattern compile(LumPattern pattern, String valueRef) {
        PatternCompiler compiler = new PatternCompiler(testCompiler());
        return compiler.compile(pattern, valueRef);
    }

    static CompiledPattern.Binding binding(String name, String value) {
        return new CompiledPattern.Binding(name, value);
    }

    @Test
    public void testIrrefutable() {
        for (String ref: List.of("v", "x.field", "xs[3]")) {
            CompiledPattern wildcard = compile(new LumWildcardPattern(), ref);
            Assert.assertEquals("true", wildcard.condition());
            Assert.assertTrue(wildcard.bindings().isEmpty());
            Assert.assertTrue(wildcard.isIrrefutable());

            CompiledPattern variable = compile(new LumIdentifierPattern("n"), ref);
            Assert.assertEquals("true", variable.condition());
            Assert.assertEquals(List.of(binding("n", ref)), variable.bindings());
        }
    }

    @Test
    public void testLiteral() {
        CompiledPattern compiled = compile(new LumLiteralPattern(str("a")), "v");
        Assert.assertEquals("v === \"a\"", compiled.condition());
        Assert.assertTrue(compiled.bindings().isEmpty());
        Assert.assertEquals("v === 3", compile(new LumLiteralPattern(lit(3)), "v").condition());
    }

    @Test
    public void testConstructor() {
        CompiledPattern some = compile(new LumConstructorPattern("Some", new LumIdentifierPattern("x")), "v");
        Assert.assertEquals("v instanceof Some && true", some.condition());
        Assert.assertEquals(List.of(binding("x", "v.value")), some.bindings());

        CompiledPattern pair = compile(new LumConstructorPattern("Pair",
                new LumIdentifierPattern("a"), new LumIdentifierPattern("b")), "v");
        Assert.assertEquals("v instanceof Pair && true && true", pair.condition());
        Assert.assertEquals(List.of(binding("a", "v.arg0"), binding("b", "v.arg1")), pair.bindings());

        CompiledPattern none = compile(new LumConstructorPattern("None"), "v");
        Assert.assertEquals("v instanceof None", none.condition());
        Assert.assertFalse(none.isIrrefutable());
    }

    @Test
    public void testRecord() {
        CompiledPattern compiled = compile(new LumRecordPattern(
                new LumRecordPattern.Field("name", new LumIdentifierPattern("n")),
                new LumRecordPattern.Field("age", new LumLiteralPattern(lit(3)))), "v");
        Assert.assertEquals("v !== null && true && v.age === 3", compiled.condition());
        Assert.assertEquals(List.of(binding("n", "v.name")), compiled.bindings());
    }

    @Test
    public void testListExactLength() {
        CompiledPattern compiled = compile(new LumListPattern(List.of(
                new LumIdentifierPattern("a"), new LumIdentifierPattern("b")), null), "v");
        Assert.assertEquals("Array.isArray(v) && true && true && v.length === 2", compiled.condition());
        Assert.assertEquals(List.of(binding("a", "v[0]"), binding("b", "v[1]")), compiled.bindings());

        CompiledPattern empty = compile(new LumListPattern(List.of(), null), "v");
        Assert.assertEquals("Array.isArray(v) && v.length === 0", empty.condition());
    }

    @Test
    public void testListMinimumLength() {
        CompiledPattern compiled = compile(new LumListPattern(List.of(
                new LumIdentifierPattern("h")), new LumIdentifierPattern("rest")), "v");
        Assert.assertEquals("Array.isArray(v) && true && v.length >= 1 && true", compiled.condition());
        // The tail bindings come last
        Assert.assertEquals(List.of(binding("h", "v[0]"), binding("rest", "v.slice(1)")), compiled.bindings());
    }

    @Test
    public void testListWildcardTail() {
        CompiledPattern compiled = compile(new LumListPattern(List.of(
                new LumLiteralPattern(lit(1))), new LumWildcardPattern()), "v");
        Assert.assertEquals("Array.isArray(v) && v[0] === 1 && v.length === 1 && true", compiled.condition());
        Assert.assertTrue(compiled.bindings().isEmpty());
    }

    @Test
    public void testAs() {
        CompiledPattern compiled = compile(new LumAsPattern("all",
                new LumConstructorPattern("Some", new LumIdentifierPattern("x"))), "v");
        Assert.assertEquals("v instanceof Some && true", compiled.condition());
        // The whole value is bound before the inner variables
        Assert.assertEquals(List.of(binding("all", "v"), binding("x", "v.value")), compiled.bindings());
    }

    @Test
    public void testOr() {
        CompiledPattern compiled = compile(new LumOrPattern(
                new LumLiteralPattern(lit(1)),
                new LumLiteralPattern(lit(2)),
                new LumConstructorPattern("None")), "v");
        Assert.assertEquals("((v === 1) || (v === 2) || (v instanceof None))", compiled.condition());
        Assert.assertTrue(compiled.bindings().isEmpty());
    }

    @Test
    public void testOrInsideConstructor() {
        CompiledPattern compiled = compile(new LumConstructorPattern("Some",
                new LumOrPattern(new LumLiteralPattern(lit(1)), new LumLiteralPattern(lit(2)))), "v");
        // The alternatives are only tested once the constructor matched
        Assert.assertEquals("v instanceof Some && ((v.value === 1) || (v.value === 2))", compiled.condition());
    }

    @Test
    public void testOrWithBindings() {
        LumPattern pattern = new LumOrPattern(
                new LumConstructorPattern("Some", new LumIdentifierPattern("x")),
                new LumWildcardPattern());
        UnimplementedException ex = Assert.assertThrows(UnimplementedException.class, () -> compile(pattern, "v"));
        Assert.assertTrue(ex.getMessage().contains("x"));
    }

    @Test
    public void testNested() {
        LumPattern pattern = new LumConstructorPattern("Some",
                new LumListPattern(List.of(new LumIdentifierPattern("x")), new LumIdentifierPattern("rest")));
        CompiledPattern compiled = compile(pattern, "v");
        Assert.assertEquals(
                "v instanceof Some && Array.isArray(v.value) && true && v.value.length >= 1 && true",
                compiled.condition());
        Assert.assertEquals(List.of(binding("x", "v.value[0]"), binding("rest", "v.value.slice(1)")),
                compiled.bindings());
    }

    @Test
    public void testCompilerIsReusable() {
        PatternCompiler compiler = new PatternCompiler(testCompiler());
        CompiledPattern first = compiler.compile(new LumConstructorPattern("Some", new LumIdentifierPattern("x")), "a");
        CompiledPattern second = compiler.compile(new LumIdentifierPattern("y"), "b");
        Assert.assertEquals("a instanceof Some && true", first.condition());
        Assert.assertEquals(List.of(binding("y", "b")), second.bindings());
    }

    @Test
    public void testBindingText() {
        Assert.assertEquals("const x = v.value;", binding("x", "v.value").toString());
    }
}
