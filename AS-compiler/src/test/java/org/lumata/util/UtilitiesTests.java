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

package org.lumata.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;

import java.util.ArrayList;
import java.util.List;

public class UtilitiesTests {
    @Test
    public void testEscape() {
        Assert.assertEquals("plain", Utilities.escape("plain"));
        Assert.assertEquals("a\\\"b", Utilities.escape("a\"b"));
        Assert.assertEquals("a\\\\b", Utilities.escape("a\\b"));
        Assert.assertEquals("\\r\\n\\t", Utilities.escape("\r\n\t"));
        Assert.assertEquals("\\u0000", Utilities.escape("\0"));
        Assert.assertEquals("\"café\"", Utilities.doubleQuote("café"));
        Assert.assertEquals("'x'", Utilities.singleQuote("x"));
    }

    @Test
    public void testEnforce() {
        Utilities.enforce(true);
        InternalCompilerError ex = Assert.assertThrows(InternalCompilerError.class,
                () -> Utilities.enforce(false, "broken"));
        Assert.assertTrue(ex.getMessage().contains("broken"));
    }

    @Test
    public void testLists() {
        List<Integer> list = new ArrayList<>(List.of(1, 2, 3));
        Assert.assertEquals(3, (int) Utilities.last(list));
        Assert.assertEquals(3, (int) Utilities.removeLast(list));
        Assert.assertEquals(List.of(1, 2), list);
        Assert.assertEquals(List.of(2, 4), Linq.map(list, x -> x * 2));
    }

    @Test
    public void testProperties() throws Exception {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        JsonNode node = mapper.readTree("{ \"s\": \"text\", \"n\": 5, \"b\": true, \"z\": null }");
        Assert.assertEquals("text", Utilities.getStringProperty(node, "s"));
        Assert.assertEquals(5, Utilities.getLongProperty(node, "n"));
        Assert.assertTrue(Utilities.getBooleanProperty(node, "b"));
        Assert.assertNull(Utilities.getOptionalProperty(node, "z"));
        Assert.assertNull(Utilities.getOptionalStringProperty(node, "missing"));
        Assert.assertThrows(CompilationError.class, () -> Utilities.getStringProperty(node, "n"));
        Assert.assertThrows(CompilationError.class, () -> Utilities.getLongProperty(node, "s"));
        Assert.assertThrows(CompilationError.class, () -> Utilities.getProperty(node, "missing"));
    }
}
