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

package org.lumata.asCompiler.compiler;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.asCompiler.compiler.errors.CompilerMessages;
import org.lumata.asCompiler.compiler.errors.UnsupportedException;

import java.io.IOException;

import static org.lumata.asCompiler.compiler.backend.JsonDecoderTests.readResource;

/** Tests for the compiler facade */
public class LumCompilerTests {
    static final String PROGRAM_OUTPUT = """
            (() => {
              const double = (n: i32) => {
                return (n * 2);
              };
              return (() => {
                try {
                  return [1, 2].map((e) => double(e)).reduce((acc, e) => (acc + e), 0);
                } catch (caught: any) {
                  if (caught !== null && caught.code === "overflow") {
                    return -1;
                  } else {
                    throw caught;
                  }
                }
              })();
            })()""";

    @Test
    public void testCompileInput() throws IOException {
        LumCompiler compiler = new LumCompiler(new CompilerOptions());
        compiler.compileInput(readResource("add.json"));
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertEquals("(1 + 2)", compiler.getFinalCode());
    }

    @Test
    public void testProgram() throws IOException {
        LumCompiler compiler = new LumCompiler(new CompilerOptions());
        compiler.compileInput(readResource("program.json"));
        Assert.assertTrue(compiler.messages.isEmpty());
        Assert.assertEquals(PROGRAM_OUTPUT, compiler.getFinalCode());
    }

    @Test
    public void testErrorsAreReported() throws IOException {
        LumCompiler compiler = new LumCompiler(new CompilerOptions());
        compiler.compileInput(readResource("unknown_operator.json"));
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertNull(compiler.getFinalCode());
        Assert.assertEquals(1, compiler.messages.errorCount());
        CompilerMessages.Message message = compiler.messages.getError(0);
        Assert.assertEquals(UnsupportedException.KIND, message.errorType);
        Assert.assertTrue(compiler.messages.toString().startsWith("error: Not supported: Unknown operator"));

        // A later successful compilation does not erase the messages
        compiler.compileInput(readResource("add.json"));
        Assert.assertEquals("(1 + 2)", compiler.getFinalCode());
        Assert.assertEquals(1, compiler.messages.errorCount());
    }

    @Test
    public void testReportedErrorKinds() {
        LumCompiler compiler = new LumCompiler(new CompilerOptions());
        Throwable unsupported = new UnsupportedException("no such thing");
        compiler.messages.reportError(unsupported);
        compiler.messages.reportError(new IllegalStateException("broken"));
        Assert.assertEquals(2, compiler.messages.errorCount());
        Assert.assertEquals(UnsupportedException.KIND, compiler.messages.getError(0).errorType);
        Assert.assertTrue(compiler.messages.getError(1).errorType.startsWith("This is a bug"));
        Assert.assertEquals("broken", compiler.messages.getError(1).message);
    }

    @Test
    public void testJsonErrors() throws IOException {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.emitJsonErrors = true;
        LumCompiler compiler = new LumCompiler(options);
        compiler.compileInput(readResource("malformed.json"));
        String json = compiler.messages.toString();
        Assert.assertTrue(json.startsWith("["));
        Assert.assertTrue(json.contains("\"error_type\" : \"Compilation error\""));
    }

    @Test
    public void testThrowOnError() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.throwOnError = true;
        LumCompiler compiler = new LumCompiler(options);
        Assert.assertThrows(CompilationError.class, () -> compiler.compileInput("{"));
        Assert.assertTrue(compiler.hasErrors());
    }

    @Test
    public void testWarnings() {
        LumCompiler compiler = new LumCompiler(new CompilerOptions());
        compiler.reportWarning("Test", "just a warning");
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals("warning: Test: just a warning" + System.lineSeparator(),
                compiler.messages.toString());
    }

    @Test
    public void testTreeStructure() throws IOException {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.emitTree = true;
        LumCompiler compiler = new LumCompiler(options);
        compiler.compileInput(readResource("add.json"));
        Assert.assertNull(compiler.getFinalCode());
        String tree = compiler.getTreeStructure();
        Assert.assertTrue(tree.contains("LumBinaryExpression"));
        Assert.assertTrue(tree.contains("opcode=+"));
        Assert.assertTrue(tree.contains("LumIntLiteral value=2"));
    }

    @Test
    public void testInvalidOptions() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.indent = -1;
        LumCompiler compiler = new LumCompiler(options);
        Assert.assertFalse(options.validate(compiler));
        Assert.assertTrue(compiler.hasErrors());
    }
}
