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

package org.lumata.asCompiler;

import org.junit.Assert;
import org.junit.Test;
import org.lumata.asCompiler.compiler.errors.CompilerMessages;
import org.lumata.util.Utilities;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.lumata.asCompiler.compiler.backend.JsonDecoderTests.readResource;

/** Tests that invoke the compiler through the command-line interface */
public class CompilerMainTests {
    static Path writeInput(String resource) throws IOException {
        Path input = Files.createTempFile("input", ".json");
        input.toFile().deleteOnExit();
        Utilities.writeFile(input, readResource(resource));
        return input;
    }

    static Path outputFile() throws IOException {
        File file = File.createTempFile("output", ".ts");
        file.deleteOnExit();
        return file.toPath();
    }

    @Test
    public void testCompileFile() throws IOException {
        Path input = writeInput("option_case.json");
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
        String code = Utilities.readFile(output);
        String expected = """
                ((valueToMatch: any) => {
                  if (valueToMatch instanceof Some && true) {
                    const v = valueToMatch.value;
                    return v;
                  } else {
                    return 0;
                  }
                })(x)
                """;
        Assert.assertEquals(expected, code.replace(System.lineSeparator(), "\n"));
    }

    @Test
    public void testIndentOption() throws IOException {
        Path input = writeInput("option_case.json");
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("--indent", "4", "-o", output.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        String code = Utilities.readFile(output);
        Assert.assertTrue(code.contains("\n    if (valueToMatch instanceof Some && true) {\n        const v"));
    }

    @Test
    public void testCompilationError() throws IOException {
        Path input = writeInput("unknown_operator.json");
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.toString(), input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
    }

    @Test
    public void testMissingFile() throws IOException {
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.toString(), "/no/such/file.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading file", messages.getError(0).errorType);
    }

    @Test
    public void testBadOptions() {
        Assert.assertEquals(CompilerMain.OPTIONS_ERROR, CompilerMain.execute("--noSuchOption").exitCode);
        Assert.assertEquals(CompilerMain.OPTIONS_ERROR, CompilerMain.execute("-TNoSuchClass=1", "x.json").exitCode);
        Assert.assertEquals(CompilerMain.OPTIONS_ERROR, CompilerMain.execute("-TPatternCompiler=high", "x.json").exitCode);
    }

    @Test
    public void testHelp() {
        CompilerMessages messages = CompilerMain.execute("-h");
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
    }
}
