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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.lumata.asCompiler.compiler.CompilerOptions;
import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.errors.BaseCompilerException;
import org.lumata.asCompiler.compiler.errors.CompilerMessages;
import org.lumata.util.Logger;
import org.lumata.util.Utilities;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the Lumata to AssemblyScript compiler. */
public class CompilerMain {
    /** Exit code for invalid command-line options. */
    public static final int OPTIONS_ERROR = 2;

    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        // JCommander mistakenly prints this as default value
        // if it manages to parse it partially.
        this.options.ioOptions.loggingLevel.clear();
        commander.usage();
    }

    /** Parse the command-line options.
     * @return 0 on success, a non-zero exit code otherwise. */
    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("lumata-to-as");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return OPTIONS_ERROR;
        }
        if (this.options.help) {
            this.usage(commander);
            return 0;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return OPTIONS_ERROR;
            } catch (BaseCompilerException ex) {
                System.err.println(ex.getMessage());
                return OPTIONS_ERROR;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty() || this.options.ioOptions.emitTree)
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), true, StandardCharsets.UTF_8);
    }

    InputStream getInputFile() throws IOException {
        if (this.options.ioOptions.readsStdin())
            return System.in;
        return Files.newInputStream(Paths.get(this.options.ioOptions.inputFile));
    }

    /** Run compiler, return the messages produced. */
    CompilerMessages run() {
        LumCompiler compiler = new LumCompiler(this.options);
        if (!this.options.validate(compiler)) {
            compiler.messages.setExitCode(OPTIONS_ERROR);
            return compiler.messages;
        }
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        try {
            InputStream input = this.getInputFile();
            compiler.setEntireInput(input);
            if (input != System.in)
                input.close();
        } catch (IOException e) {
            compiler.reportError("Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return compiler.messages;
        }

        compiler.compileInput();
        if (compiler.hasErrors())
            return compiler.messages;
        String output = this.options.ioOptions.emitTree ?
                compiler.getTreeStructure() : compiler.getFinalCode();
        try {
            PrintStream stream = this.getOutputStream();
            stream.println(output);
            if (stream != System.out)
                stream.close();
        } catch (IOException e) {
            compiler.reportError("Error writing to output file", e.getMessage());
        }
        return compiler.messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0 || main.options.help) {
            // return empty messages
            CompilerMessages result = new CompilerMessages(new LumCompiler(new CompilerOptions()));
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
