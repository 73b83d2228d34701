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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.lumata.util.IValidate;
import org.lumata.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/** Command-line options for the Lumata to AssemblyScript compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IValidate {
    /** Options related to the generated code. */
    @SuppressWarnings("CanBeFinal")
    public static class Language implements IValidate {
        @Parameter(names = "--indent", description = "Number of spaces used for indentation; 0 emits the code on one line")
        public int indent = 2;
        /** Useful for development */
        public boolean throwOnError = false;

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tindent=" + this.indent +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.indent < 0) {
                reporter.reportError("Invalid options",
                        "Indentation amount must be non-negative; got " + this.indent);
                return false;
            }
            return true;
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names="-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;
        @Parameter(names = "--tree", description = "Print the structure of the input tree instead of compiling it")
        public boolean emitTree = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(description = "JSON file with the tree to compile; stdin if '-'")
        public String inputFile = "-";
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;

        public boolean readsStdin() {
            return this.inputFile.equals("-");
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.emitTree && !this.outputFile.isEmpty()) {
                reporter.reportWarning("Invalid options",
                        "Option --tree prints to stdout; ignoring -o " + Utilities.singleQuote(this.outputFile));
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\temitTree=" + this.emitTree +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help=true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.languageOptions.validate(reporter);
    }
}
