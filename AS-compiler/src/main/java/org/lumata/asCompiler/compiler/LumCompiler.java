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

import org.lumata.asCompiler.compiler.backend.JsonDecoder;
import org.lumata.asCompiler.compiler.backend.as.ToAsInnerVisitor;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.asCompiler.compiler.errors.CompilerMessages;
import org.lumata.asCompiler.ir.expression.ExpressionTree;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.util.IWritesLogs;
import org.lumata.util.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * This class compiles Lumata expression trees into AssemblyScript.
 * A compiler instance accumulates the messages produced by all the
 * compilations it performs; each compilation is independent otherwise.
 * Compiler instances are not thread-safe; use one instance per thread.
 */
public class LumCompiler implements IErrorReporter, ICompilerComponent, IWritesLogs {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    /** Tree decoded by the last call to compileInput. */
    @Nullable
    LumExpression tree;
    /** Code produced by the last successful compilation. */
    @Nullable
    String finalCode;
    /** Program read by setEntireInput. */
    @Nullable
    String input;

    public LumCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(this);
        this.tree = null;
        this.finalCode = null;
        this.input = null;
    }

    @Override
    public LumCompiler compiler() {
        return this;
    }

    /** Render an expression.  Throws on failure. */
    public String render(LumExpression expression) {
        return ToAsInnerVisitor.toAsString(this, expression);
    }

    /** Decode a tree from its JSON representation.  Throws on failure. */
    public LumExpression decode(String json) {
        JsonDecoder decoder = new JsonDecoder();
        return decoder.decode(json, LumExpression.class);
    }

    /** Read the whole input from a stream. */
    public void setEntireInput(InputStream contents) throws IOException {
        this.input = new String(contents.readAllBytes(), StandardCharsets.UTF_8);
    }

    /** Compile the input supplied by setEntireInput. */
    public void compileInput() {
        if (this.input == null)
            throw new CompilationError("compileInput has been called without calling setEntireInput");
        this.compileInput(this.input);
    }

    /** Decode and render a tree given in JSON.  Errors are reported
     * as messages; the result is available from getFinalCode. */
    public void compileInput(String json) {
        long start = System.currentTimeMillis();
        this.finalCode = null;
        this.tree = null;
        try {
            this.tree = this.decode(json);
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Decoded ")
                    .appendSupplier(() -> ExpressionTree.asTree(this.checkTree()))
                    .newline();
            if (!this.options.ioOptions.emitTree)
                this.finalCode = this.render(this.tree);
        } catch (RuntimeException e) {
            this.messages.reportError(e);
            this.rethrow(e);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compilation time ")
                .appendSupplier(() -> (System.currentTimeMillis() - start) + "ms")
                .newline();
    }

    void rethrow(RuntimeException e) {
        if (this.options.languageOptions.throwOnError)
            throw e;
    }

    LumExpression checkTree() {
        if (this.tree == null)
            throw new CompilationError("No tree has been decoded");
        return this.tree;
    }

    /** The tree decoded by the last compilation, printed one node per line. */
    public String getTreeStructure() {
        return ExpressionTree.asTree(this.checkTree());
    }

    /** The code generated by the last compilation, or null if it failed. */
    @Nullable
    public String getFinalCode() {
        return this.finalCode;
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.messages.reportProblem(warning, errorType, message);
        if (!warning && this.options.languageOptions.throwOnError) {
            System.err.println(this.messages);
            throw new CompilationError("Error during compilation");
        }
    }

    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /** Throw if any error has been encountered.
     * Displays the errors on stderr as well. */
    public void throwIfErrorsOccurred() {
        if (this.hasErrors()) {
            this.showErrors(System.err);
            throw new CompilationError("Error during compilation");
        }
    }
}
