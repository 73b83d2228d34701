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

import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.errors.UnimplementedException;
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.asCompiler.compiler.visitors.inner.PatternVariables;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.pattern.LumAsPattern;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumListPattern;
import org.lumata.asCompiler.ir.pattern.LumLiteralPattern;
import org.lumata.asCompiler.ir.pattern.LumOrPattern;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.pattern.LumRecordPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;
import org.lumata.util.Logger;
import org.lumata.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Compiles a pattern tested against a value into a boolean condition
 * and the list of variables the pattern binds.
 * The value is given as the text of an AssemblyScript expression,
 * which is duplicated verbatim in the generated code, so it should not have side effects. */
public class PatternCompiler extends InnerVisitor {
    /** Reference to the value matched by the pattern currently visited. */
    String valueRef;
    @Nullable
    CompiledPattern result;

    public PatternCompiler(LumCompiler compiler) {
        super(compiler);
        this.valueRef = "";
        this.result = null;
    }

    /** Compile a pattern.
     * @param pattern  Pattern to compile.
     * @param valueRef Expression producing the value matched. */
    public CompiledPattern compile(LumPattern pattern, String valueRef) {
        String saveRef = this.valueRef;
        this.valueRef = valueRef;
        this.result = null;
        pattern.accept(this);
        CompiledPattern compiled = this.result;
        if (compiled == null)
            throw new InternalCompilerError("No code produced for pattern", pattern);
        this.valueRef = saveRef;
        this.result = null;
        if (this.context.isEmpty()) {
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Compiled ")
                    .append(pattern)
                    .append(" against ")
                    .append(valueRef)
                    .append(" to ")
                    .append(compiled.condition())
                    .newline();
        }
        return compiled;
    }

    /** Conjunction of conditions; bindings of all parts are concatenated. */
    static CompiledPattern and(List<String> conditions, List<CompiledPattern> parts) {
        List<String> all = new ArrayList<>(conditions);
        List<CompiledPattern.Binding> bindings = new ArrayList<>();
        for (CompiledPattern part: parts) {
            all.add(part.condition());
            bindings.addAll(part.bindings());
        }
        return new CompiledPattern(String.join(" && ", all), bindings);
    }

    void set(CompiledPattern result) {
        this.result = result;
    }

    @Override
    public VisitDecision preorder(ILumNode node) {
        throw new UnsupportedException("Unhandled node in pattern", node);
    }

    @Override
    public VisitDecision preorder(LumPattern pattern) {
        throw new UnsupportedException("Unhandled pattern", pattern);
    }

    @Override
    public VisitDecision preorder(LumWildcardPattern pattern) {
        this.set(new CompiledPattern(CompiledPattern.TRUE));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumIdentifierPattern pattern) {
        this.set(new CompiledPattern(CompiledPattern.TRUE,
                List.of(new CompiledPattern.Binding(pattern.identifier, this.valueRef))));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumLiteralPattern pattern) {
        String literal = ToAsInnerVisitor.toAsString(this.compiler, pattern.literal);
        this.set(new CompiledPattern(this.valueRef + " === " + literal));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumConstructorPattern pattern) {
        String ref = this.valueRef;
        this.push(pattern);
        List<CompiledPattern> parts = new ArrayList<>();
        int size = pattern.arguments.size();
        for (int i = 0; i < size; i++) {
            String payload = AsRuntimeLibrary.constructorPayload(ref, i, size);
            parts.add(this.compile(pattern.arguments.get(i), payload));
        }
        this.pop(pattern);
        this.set(and(List.of(ref + " instanceof " + pattern.constructor), parts));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumRecordPattern pattern) {
        String ref = this.valueRef;
        this.push(pattern);
        List<CompiledPattern> parts = new ArrayList<>();
        for (LumRecordPattern.Field field: pattern.fields)
            parts.add(this.compile(field.pattern, ref + "." + field.name));
        this.pop(pattern);
        this.set(and(List.of(ref + " !== null"), parts));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumListPattern pattern) {
        String ref = this.valueRef;
        this.push(pattern);
        List<CompiledPattern> parts = new ArrayList<>();
        int size = pattern.elements.size();
        for (int i = 0; i < size; i++)
            parts.add(this.compile(pattern.elements.get(i), ref + "[" + i + "]"));
        boolean exact = pattern.tail == null || pattern.tail.is(LumWildcardPattern.class);
        String length = ref + ".length " + (exact ? "===" : ">=") + " " + size;
        parts.add(new CompiledPattern(length));
        if (pattern.tail != null)
            parts.add(this.compile(pattern.tail, ref + ".slice(" + size + ")"));
        this.pop(pattern);
        this.set(and(List.of("Array.isArray(" + ref + ")"), parts));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumAsPattern pattern) {
        String ref = this.valueRef;
        this.push(pattern);
        CompiledPattern inner = this.compile(pattern.pattern, ref);
        this.pop(pattern);
        List<CompiledPattern.Binding> bindings = new ArrayList<>();
        bindings.add(new CompiledPattern.Binding(pattern.identifier, ref));
        bindings.addAll(inner.bindings());
        this.set(new CompiledPattern(inner.condition(), bindings));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumOrPattern pattern) {
        String ref = this.valueRef;
        List<String> variables = PatternVariables.of(this.compiler, pattern);
        if (!variables.isEmpty())
            throw new UnimplementedException("Alternatives of an or-pattern cannot bind variables: "
                    + String.join(", ", variables), pattern);
        this.push(pattern);
        List<String> conditions = new ArrayList<>();
        for (LumPattern alternative: pattern.alternatives) {
            CompiledPattern compiled = this.compile(alternative, ref);
            Utilities.enforce(!compiled.hasBindings());
            conditions.add("(" + compiled.condition() + ")");
        }
        this.pop(pattern);
        // Parenthesized, since the result may be conjoined with other conditions
        this.set(new CompiledPattern("(" + String.join(" || ", conditions) + ")"));
        return VisitDecision.STOP;
    }
}
