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
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.LumParameter;
import org.lumata.asCompiler.ir.expression.LumApplyExpression;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumClosureExpression;
import org.lumata.asCompiler.ir.expression.LumConstructorExpression;
import org.lumata.asCompiler.ir.expression.LumDoExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumFieldExpression;
import org.lumata.asCompiler.ir.expression.LumFieldValue;
import org.lumata.asCompiler.ir.expression.LumFilterExpression;
import org.lumata.asCompiler.ir.expression.LumFoldExpression;
import org.lumata.asCompiler.ir.expression.LumIfExpression;
import org.lumata.asCompiler.ir.expression.LumIndexExpression;
import org.lumata.asCompiler.ir.expression.LumLetExpression;
import org.lumata.asCompiler.ir.expression.LumMapExpression;
import org.lumata.asCompiler.ir.expression.LumQualifiedIdentifier;
import org.lumata.asCompiler.ir.expression.LumRecordCreationExpression;
import org.lumata.asCompiler.ir.expression.LumRecordUpdateExpression;
import org.lumata.asCompiler.ir.expression.LumTryExpression;
import org.lumata.asCompiler.ir.expression.LumTypeAnnotationExpression;
import org.lumata.asCompiler.ir.expression.LumUnaryExpression;
import org.lumata.asCompiler.ir.expression.LumVariablePath;
import org.lumata.asCompiler.ir.expression.literal.LumBoolLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumIntLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumListLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumRecordLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumStringLiteral;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.statement.LumExpressionStatement;
import org.lumata.asCompiler.ir.statement.LumLetStatement;
import org.lumata.util.IIndentStream;
import org.lumata.util.IndentStreamBuilder;
import org.lumata.util.Linq;
import org.lumata.util.Logger;
import org.lumata.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/**
 * This visitor generates an AssemblyScript implementation of a Lumata expression.
 * Control forms (if, let, do, case, try) become immediately invoked
 * closures, so that every expression produces a value.
 */
public class ToAsInnerVisitor extends InnerVisitor {
    protected final IIndentStream builder;
    protected final AsRuntimeLibrary library;

    /** One arm of a case or try, after the differences between the two are erased. */
    record MatchArm(LumPattern pattern, @Nullable LumExpression guard, LumExpression result) {}

    public ToAsInnerVisitor(LumCompiler compiler, IIndentStream builder) {
        super(compiler);
        this.builder = builder;
        this.library = AsRuntimeLibrary.INSTANCE;
    }

    /** Render a node to AssemblyScript text. */
    public static String toAsString(LumCompiler compiler, ILumNode node) {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        builder.setIndentAmount(compiler.options.languageOptions.indent);
        ToAsInnerVisitor visitor = new ToAsInnerVisitor(compiler, builder);
        visitor.apply(node);
        return builder.toString();
    }

    @Override
    public VisitDecision preorder(ILumNode node) {
        throw new UnsupportedException("Unhandled node", node);
    }

    /////////////////// Literals

    @Override
    public VisitDecision preorder(LumIntLiteral literal) {
        this.builder.append(literal.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumStringLiteral literal) {
        this.builder.append(Utilities.doubleQuote(literal.value));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumBoolLiteral literal) {
        this.builder.append(literal.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumListLiteral literal) {
        this.push(literal);
        this.builder.append("[");
        this.commaSeparated(literal.elements);
        this.builder.append("]");
        this.pop(literal);
        return VisitDecision.STOP;
    }

    void recordFields(List<LumFieldValue> fields) {
        if (fields.isEmpty()) {
            this.builder.append("{}");
            return;
        }
        this.builder.append("{ ");
        this.commaSeparated(fields);
        this.builder.append(" }");
    }

    @Override
    public VisitDecision preorder(LumRecordLiteral literal) {
        this.push(literal);
        this.recordFields(literal.fields);
        this.pop(literal);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumFieldValue field) {
        this.push(field);
        this.builder.append(Utilities.doubleQuote(field.name))
                .append(": ");
        field.value.accept(this);
        this.pop(field);
        return VisitDecision.STOP;
    }

    <T extends ILumNode> void commaSeparated(List<T> nodes) {
        boolean first = true;
        for (T node: nodes) {
            if (!first)
                this.builder.append(", ");
            first = false;
            node.accept(this);
        }
    }

    /////////////////// Names

    @Override
    public VisitDecision preorder(LumVariablePath expression) {
        this.builder.append(expression.variable);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumQualifiedIdentifier expression) {
        if (expression.namespace != null)
            this.builder.append(expression.namespace).append(".");
        this.builder.append(expression.name);
        return VisitDecision.STOP;
    }

    /////////////////// Operators

    @Override
    public VisitDecision preorder(LumBinaryExpression expression) {
        AsRuntimeLibrary.BinaryTemplate template = this.library.getBinaryTemplate(expression.opcode, expression);
        this.push(expression);
        LumExpression first = template.swapped() ? expression.right : expression.left;
        LumExpression second = template.swapped() ? expression.left : expression.right;
        this.builder.append(template.prefix());
        if (template.calls())
            this.callee(first);
        else
            first.accept(this);
        this.builder.append(template.middle());
        if (template.calls())
            this.callee(second);
        else
            second.accept(this);
        this.builder.append(template.suffix());
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumUnaryExpression expression) {
        AsRuntimeLibrary.UnaryTemplate template = this.library.getUnaryTemplate(expression.opcode, expression);
        this.push(expression);
        this.builder.append(template.prefix());
        LumIntLiteral literal = expression.source.as(LumIntLiteral.class);
        // "--1" is a decrement
        if (literal != null && literal.value < 0 && template.prefix().endsWith("-"))
            this.builder.append(" ");
        expression.source.accept(this);
        this.builder.append(template.suffix());
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumTypeAnnotationExpression expression) {
        this.push(expression);
        this.builder.append("(");
        expression.source.accept(this);
        this.builder.append(" as ")
                .append(expression.type)
                .append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    /////////////////// Calls, records, accesses

    /** Emit an expression that is immediately called.
     * An arrow function must be parenthesized in this position. */
    void callee(LumExpression function) {
        boolean parens = function.is(LumClosureExpression.class);
        if (parens)
            this.builder.append("(");
        function.accept(this);
        if (parens)
            this.builder.append(")");
    }

    @Override
    public VisitDecision preorder(LumApplyExpression expression) {
        this.push(expression);
        this.callee(expression.function);
        this.builder.append("(");
        this.commaSeparated(expression.arguments);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumConstructorExpression expression) {
        this.push(expression);
        this.builder.append("new ")
                .append(expression.constructor)
                .append("(");
        this.commaSeparated(expression.arguments);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumRecordCreationExpression expression) {
        this.push(expression);
        this.builder.append("new ")
                .append(expression.recordType)
                .append("(");
        this.recordFields(expression.fields);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumRecordUpdateExpression expression) {
        this.push(expression);
        this.builder.append("({ ...");
        expression.target.accept(this);
        for (LumFieldValue update: expression.updates) {
            this.builder.append(", ");
            update.accept(this);
        }
        this.builder.append(" })");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumFieldExpression expression) {
        this.push(expression);
        expression.expression.accept(this);
        this.builder.append(".")
                .append(expression.fieldName);
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumIndexExpression expression) {
        this.push(expression);
        expression.array.accept(this);
        this.builder.append("[");
        expression.index.accept(this);
        this.builder.append("]");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    /////////////////// Collections

    @Override
    public VisitDecision preorder(LumMapExpression expression) {
        this.push(expression);
        expression.collection.accept(this);
        this.builder.append(".map((")
                .append(expression.iterator)
                .append(") => ");
        expression.transform.accept(this);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumFilterExpression expression) {
        this.push(expression);
        expression.collection.accept(this);
        this.builder.append(".filter((")
                .append(expression.iterator)
                .append(") => ");
        expression.predicate.accept(this);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumFoldExpression expression) {
        this.push(expression);
        expression.collection.accept(this);
        // The accumulator comes first
        this.builder.append(".reduce((")
                .append(expression.accumulatorName)
                .append(", ")
                .append(expression.iterator)
                .append(") => ");
        expression.transform.accept(this);
        this.builder.append(", ");
        expression.initial.accept(this);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    /////////////////// Closures

    /** Emit "return expression;" */
    void returnStatement(LumExpression expression) {
        this.builder.append("return ");
        expression.accept(this);
        this.builder.append(";");
    }

    void startImmediateClosure() {
        this.builder.append("(() => {")
                .increase();
    }

    void endImmediateClosure() {
        this.builder.decrease()
                .append("\n})()");
    }

    @Override
    public VisitDecision preorder(LumParameter parameter) {
        this.builder.append(parameter.name);
        if (parameter.type != null)
            this.builder.append(": ").append(parameter.type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumClosureExpression expression) {
        this.push(expression);
        this.builder.append("(");
        this.commaSeparated(expression.parameters);
        this.builder.append(") => {")
                .increase();
        this.returnStatement(expression.body);
        this.builder.decrease()
                .append("\n}");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumIfExpression expression) {
        this.push(expression);
        this.startImmediateClosure();
        this.builder.append("if (");
        expression.condition.accept(this);
        this.builder.append(") {")
                .increase();
        this.returnStatement(expression.positive);
        this.builder.decrease()
                .append("\n} else {")
                .increase();
        this.returnStatement(expression.negative);
        this.builder.decrease()
                .append("\n}");
        this.endImmediateClosure();
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumLetExpression.Binding binding) {
        this.push(binding);
        this.builder.append("const ")
                .append(binding.variable)
                .append(" = ");
        binding.initializer.accept(this);
        this.builder.append(";");
        this.pop(binding);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumLetExpression expression) {
        this.push(expression);
        this.startImmediateClosure();
        for (LumLetExpression.Binding binding: expression.bindings) {
            binding.accept(this);
            this.builder.newline();
        }
        this.returnStatement(expression.body);
        this.endImmediateClosure();
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumLetStatement statement) {
        this.push(statement);
        this.builder.append("const ")
                .append(statement.variable)
                .append(" = ");
        statement.initializer.accept(this);
        this.builder.append(";");
        this.pop(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumExpressionStatement statement) {
        this.push(statement);
        statement.expression.accept(this);
        this.builder.append(";");
        this.pop(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumDoExpression expression) {
        this.push(expression);
        this.startImmediateClosure();
        for (var statement: expression.statements) {
            statement.accept(this);
            this.builder.newline();
        }
        this.returnStatement(expression.result);
        this.endImmediateClosure();
        this.pop(expression);
        return VisitDecision.STOP;
    }

    /////////////////// Pattern matching

    /** Emit the declarations of the bound variables followed by the result. */
    void armBody(CompiledPattern compiled, LumExpression result) {
        for (CompiledPattern.Binding binding: compiled.bindings()) {
            this.builder.append(binding.toString())
                    .newline();
        }
        this.returnStatement(result);
    }

    /** Emit the guard of an arm.  The guard may refer to the variables
     * bound by the pattern, so these are declared in a nested closure. */
    void guard(CompiledPattern compiled, LumExpression guard) {
        if (!compiled.hasBindings()) {
            this.builder.append("(");
            guard.accept(this);
            this.builder.append(")");
            return;
        }
        this.builder.append("(() => {")
                .increase();
        for (CompiledPattern.Binding binding: compiled.bindings()) {
            this.builder.append(binding.toString())
                    .newline();
        }
        this.builder.append("return (");
        guard.accept(this);
        this.builder.append(");")
                .decrease()
                .append("\n})()");
    }

    /** Emit a chain of if-else statements testing the arms in order.
     * @param arms      Arms to test.
     * @param valueRef  Variable holding the value matched.
     * @param noMatch   Statement executed when no arm matches. */
    void matchArms(List<MatchArm> arms, String valueRef, String noMatch) {
        PatternCompiler patternCompiler = new PatternCompiler(this.compiler);
        boolean first = true;
        for (int i = 0; i < arms.size(); i++) {
            MatchArm arm = arms.get(i);
            CompiledPattern compiled = patternCompiler.compile(arm.pattern(), valueRef);
            boolean last = i == arms.size() - 1;
            if (last && arm.guard() == null && compiled.isIrrefutable()) {
                // The last arm matches everything: no need for a fallback
                if (first) {
                    this.armBody(compiled, arm.result());
                } else {
                    this.builder.append(" else {")
                            .increase();
                    this.armBody(compiled, arm.result());
                    this.builder.decrease()
                            .append("\n}");
                }
                return;
            }
            this.builder.append(first ? "if (" : " else if (")
                    .append(compiled.condition());
            if (arm.guard() != null) {
                this.builder.append(" && ");
                this.guard(compiled, arm.guard());
            }
            this.builder.append(") {")
                    .increase();
            this.armBody(compiled, arm.result());
            this.builder.decrease()
                    .append("\n}");
            first = false;
        }
        this.builder.append(" else {")
                .increase()
                .append(noMatch)
                .decrease()
                .append("\n}");
    }

    @Override
    public VisitDecision preorder(LumCaseExpression expression) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Compiling case with ")
                .append(expression.arms.size())
                .append(" arms")
                .newline();
        this.push(expression);
        String valueRef = AsRuntimeLibrary.CASE_TEMPORARY;
        this.builder.append("((")
                .append(valueRef)
                .append(": any) => {")
                .increase();
        List<MatchArm> arms = Linq.map(expression.arms, a -> new MatchArm(a.pattern, a.guard, a.result));
        this.matchArms(arms, valueRef, "throw " + AsRuntimeLibrary.noMatchError(valueRef) + ";");
        this.builder.decrease()
                .append("\n})(");
        expression.scrutinee.accept(this);
        this.builder.append(")");
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LumTryExpression expression) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Compiling try with ")
                .append(expression.handlers.size())
                .append(" handlers")
                .newline();
        this.push(expression);
        String valueRef = AsRuntimeLibrary.CATCH_TEMPORARY;
        this.startImmediateClosure();
        this.builder.append("try {")
                .increase();
        this.returnStatement(expression.body);
        this.builder.decrease()
                .append("\n} catch (")
                .append(valueRef)
                .append(": any) {")
                .increase();
        List<MatchArm> arms = Linq.map(expression.handlers, h -> new MatchArm(h.pattern, null, h.handler));
        // Exceptions not handled are raised again unchanged
        this.matchArms(arms, valueRef, "throw " + valueRef + ";");
        this.builder.decrease()
                .append("\n}");
        this.endImmediateClosure();
        this.pop(expression);
        return VisitDecision.STOP;
    }
}
