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

package org.lumata.asCompiler.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.lumata.asCompiler.compiler.backend.JsonDecoder;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.asCompiler.ir.LumNode;
import org.lumata.util.IIndentStream;
import org.lumata.util.Utilities;

import java.util.List;

/** A sequence of bindings visible in a body expression.
 * Each binding can refer to the previous ones. */
public final class LumLetExpression extends LumExpression {
    public static final class Binding extends LumNode {
        public final String variable;
        public final LumExpression initializer;

        public Binding(String variable, LumExpression initializer) {
            this.variable = variable;
            this.initializer = initializer;
        }

        @Override
        public void accept(InnerVisitor visitor) {
            if (visitor.preorder(this).stop()) return;
            visitor.push(this);
            this.initializer.accept(visitor);
            visitor.pop(this);
            visitor.postorder(this);
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.variable)
                    .append(" = ")
                    .append(this.initializer);
        }

        public static Binding fromJson(JsonNode node, JsonDecoder decoder) {
            String variable = Utilities.getStringProperty(node, "variable");
            LumExpression initializer = fromJsonInner(node, "initializer", decoder, LumExpression.class);
            return new Binding(variable, initializer);
        }
    }

    public final List<Binding> bindings;
    public final LumExpression body;

    public LumLetExpression(List<Binding> bindings, LumExpression body) {
        this.bindings = List.copyOf(bindings);
        this.body = body;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Binding binding: this.bindings)
            binding.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("let")
                .increase()
                .joinI(System.lineSeparator(), this.bindings)
                .decrease()
                .newline()
                .append("in ")
                .append(this.body);
    }

    @SuppressWarnings("unused")
    public static LumLetExpression fromJson(JsonNode node, JsonDecoder decoder) {
        List<Binding> bindings = fromJsonHelperList(
                node, "bindings", b -> Binding.fromJson(b, decoder));
        LumExpression body = fromJsonInner(node, "body", decoder, LumExpression.class);
        return new LumLetExpression(bindings, body);
    }
}
