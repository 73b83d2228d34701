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
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.asCompiler.ir.LumNode;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.util.IIndentStream;

import java.util.List;

/**
 * Evaluates the body; if it raises, the raised value is matched against
 * the handlers in order.  A value not matched by any handler is raised again.
 */
public final class LumTryExpression extends LumExpression {
    public static final class CatchArm extends LumNode {
        public final LumPattern pattern;
        public final LumExpression handler;

        public CatchArm(LumPattern pattern, LumExpression handler) {
            this.pattern = pattern;
            this.handler = handler;
        }

        @Override
        public void accept(InnerVisitor visitor) {
            if (visitor.preorder(this).stop()) return;
            visitor.push(this);
            this.pattern.accept(visitor);
            this.handler.accept(visitor);
            visitor.pop(this);
            visitor.postorder(this);
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.pattern)
                    .append(" -> ")
                    .append(this.handler);
        }

        public static CatchArm fromJson(JsonNode node, JsonDecoder decoder) {
            LumPattern pattern = fromJsonInner(node, "pattern", decoder, LumPattern.class);
            LumExpression handler = fromJsonInner(node, "handler", decoder, LumExpression.class);
            return new CatchArm(pattern, handler);
        }
    }

    public final LumExpression body;
    public final List<CatchArm> handlers;

    public LumTryExpression(LumExpression body, List<CatchArm> handlers) {
        this.body = body;
        this.handlers = List.copyOf(handlers);
        if (handlers.isEmpty())
            throw new InternalCompilerError("Empty list of handlers for try", this);
    }

    public LumTryExpression(LumExpression body, CatchArm... handlers) {
        this(body, List.of(handlers));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        if (visitor.preorder(this).stop()) return;
        visitor.push(this);
        this.body.accept(visitor);
        for (CatchArm arm: this.handlers)
            arm.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("try ")
                .append(this.body)
                .append(" catch")
                .increase()
                .joinI(System.lineSeparator(), this.handlers)
                .decrease();
    }

    @SuppressWarnings("unused")
    public static LumTryExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LumExpression body = fromJsonInner(node, "body", decoder, LumExpression.class);
        List<CatchArm> handlers = fromJsonHelperList(node, "handlers", a -> CatchArm.fromJson(a, decoder));
        return new LumTryExpression(body, handlers);
    }
}
