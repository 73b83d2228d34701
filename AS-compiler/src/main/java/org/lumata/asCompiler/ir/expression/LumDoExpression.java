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
import org.lumata.asCompiler.ir.statement.LumStatement;
import org.lumata.util.IIndentStream;

import java.util.List;

/** A block of statements executed in order, followed by the expression
 * that produces the value of the block. */
public final class LumDoExpression extends LumExpression {
    public final List<LumStatement> statements;
    public final LumExpression result;

    public LumDoExpression(List<LumStatement> statements, LumExpression result) {
        this.statements = List.copyOf(statements);
        this.result = result;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (LumStatement statement: this.statements)
            statement.accept(visitor);
        this.result.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("do")
                .increase();
        for (LumStatement statement: this.statements)
            builder.append(statement).newline();
        return builder.append("return ")
                .append(this.result)
                .decrease();
    }

    @SuppressWarnings("unused")
    public static LumDoExpression fromJson(JsonNode node, JsonDecoder decoder) {
        List<LumStatement> statements = fromJsonInnerList(node, "statements", decoder, LumStatement.class);
        LumExpression result = fromJsonInner(node, "result", decoder, LumExpression.class);
        return new LumDoExpression(statements, result);
    }
}
