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

import javax.annotation.Nullable;
import java.util.List;

/**
 * A case expression: the scrutinee is matched against each arm in order,
 * and the result of the first arm whose pattern and guard both succeed
 * is the value of the expression.
 */
public final class LumCaseExpression extends LumExpression {
    public static final class Arm extends LumNode {
        public final LumPattern pattern;
        @Nullable
        public final LumExpression guard;
        public final LumExpression result;

        public Arm(LumPattern pattern, @Nullable LumExpression guard, LumExpression result) {
            this.pattern = pattern;
            this.guard = guard;
            this.result = result;
        }

        public Arm(LumPattern pattern, LumExpression result) {
            this(pattern, null, result);
        }

        @Override
        public void accept(InnerVisitor visitor) {
            if (visitor.preorder(this).stop()) return;
            visitor.push(this);
            this.pattern.accept(visitor);
            if (this.guard != null)
                this.guard.accept(visitor);
            this.result.accept(visitor);
            visitor.pop(this);
            visitor.postorder(this);
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            builder.append(this.pattern);
            if (this.guard != null)
                builder.append(" when ").append(this.guard);
            return builder.append(" -> ")
                    .append(this.result);
        }

        public static Arm fromJson(JsonNode node, JsonDecoder decoder) {
            LumPattern pattern = fromJsonInner(node, "pattern", decoder, LumPattern.class);
            LumExpression guard = fromJsonOptional(node, "guard", decoder, LumExpression.class);
            LumExpression result = fromJsonInner(node, "result", decoder, LumExpression.class);
            return new Arm(pattern, guard, result);
        }
    }

    public final LumExpression scrutinee;
    public final List<Arm> arms;

    public LumCaseExpression(LumExpression scrutinee, List<Arm> arms) {
        this.scrutinee = scrutinee;
        this.arms = List.copyOf(arms);
        if (arms.isEmpty())
            throw new InternalCompilerError("Empty list of arms for case", this);
    }

    public LumCaseExpression(LumExpression scrutinee, Arm... arms) {
        this(scrutinee, List.of(arms));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        if (visitor.preorder(this).stop()) return;
        visitor.push(this);
        this.scrutinee.accept(visitor);
        for (Arm arm: this.arms)
            arm.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("case ")
                .append(this.scrutinee)
                .append(" of")
                .increase()
                .joinI(System.lineSeparator(), this.arms)
                .decrease();
    }

    @SuppressWarnings("unused")
    public static LumCaseExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LumExpression scrutinee = fromJsonInner(node, "scrutinee", decoder, LumExpression.class);
        List<Arm> arms = fromJsonHelperList(node, "arms", a -> Arm.fromJson(a, decoder));
        return new LumCaseExpression(scrutinee, arms);
    }
}
