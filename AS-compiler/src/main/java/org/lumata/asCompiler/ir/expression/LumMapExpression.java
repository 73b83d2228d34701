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
import org.lumata.util.IIndentStream;
import org.lumata.util.Utilities;

/** Applies the transform to every element of a collection;
 * the iterator names the current element. */
public final class LumMapExpression extends LumExpression {
    public final LumExpression collection;
    public final String iterator;
    public final LumExpression transform;

    public LumMapExpression(LumExpression collection, String iterator, LumExpression transform) {
        this.collection = collection;
        this.iterator = iterator;
        this.transform = transform;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.collection.accept(visitor);
        this.transform.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("map ")
                .append(this.iterator)
                .append(" in ")
                .append(this.collection)
                .append(" -> ")
                .append(this.transform);
    }

    @SuppressWarnings("unused")
    public static LumMapExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LumExpression collection = fromJsonInner(node, "collection", decoder, LumExpression.class);
        String iterator = Utilities.getStringProperty(node, "iterator");
        LumExpression transform = fromJsonInner(node, "transform", decoder, LumExpression.class);
        return new LumMapExpression(collection, iterator, transform);
    }
}
