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

package org.lumata.asCompiler.ir.pattern;

import com.fasterxml.jackson.databind.JsonNode;
import org.lumata.asCompiler.compiler.backend.JsonDecoder;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Matches lists.  Without a tail the list must have exactly as many
 * elements as there are element patterns.  With a tail the list may be
 * longer, and the remaining suffix is matched against the tail pattern.
 */
public final class LumListPattern extends LumPattern {
    public final List<LumPattern> elements;
    @Nullable
    public final LumPattern tail;

    public LumListPattern(List<LumPattern> elements, @Nullable LumPattern tail) {
        this.elements = List.copyOf(elements);
        this.tail = tail;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (LumPattern element: this.elements)
            element.accept(visitor);
        if (this.tail != null)
            this.tail.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("[")
                .joinI(", ", this.elements);
        if (this.tail != null) {
            if (!this.elements.isEmpty())
                builder.append(", ");
            builder.append("...").append(this.tail);
        }
        return builder.append("]");
    }

    @SuppressWarnings("unused")
    public static LumListPattern fromJson(JsonNode node, JsonDecoder decoder) {
        List<LumPattern> elements = fromJsonInnerList(node, "elements", decoder, LumPattern.class);
        LumPattern tail = fromJsonOptional(node, "tail", decoder, LumPattern.class);
        return new LumListPattern(elements, tail);
    }
}
