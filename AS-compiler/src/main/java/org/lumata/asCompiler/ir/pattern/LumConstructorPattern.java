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
import org.lumata.util.Utilities;

import java.util.List;

/** Matches values built with a specific data constructor,
 * whose arguments in turn match the argument patterns. */
public final class LumConstructorPattern extends LumPattern {
    public final String constructor;
    public final List<LumPattern> arguments;

    public LumConstructorPattern(String constructor, List<LumPattern> arguments) {
        this.constructor = constructor;
        this.arguments = List.copyOf(arguments);
    }

    public LumConstructorPattern(String constructor, LumPattern... arguments) {
        this(constructor, List.of(arguments));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (LumPattern argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.constructor);
        if (!this.arguments.isEmpty())
            builder.append("(")
                    .joinI(", ", this.arguments)
                    .append(")");
        return builder;
    }

    @SuppressWarnings("unused")
    public static LumConstructorPattern fromJson(JsonNode node, JsonDecoder decoder) {
        String constructor = Utilities.getStringProperty(node, "constructor");
        List<LumPattern> arguments = fromJsonInnerList(node, "arguments", decoder, LumPattern.class);
        return new LumConstructorPattern(constructor, arguments);
    }
}
