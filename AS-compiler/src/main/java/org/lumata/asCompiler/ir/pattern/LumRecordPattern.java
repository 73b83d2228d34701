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
import org.lumata.asCompiler.compiler.visitors.inner.InnerVisitor;
import org.lumata.asCompiler.ir.LumNode;
import org.lumata.util.IIndentStream;
import org.lumata.util.Utilities;

import java.util.List;

/** Matches non-null records whose named fields match the field patterns.
 * Fields not mentioned are not examined. */
public final class LumRecordPattern extends LumPattern {
    public static final class Field extends LumNode {
        public final String name;
        public final LumPattern pattern;

        public Field(String name, LumPattern pattern) {
            this.name = name;
            this.pattern = pattern;
        }

        @Override
        public void accept(InnerVisitor visitor) {
            if (visitor.preorder(this).stop()) return;
            visitor.push(this);
            this.pattern.accept(visitor);
            visitor.pop(this);
            visitor.postorder(this);
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.name)
                    .append(" = ")
                    .append(this.pattern);
        }

        public static Field fromJson(JsonNode node, JsonDecoder decoder) {
            String name = Utilities.getStringProperty(node, "name");
            LumPattern pattern = fromJsonInner(node, "pattern", decoder, LumPattern.class);
            return new Field(name, pattern);
        }
    }

    public final List<Field> fields;

    public LumRecordPattern(List<Field> fields) {
        this.fields = List.copyOf(fields);
    }

    public LumRecordPattern(Field... fields) {
        this(List.of(fields));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        if (visitor.preorder(this).stop()) return;
        visitor.push(this);
        for (Field field: this.fields)
            field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("{ ")
                .joinI(", ", this.fields)
                .append(" }");
    }

    @SuppressWarnings("unused")
    public static LumRecordPattern fromJson(JsonNode node, JsonDecoder decoder) {
        List<Field> fields = fromJsonHelperList(node, "fields", f -> Field.fromJson(f, decoder));
        return new LumRecordPattern(fields);
    }
}
