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

package org.lumata.asCompiler.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.lumata.asCompiler.compiler.backend.JsonDecoder;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.util.IndentStream;
import org.lumata.util.IndentStreamBuilder;
import org.lumata.util.Linq;
import org.lumata.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/** Base class for all Lumata tree nodes.
 * Nodes are immutable once constructed. */
public abstract class LumNode implements ILumNode {
    static final AtomicLong crtId = new AtomicLong();
    public final long id;

    protected LumNode() {
        this.id = crtId.getAndIncrement();
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public String toString() {
        IndentStream stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }

    public static <T extends ILumNode> T fromJsonInner(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return decoder.decode(prop, clazz);
    }

    /** Decode a property which may be missing or null. */
    @Nullable
    public static <T extends ILumNode> T fromJsonOptional(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getOptionalProperty(node, property);
        if (prop == null)
            return null;
        return decoder.decode(prop, clazz);
    }

    public static <T extends ILumNode> List<T> fromJsonInnerList(
            JsonNode node, JsonDecoder decoder, Class<T> clazz) {
        if (!node.isArray())
            throw new CompilationError("Node is not an array " + Utilities.toDepth(node, 1));
        return Linq.list(Linq.map(
                node.elements(), e -> decoder.decode(e, clazz)));
    }

    public static <T extends ILumNode> List<T> fromJsonInnerList(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return fromJsonInnerList(prop, decoder, clazz);
    }

    /** Decode an array of helper objects which carry no "class" property.
     * @param node     Node holding the array.
     * @param property Name of the property holding the array.
     * @param decoder  Function decoding one element. */
    public static <T> List<T> fromJsonHelperList(
            JsonNode node, String property, Function<JsonNode, T> decoder) {
        JsonNode prop = Utilities.getProperty(node, property);
        if (!prop.isArray())
            throw new CompilationError("Property " + Utilities.singleQuote(property) + " is not an array");
        return Linq.list(Linq.map(prop.elements(), decoder));
    }
}
