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

package org.lumata.asCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.lumata.asCompiler.compiler.errors.BaseCompilerException;
import org.lumata.asCompiler.compiler.errors.CompilationError;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

/** Deserialize a Lumata tree from its JSON representation.
 * Every object carries a "class" property with the simple name of the node class;
 * the class must provide a static method fromJson(JsonNode, JsonDecoder). */
public class JsonDecoder {
    static final String INNER_ROOT = "org.lumata.asCompiler.ir";
    static final List<String> INNER_PACKAGES = Arrays.asList(
            "", "expression", "expression.literal", "pattern", "statement");

    public JsonDecoder() {}

    static Class<?> getClass(String simpleName) {
        for (String cls : INNER_PACKAGES) {
            String className = INNER_ROOT;
            if (!cls.isEmpty())
                className += "." + cls;
            className += "." + simpleName;
            try {
                return Class.forName(className);
            } catch (ClassNotFoundException ignored) {
            }
        }
        throw new UnsupportedException("Class " + Utilities.singleQuote(simpleName) + " not found");
    }

    ILumNode decode(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object, got " + Utilities.toDepth(node, 1));
        JsonNode cls = node.get("class");
        if (cls == null || !cls.isTextual())
            throw new CompilationError("Node does not have 'class' field: " + Utilities.toDepth(node, 1));
        Class<?> clazz = getClass(cls.asText());
        if (!ILumNode.class.isAssignableFrom(clazz))
            throw new UnsupportedException("Class " + Utilities.singleQuote(cls.asText()) + " is not a tree node");
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (!isStatic)
                throw new InternalCompilerError(cls.asText() + ".fromJson is not static");
            return (ILumNode) method.invoke(null, node, this);
        } catch (NoSuchMethodException e) {
            throw new UnsupportedException("Class " + Utilities.singleQuote(cls.asText())
                    + " cannot be decoded", e);
        } catch (IllegalAccessException e) {
            throw new InternalCompilerError(e.getMessage());
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseCompilerException)
                throw (BaseCompilerException) cause;
            throw new CompilationError("Error decoding " + cls.asText(), cause);
        }
    }

    /** Decode a node and check that it has the expected class. */
    public <T extends ILumNode> T decode(JsonNode node, Class<T> clazz) {
        ILumNode result = this.decode(node);
        if (!clazz.isInstance(result))
            throw new CompilationError("Expected a " + clazz.getSimpleName() + ", got "
                    + result.getClass().getSimpleName() + ": " + Utilities.toDepth(node, 1));
        return clazz.cast(result);
    }

    /** Parse a JSON document and decode the tree it describes. */
    public <T extends ILumNode> T decode(String json, Class<T> clazz) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode())
                throw new CompilationError("Empty JSON document");
            return this.decode(node, clazz);
        } catch (JsonProcessingException e) {
            throw new CompilationError("Malformed JSON input: " + e.getOriginalMessage(), e);
        }
    }
}
