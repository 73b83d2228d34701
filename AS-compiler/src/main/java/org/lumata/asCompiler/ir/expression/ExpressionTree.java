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

import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.LumNode;
import org.lumata.util.IIndentStream;
import org.lumata.util.IndentStream;
import org.lumata.util.IndentStreamBuilder;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Use reflection to print a tree with one node per line */
public class ExpressionTree {
    private ExpressionTree() {}

    static List<Field> getAllFields(Class<?> clazz) {
        List<Field> fields = new ArrayList<>();
        while (clazz != null) {
            Collections.addAll(fields, clazz.getDeclaredFields());
            clazz = clazz.getSuperclass();
        }
        return fields;
    }

    static boolean acceptableType(Field field) {
        Class<?> clazz = field.getType();
        if (field.getDeclaringClass() == LumNode.class)
            return false;
        return long.class.isAssignableFrom(clazz) ||
                String.class.isAssignableFrom(clazz) ||
                boolean.class.isAssignableFrom(clazz) ||
                LumOpcode.class.isAssignableFrom(clazz);
    }

    private static void asTree(@Nullable ILumNode node, IIndentStream stream) throws IllegalAccessException {
        if (node == null) {
            return;
        }
        Class<?> clazz = node.getClass();
        stream.append(node.getId())
                .append(" ")
                .append(clazz.getSimpleName());
        for (Field field : getAllFields(clazz)) {
            if (!Modifier.isStatic(field.getModifiers()) && acceptableType(field)) {
                field.setAccessible(true);
                Object value = field.get(node);
                if (value == null)
                    continue;
                stream.append(" ")
                        .append(field.getName())
                        .append("=")
                        .append(value.toString());
            }
        }

        stream.increase();
        for (Field field : getAllFields(clazz)) {
            if (Modifier.isStatic(field.getModifiers()))
                continue;
            if (ILumNode.class.isAssignableFrom(field.getType())) {
                field.setAccessible(true);
                asTree((ILumNode) field.get(node), stream);
            } else if (List.class.isAssignableFrom(field.getType())) {
                field.setAccessible(true);
                List<?> values = (List<?>)field.get(node);
                if (values != null) {
                    for (Object obj : values) {
                        if (obj instanceof ILumNode)
                            asTree((ILumNode) obj, stream);
                    }
                }
            }
        }
        stream.decrease();
    }

    @CheckReturnValue
    public static String asTree(ILumNode node) {
        try {
            IndentStream stream = new IndentStreamBuilder();
            asTree(node, stream);
            return stream.toString();
        } catch (IllegalAccessException e) {
            throw new InternalCompilerError("Cannot display tree: " + e.getMessage(), node);
        }
    }
}
