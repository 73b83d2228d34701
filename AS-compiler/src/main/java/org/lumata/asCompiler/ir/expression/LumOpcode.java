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
import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.util.Utilities;

/** Operators of the Lumata language.
 * Each operator has the tag used by the tree producers and
 * a text used only when displaying trees. */
public enum LumOpcode {
    // Binary operators
    ADD("Add", "+", true),
    SUBTRACT("Subtract", "-", true),
    MULTIPLY("Multiply", "*", true),
    DIVIDE("Divide", "/", true),
    MODULO("Modulo", "%", true),
    POWER("Power", "^", true),
    EQUAL("Equal", "==", true),
    NOT_EQUAL("NotEqual", "!=", true),
    LESS_THAN("LessThan", "<", true),
    LESS_THAN_OR_EQUAL("LessThanOrEqual", "<=", true),
    GREATER_THAN("GreaterThan", ">", true),
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqual", ">=", true),
    AND("And", "&&", true),
    OR("Or", "||", true),
    // Prepend an element to a list
    CONS("Cons", "::", true),
    APPEND("Append", "++", true),
    // (f . g)(x) = f(g(x))
    COMPOSE("Compose", ".", true),
    // (f |> g)(x) = g(f(x))
    PIPE("Pipe", "|>", true),

    // Unary operators
    NEGATE("Negate", "-", false),
    NOT("Not", "!", false),
    LENGTH("Length", "length", false),
    HEAD("Head", "head", false),
    TAIL("Tail", "tail", false),
    REVERSE("Reverse", "reverse", false),
    ;

    public final String tag;
    private final String text;
    public final boolean isBinary;

    LumOpcode(String tag, String text, boolean isBinary) {
        this.tag = tag;
        this.text = text;
        this.isBinary = isBinary;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public static LumOpcode fromTag(String tag) {
        for (LumOpcode opcode: LumOpcode.values()) {
            if (opcode.tag.equals(tag))
                return opcode;
        }
        throw new UnsupportedException("Unknown operator: " + Utilities.singleQuote(tag));
    }

    public static LumOpcode fromJson(JsonNode node) {
        String tag = Utilities.getStringProperty(node, "opcode");
        return LumOpcode.fromTag(tag);
    }
}
