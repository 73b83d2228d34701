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

package org.lumata.asCompiler.compiler.backend.as;

import org.lumata.asCompiler.compiler.errors.UnsupportedException;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.expression.LumOpcode;
import org.lumata.util.Utilities;

import java.util.EnumMap;
import java.util.Map;

/** This class encodes the interface to the AssemblyScript target:
 * the spelling of every Lumata operator and the names of the
 * temporaries introduced by the generated code. */
public class AsRuntimeLibrary {
    /** Template for a binary operator: prefix, first operand, middle, second operand, suffix.
     * When swapped is true the right operand is emitted first.
     * When calls is true both operands are emitted in the position of a called function. */
    public record BinaryTemplate(String prefix, String middle, String suffix, boolean swapped, boolean calls) {
        BinaryTemplate(String prefix, String middle, String suffix) {
            this(prefix, middle, suffix, false, false);
        }
    }

    /** Template for a unary operator: prefix, operand, suffix. */
    public record UnaryTemplate(String prefix, String suffix) {}

    private final Map<LumOpcode, BinaryTemplate> binaryOperators = new EnumMap<>(LumOpcode.class);
    private final Map<LumOpcode, UnaryTemplate> unaryOperators = new EnumMap<>(LumOpcode.class);

    /** Parameter of the closure produced for a case expression. */
    public static final String CASE_TEMPORARY = "valueToMatch";
    /** Variable holding the exception in the closure produced for a try expression. */
    public static final String CATCH_TEMPORARY = "caught";
    /** Parameter of the closure produced for a function composition. */
    public static final String COMPOSE_ARGUMENT = "composeArg";
    /** Payload of a constructor with a single argument. */
    public static final String SINGLE_PAYLOAD = "value";
    /** Prefix of the payload fields of a constructor with several arguments. */
    public static final String PAYLOAD_PREFIX = "arg";

    public static final AsRuntimeLibrary INSTANCE = new AsRuntimeLibrary();

    protected AsRuntimeLibrary() {
        this.binaryOperators.put(LumOpcode.ADD, new BinaryTemplate("(", " + ", ")"));
        this.binaryOperators.put(LumOpcode.SUBTRACT, new BinaryTemplate("(", " - ", ")"));
        this.binaryOperators.put(LumOpcode.MULTIPLY, new BinaryTemplate("(", " * ", ")"));
        this.binaryOperators.put(LumOpcode.DIVIDE, new BinaryTemplate("(", " / ", ")"));
        this.binaryOperators.put(LumOpcode.MODULO, new BinaryTemplate("(", " % ", ")"));
        this.binaryOperators.put(LumOpcode.POWER, new BinaryTemplate("Math.pow(", ", ", ")"));
        this.binaryOperators.put(LumOpcode.EQUAL, new BinaryTemplate("(", " === ", ")"));
        this.binaryOperators.put(LumOpcode.NOT_EQUAL, new BinaryTemplate("(", " !== ", ")"));
        this.binaryOperators.put(LumOpcode.LESS_THAN, new BinaryTemplate("(", " < ", ")"));
        this.binaryOperators.put(LumOpcode.LESS_THAN_OR_EQUAL, new BinaryTemplate("(", " <= ", ")"));
        this.binaryOperators.put(LumOpcode.GREATER_THAN, new BinaryTemplate("(", " > ", ")"));
        this.binaryOperators.put(LumOpcode.GREATER_THAN_OR_EQUAL, new BinaryTemplate("(", " >= ", ")"));
        this.binaryOperators.put(LumOpcode.AND, new BinaryTemplate("(", " && ", ")"));
        this.binaryOperators.put(LumOpcode.OR, new BinaryTemplate("(", " || ", ")"));
        this.binaryOperators.put(LumOpcode.CONS, new BinaryTemplate("[", "].concat(", ")"));
        this.binaryOperators.put(LumOpcode.APPEND, new BinaryTemplate("(", ").concat(", ")"));
        String composeHead = "((" + COMPOSE_ARGUMENT + ": any) => ";
        String composeTail = "(" + COMPOSE_ARGUMENT + ")))";
        // l(r(x))
        this.binaryOperators.put(LumOpcode.COMPOSE, new BinaryTemplate(composeHead, "(", composeTail, false, true));
        // r(l(x))
        this.binaryOperators.put(LumOpcode.PIPE, new BinaryTemplate(composeHead, "(", composeTail, true, true));

        this.unaryOperators.put(LumOpcode.NEGATE, new UnaryTemplate("(-", ")"));
        this.unaryOperators.put(LumOpcode.NOT, new UnaryTemplate("(!", ")"));
        this.unaryOperators.put(LumOpcode.LENGTH, new UnaryTemplate("(", ".length)"));
        this.unaryOperators.put(LumOpcode.HEAD, new UnaryTemplate("(", "[0])"));
        this.unaryOperators.put(LumOpcode.TAIL, new UnaryTemplate("(", ".slice(1))"));
        this.unaryOperators.put(LumOpcode.REVERSE, new UnaryTemplate("(Array.from(", ").reverse())"));
    }

    public BinaryTemplate getBinaryTemplate(LumOpcode opcode, ILumNode node) {
        BinaryTemplate result = this.binaryOperators.get(opcode);
        if (result == null)
            throw new UnsupportedException("Unknown binary operator " + Utilities.singleQuote(opcode.tag), node);
        return result;
    }

    public UnaryTemplate getUnaryTemplate(LumOpcode opcode, ILumNode node) {
        UnaryTemplate result = this.unaryOperators.get(opcode);
        if (result == null)
            throw new UnsupportedException("Unknown unary operator " + Utilities.singleQuote(opcode.tag), node);
        return result;
    }

    /** Reference to the payload of a constructor value.
     * @param valueRef  Reference to the constructor value.
     * @param index     Index of the argument.
     * @param arguments Number of arguments of the constructor. */
    public static String constructorPayload(String valueRef, int index, int arguments) {
        if (arguments == 1)
            return valueRef + "." + SINGLE_PAYLOAD;
        return valueRef + "." + PAYLOAD_PREFIX + index;
    }

    /** Expression raised when no arm of a case matches. */
    public static String noMatchError(String valueRef) {
        return "new Error(\"No match found for value: \" + String(" + valueRef + "))";
    }
}
