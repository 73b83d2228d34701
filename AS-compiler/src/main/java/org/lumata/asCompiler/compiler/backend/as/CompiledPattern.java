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

import java.util.List;

/** Result of compiling a pattern against a value reference.
 *
 * @param condition Boolean expression which is true when the value matches.
 * @param bindings  Declarations to emit when the condition holds, in order. */
public record CompiledPattern(String condition, List<Binding> bindings) {
    public static final String TRUE = "true";

    /** A variable bound by a pattern. */
    public record Binding(String name, String value) {
        @Override
        public String toString() {
            return "const " + this.name + " = " + this.value + ";";
        }
    }

    public CompiledPattern {
        bindings = List.copyOf(bindings);
    }

    public CompiledPattern(String condition) {
        this(condition, List.of());
    }

    /** True if the pattern matches every value. */
    public boolean isIrrefutable() {
        return this.condition.equals(TRUE);
    }

    public boolean hasBindings() {
        return !this.bindings.isEmpty();
    }
}
