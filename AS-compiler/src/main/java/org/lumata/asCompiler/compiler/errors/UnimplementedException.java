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

package org.lumata.asCompiler.compiler.errors;

import org.lumata.asCompiler.ir.ILumNode;

import javax.annotation.Nullable;

/** Exception thrown when the compiler encounters a code
 * construct that is not yet fully implemented.  This is a legal construct,
 * and the compiler should eventually support it. */
public class UnimplementedException extends BaseCompilerException {
    @Nullable
    public final ILumNode lumNode;

    public static final String KIND = "Not yet implemented";

    public UnimplementedException() {
        super(KIND);
        this.lumNode = null;
    }

    public UnimplementedException(String message) {
        super(message);
        this.lumNode = null;
    }

    public UnimplementedException(String message, ILumNode node) {
        super(message + " " + node.getClass().getSimpleName() + ": " + node);
        this.lumNode = node;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
