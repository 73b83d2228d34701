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

package org.lumata.asCompiler.compiler.visitors.inner;

import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.ir.pattern.LumAsPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.pattern.LumPattern;

import java.util.ArrayList;
import java.util.List;

/** Collects the names of the variables bound by a pattern, in binding order. */
public class PatternVariables extends InnerVisitor {
    public final List<String> variables;

    public PatternVariables(LumCompiler compiler) {
        super(compiler);
        this.variables = new ArrayList<>();
    }

    @Override
    public VisitDecision preorder(LumIdentifierPattern pattern) {
        this.variables.add(pattern.identifier);
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(LumAsPattern pattern) {
        this.variables.add(pattern.identifier);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void startVisit(ILumNode node) {
        super.startVisit(node);
        this.variables.clear();
    }

    public static List<String> of(LumCompiler compiler, LumPattern pattern) {
        PatternVariables visitor = new PatternVariables(compiler);
        visitor.apply(pattern);
        return visitor.variables;
    }
}
