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

import org.lumata.asCompiler.compiler.ICompilerComponent;
import org.lumata.asCompiler.compiler.LumCompiler;
import org.lumata.asCompiler.compiler.errors.InternalCompilerError;
import org.lumata.asCompiler.compiler.visitors.VisitDecision;
import org.lumata.asCompiler.ir.ILumNode;
import org.lumata.asCompiler.ir.LumParameter;
import org.lumata.asCompiler.ir.expression.LumApplyExpression;
import org.lumata.asCompiler.ir.expression.LumBinaryExpression;
import org.lumata.asCompiler.ir.expression.LumCaseExpression;
import org.lumata.asCompiler.ir.expression.LumClosureExpression;
import org.lumata.asCompiler.ir.expression.LumConstructorExpression;
import org.lumata.asCompiler.ir.expression.LumDoExpression;
import org.lumata.asCompiler.ir.expression.LumExpression;
import org.lumata.asCompiler.ir.expression.LumFieldExpression;
import org.lumata.asCompiler.ir.expression.LumFieldValue;
import org.lumata.asCompiler.ir.expression.LumFilterExpression;
import org.lumata.asCompiler.ir.expression.LumFoldExpression;
import org.lumata.asCompiler.ir.expression.LumIfExpression;
import org.lumata.asCompiler.ir.expression.LumIndexExpression;
import org.lumata.asCompiler.ir.expression.LumLetExpression;
import org.lumata.asCompiler.ir.expression.LumMapExpression;
import org.lumata.asCompiler.ir.expression.LumQualifiedIdentifier;
import org.lumata.asCompiler.ir.expression.LumRecordCreationExpression;
import org.lumata.asCompiler.ir.expression.LumRecordUpdateExpression;
import org.lumata.asCompiler.ir.expression.LumTryExpression;
import org.lumata.asCompiler.ir.expression.LumTypeAnnotationExpression;
import org.lumata.asCompiler.ir.expression.LumUnaryExpression;
import org.lumata.asCompiler.ir.expression.LumVariablePath;
import org.lumata.asCompiler.ir.expression.literal.LumBoolLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumIntLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumListLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumRecordLiteral;
import org.lumata.asCompiler.ir.expression.literal.LumStringLiteral;
import org.lumata.asCompiler.ir.pattern.LumAsPattern;
import org.lumata.asCompiler.ir.pattern.LumConstructorPattern;
import org.lumata.asCompiler.ir.pattern.LumIdentifierPattern;
import org.lumata.asCompiler.ir.pattern.LumListPattern;
import org.lumata.asCompiler.ir.pattern.LumLiteralPattern;
import org.lumata.asCompiler.ir.pattern.LumOrPattern;
import org.lumata.asCompiler.ir.pattern.LumPattern;
import org.lumata.asCompiler.ir.pattern.LumRecordPattern;
import org.lumata.asCompiler.ir.pattern.LumWildcardPattern;
import org.lumata.asCompiler.ir.statement.LumExpressionStatement;
import org.lumata.asCompiler.ir.statement.LumLetStatement;
import org.lumata.asCompiler.ir.statement.LumStatement;
import org.lumata.util.IHasId;
import org.lumata.util.IWritesLogs;
import org.lumata.util.Logger;
import org.lumata.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Depth-first traversal of a Lumata tree.
 * A visitor instance keeps the traversal context, so it must
 * not be shared between threads; distinct instances are independent. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class InnerVisitor implements IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static final AtomicLong crtId = new AtomicLong();
    public final LumCompiler compiler;
    protected final List<ILumNode> context;

    public InnerVisitor(LumCompiler compiler) {
        this.id = crtId.getAndIncrement();
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public LumCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(ILumNode node) {
        this.context.add(node);
    }

    public void pop(ILumNode node) {
        ILumNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public ILumNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(ILumNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should not visit the children of the current node.
    // base classes
    public VisitDecision preorder(ILumNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(LumExpression node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumPattern node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumStatement node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumLiteral node) {
        return this.preorder((LumExpression) node);
    }

    // helpers

    public VisitDecision preorder(LumParameter node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumFieldValue node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumLetExpression.Binding node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumCaseExpression.Arm node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumTryExpression.CatchArm node) {
        return this.preorder((ILumNode) node);
    }

    public VisitDecision preorder(LumRecordPattern.Field node) {
        return this.preorder((ILumNode) node);
    }

    // concrete classes

    public VisitDecision preorder(LumBinaryExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumUnaryExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumVariablePath node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumQualifiedIdentifier node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumApplyExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumConstructorExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumRecordCreationExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumRecordUpdateExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumFieldExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumIndexExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumIfExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumLetExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumClosureExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumCaseExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumTryExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumDoExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumMapExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumFilterExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumFoldExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumTypeAnnotationExpression node) {
        return this.preorder((LumExpression) node);
    }

    public VisitDecision preorder(LumIntLiteral node) {
        return this.preorder((LumLiteral) node);
    }

    public VisitDecision preorder(LumStringLiteral node) {
        return this.preorder((LumLiteral) node);
    }

    public VisitDecision preorder(LumBoolLiteral node) {
        return this.preorder((LumLiteral) node);
    }

    public VisitDecision preorder(LumListLiteral node) {
        return this.preorder((LumLiteral) node);
    }

    public VisitDecision preorder(LumRecordLiteral node) {
        return this.preorder((LumLiteral) node);
    }

    public VisitDecision preorder(LumWildcardPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumIdentifierPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumLiteralPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumConstructorPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumRecordPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumListPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumAsPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumOrPattern node) {
        return this.preorder((LumPattern) node);
    }

    public VisitDecision preorder(LumLetStatement node) {
        return this.preorder((LumStatement) node);
    }

    public VisitDecision preorder(LumExpressionStatement node) {
        return this.preorder((LumStatement) node);
    }
    /************************* POSTORDER *****************************/

    @SuppressWarnings("EmptyMethod")
    public void postorder(ILumNode ignored) {}

    public void postorder(LumExpression node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumPattern node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumStatement node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumLiteral node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumParameter node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumFieldValue node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumLetExpression.Binding node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumCaseExpression.Arm node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumTryExpression.CatchArm node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumRecordPattern.Field node) {
        this.postorder((ILumNode) node);
    }

    public void postorder(LumBinaryExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumUnaryExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumVariablePath node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumQualifiedIdentifier node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumApplyExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumConstructorExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumRecordCreationExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumRecordUpdateExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumFieldExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumIndexExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumIfExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumLetExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumClosureExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumCaseExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumTryExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumDoExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumMapExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumFilterExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumFoldExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumTypeAnnotationExpression node) {
        this.postorder((LumExpression) node);
    }

    public void postorder(LumIntLiteral node) {
        this.postorder((LumLiteral) node);
    }

    public void postorder(LumStringLiteral node) {
        this.postorder((LumLiteral) node);
    }

    public void postorder(LumBoolLiteral node) {
        this.postorder((LumLiteral) node);
    }

    public void postorder(LumListLiteral node) {
        this.postorder((LumLiteral) node);
    }

    public void postorder(LumRecordLiteral node) {
        this.postorder((LumLiteral) node);
    }

    public void postorder(LumWildcardPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumIdentifierPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumLiteralPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumConstructorPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumRecordPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumListPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumAsPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumOrPattern node) {
        this.postorder((LumPattern) node);
    }

    public void postorder(LumLetStatement node) {
        this.postorder((LumStatement) node);
    }

    public void postorder(LumExpressionStatement node) {
        this.postorder((LumStatement) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    /** Visit the tree rooted at the specified node. */
    public ILumNode apply(ILumNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
