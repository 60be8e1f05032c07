package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * A postfix operation wrapping its operand. Chains nest outwards, so {@code a[0](x)++} is an
 * increment of a call of an index of {@code a}.
 *
 * @param operand The expression the operation applies to.
 * @param operation The operation.
 * @param position The position of the operand.
 */
public record PostfixNode(
        ExpressionNode operand,
        PostfixOperation operation,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPostfix(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(operand);
        if (operation instanceof PostfixOperation.Index index) {
            children.add(index.index());
        } else if (operation instanceof PostfixOperation.Call call) {
            children.addAll(call.arguments());
        }
        return children;
    }
}
