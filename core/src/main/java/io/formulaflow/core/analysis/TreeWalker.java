package io.formulaflow.core.analysis;

import io.formulaflow.core.model.Expr;
import java.util.function.Consumer;

/** Pre-order traversal of an expression tree, handing every node to a consumer. */
final class TreeWalker implements Expr.Visitor<Void> {

    private final Consumer<Expr> consumer;

    private TreeWalker(Consumer<Expr> consumer) {
        this.consumer = consumer;
    }

    static void walk(Expr root, Consumer<Expr> consumer) {
        root.accept(new TreeWalker(consumer));
    }

    @Override
    public Void visitConstant(Expr.Constant node) {
        consumer.accept(node);
        return null;
    }

    @Override
    public Void visitVariable(Expr.Variable node) {
        consumer.accept(node);
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary node) {
        consumer.accept(node);
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public Void visitNegate(Expr.Negate node) {
        consumer.accept(node);
        node.operand().accept(this);
        return null;
    }

    @Override
    public Void visitComparison(Expr.Comparison node) {
        consumer.accept(node);
        node.first().accept(this);
        for (Expr operand : node.operands()) {
            operand.accept(this);
        }
        return null;
    }

    @Override
    public Void visitCall(Expr.Call node) {
        consumer.accept(node);
        for (Expr argument : node.arguments()) {
            argument.accept(this);
        }
        return null;
    }
}
