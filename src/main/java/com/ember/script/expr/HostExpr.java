package com.ember.script.expr;

import java.util.List;

final class HostExpr {

    private HostExpr() {}

    interface Node {
        <R> R accept(Visitor<R> visitor) throws ExpressionException;
    }

    interface Visitor<R> {
        R visitBinary(Binary expr) throws ExpressionException;
        R visitLogical(Logical expr) throws ExpressionException;
        R visitUnary(Unary expr) throws ExpressionException;
        R visitLiteral(Literal expr) throws ExpressionException;
        R visitCall(Call expr) throws ExpressionException;
    }

    static final class Binary implements Node {
        final Node left;
        final HostToken operator;
        final Node right;

        Binary(Node left, HostToken operator, Node right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ExpressionException { return visitor.visitBinary(this); }
    }

    static final class Logical implements Node {
        final Node left;
        final HostToken operator;
        final Node right;

        Logical(Node left, HostToken operator, Node right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ExpressionException { return visitor.visitLogical(this); }
    }

    static final class Unary implements Node {
        final HostToken operator;
        final Node right;

        Unary(HostToken operator, Node right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ExpressionException { return visitor.visitUnary(this); }
    }

    /** Boolean, Double or String constant; bare words are strings. */
    static final class Literal implements Node {
        final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ExpressionException { return visitor.visitLiteral(this); }
    }

    static final class Call implements Node {
        final String name;
        final List<Node> arguments;

        Call(String name, List<Node> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws ExpressionException { return visitor.visitCall(this); }
    }
}
