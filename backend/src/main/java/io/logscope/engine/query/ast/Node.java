package io.logscope.engine.query.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed filter expression. Every variant dispatches through {@link NodeVisitor}, so a new
 * variant does not compile until each visitor handles it.
 */
public sealed interface Node permits Node.Binary, Node.Unary, Node.Identifier, Node.StringLiteral,
        Node.IntegerLiteral, Node.FloatLiteral, Node.BoolLiteral, Node.NilLiteral, Node.ArrayLiteral,
        Node.ConstantSet, Node.Call, Node.Member {

    <R> R accept(NodeVisitor<R> visitor);

    record Binary(String operator, Node left, Node right) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(String operator, Node operand) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Identifier(String name) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record StringLiteral(String value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record IntegerLiteral(long value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    record FloatLiteral(double value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    record BoolLiteral(boolean value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record NilLiteral() implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNil(this);
        }
    }

    record ArrayLiteral(List<Node> elements) implements Node {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * Array of literal values folded at parse time. Values are {@link String}, {@link Long},
     * {@link Double} or {@link Boolean}; duplicates collapse and iteration order is unspecified.
     */
    record ConstantSet(Set<Object> values) implements Node {
        public ConstantSet {
            values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConstantSet(this);
        }
    }

    record Call(String function, List<Node> arguments) implements Node {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Member(Node target, String property) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }
}
