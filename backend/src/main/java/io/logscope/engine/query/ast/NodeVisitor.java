package io.logscope.engine.query.ast;

public interface NodeVisitor<R> {

    R visitBinary(Node.Binary node);

    R visitUnary(Node.Unary node);

    R visitIdentifier(Node.Identifier node);

    R visitString(Node.StringLiteral node);

    R visitInteger(Node.IntegerLiteral node);

    R visitFloat(Node.FloatLiteral node);

    R visitBool(Node.BoolLiteral node);

    R visitNil(Node.NilLiteral node);

    R visitArray(Node.ArrayLiteral node);

    R visitConstantSet(Node.ConstantSet node);

    R visitCall(Node.Call node);

    R visitMember(Node.Member node);
}
