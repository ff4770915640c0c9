package org.goof.ast;

/**
 * One visit method per node variant. The analyzer, the JavaScript generator
 * and the JSON dumper are all implementations.
 */
public interface AstVisitor<R>
{
	R visitProgram(Program node);

	R visitArrayExpression(ArrayExpression node);

	R visitArrayType(ArrayTypeNode node);

	R visitAssignmentStatement(AssignmentStatement node);

	R visitBinaryExpression(BinaryExpression node);

	R visitCallExpression(CallExpression node);

	R visitField(Field node);

	R visitForStatement(ForStatement node);

	R visitFunc(Func node);

	R visitMethod(Method node);

	R visitGifStatement(GifStatement node);

	R visitIdExp(IdExp node);

	R visitLiteral(Literal node);

	R visitMemberExpression(MemberExpression node);

	R visitObjectExp(ObjectExp node);

	R visitParameter(Parameter node);

	R visitPrimitiveType(PrimitiveTypeNode node);

	R visitRecordType(RecordTypeNode node);

	R visitReturnStatement(ReturnStatement node);

	R visitThrowStatement(ThrowStatement node);

	R visitVariableDeclaration(VariableDeclaration node);

	R visitWhileStatement(WhileStatement node);
}
