package com.lujie.pruner.ast;

public interface ASTVisitor {
	void visit(ContractDefinition contract);

	void visit(FunctionDefinition function);
}
