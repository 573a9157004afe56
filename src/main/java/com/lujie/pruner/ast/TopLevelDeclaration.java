package com.lujie.pruner.ast;

/**
 * A declaration that may appear directly in a {@link SourceUnit}.
 */
public interface TopLevelDeclaration {
	void accept(ASTVisitor visitor);
}
