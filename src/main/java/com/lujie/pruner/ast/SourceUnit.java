package com.lujie.pruner.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of an analysed program: contracts, libraries, interfaces and free
 * functions in declaration order.
 */
public class SourceUnit {
	private final List<TopLevelDeclaration> declarations = new ArrayList<TopLevelDeclaration>();

	public SourceUnit add(TopLevelDeclaration declaration) {
		if (declaration instanceof FunctionDefinition && !((FunctionDefinition) declaration).isFree()) {
			throw new IllegalArgumentException("member function " + declaration + " is not a top level declaration");
		}
		declarations.add(declaration);
		return this;
	}

	public List<TopLevelDeclaration> getDeclarations() {
		return Collections.unmodifiableList(declarations);
	}

	public void accept(ASTVisitor visitor) {
		for (TopLevelDeclaration declaration : declarations) {
			declaration.accept(visitor);
		}
	}
}
