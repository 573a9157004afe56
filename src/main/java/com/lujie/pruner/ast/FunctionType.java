package com.lujie.pruner.ast;

/**
 * Type of a callable expression. Builtins, function pointers and calls
 * through an address carry no declaration.
 */
public class FunctionType extends Type {
	private final FunctionDefinition declaration;

	public FunctionType(FunctionDefinition declaration) {
		this.declaration = declaration;
	}

	public static FunctionType builtin() {
		return new FunctionType(null);
	}

	@Override
	public Category getCategory() {
		return Category.FUNCTION;
	}

	public boolean hasDeclaration() {
		return declaration != null;
	}

	public FunctionDefinition getDeclaration() {
		return declaration;
	}

	@Override
	public int hashCode() {
		return declaration == null ? 0 : declaration.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return declaration == ((FunctionType) obj).declaration;
	}

	@Override
	public String toString() {
		return declaration == null ? "function" : "function " + declaration.getName();
	}
}
