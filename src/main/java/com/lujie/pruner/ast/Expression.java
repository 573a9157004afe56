package com.lujie.pruner.ast;

public abstract class Expression {
	private final Type type;
	// only set on expressions that reference a function
	private final VirtualLookup requiredLookup;

	protected Expression(Type type, VirtualLookup requiredLookup) {
		if (type == null) {
			throw new IllegalArgumentException("expression without a type");
		}
		this.type = type;
		this.requiredLookup = requiredLookup;
	}

	public Type getType() {
		return type;
	}

	public VirtualLookup getRequiredLookup() {
		return requiredLookup;
	}
}
