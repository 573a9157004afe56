package com.lujie.pruner.ast;

public class Identifier extends Expression {
	private final String name;

	public Identifier(String name, Type type, VirtualLookup requiredLookup) {
		super(type, requiredLookup);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return name;
	}
}
