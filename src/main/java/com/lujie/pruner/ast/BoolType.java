package com.lujie.pruner.ast;

public class BoolType extends Type {

	@Override
	public Category getCategory() {
		return Category.BOOL;
	}

	@Override
	public int hashCode() {
		return Category.BOOL.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

	@Override
	public String toString() {
		return "bool";
	}
}
