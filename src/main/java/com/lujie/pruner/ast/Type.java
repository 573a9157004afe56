package com.lujie.pruner.ast;

/**
 * Type of an expression as annotated by the type checker. The set of
 * categories is closed, callers switch on {@link #getCategory()}.
 */
public abstract class Type {
	public enum Category {
		INTEGER, BOOL, ADDRESS, FIXED_BYTES, BYTES, CONTRACT, FUNCTION
	}

	public abstract Category getCategory();
}
