package com.lujie.pruner.ast;

/**
 * Dynamically-sized byte array.
 */
public class BytesType extends Type {

	@Override
	public Category getCategory() {
		return Category.BYTES;
	}

	@Override
	public int hashCode() {
		return Category.BYTES.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

	@Override
	public String toString() {
		return "bytes";
	}
}
