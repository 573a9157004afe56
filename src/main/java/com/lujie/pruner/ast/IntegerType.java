package com.lujie.pruner.ast;

public class IntegerType extends Type {
	private final int bits;
	private final boolean signed;

	public IntegerType(int bits, boolean signed) {
		if (bits <= 0 || bits > 256 || bits % 8 != 0) {
			throw new IllegalArgumentException("invalid integer width " + bits);
		}
		this.bits = bits;
		this.signed = signed;
	}

	public static IntegerType uint256() {
		return new IntegerType(256, false);
	}

	@Override
	public Category getCategory() {
		return Category.INTEGER;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + bits;
		result = prime * result + (signed ? 1231 : 1237);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		IntegerType other = (IntegerType) obj;
		return bits == other.bits && signed == other.signed;
	}

	@Override
	public String toString() {
		return (signed ? "int" : "uint") + bits;
	}
}
