package com.lujie.pruner.ast;

public class FixedBytesType extends Type {
	private final int numBytes;

	public FixedBytesType(int numBytes) {
		if (numBytes < 1 || numBytes > 32) {
			throw new IllegalArgumentException("invalid fixed bytes size " + numBytes);
		}
		this.numBytes = numBytes;
	}

	@Override
	public Category getCategory() {
		return Category.FIXED_BYTES;
	}

	@Override
	public int hashCode() {
		return 31 + numBytes;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return numBytes == ((FixedBytesType) obj).numBytes;
	}

	@Override
	public String toString() {
		return "bytes" + numBytes;
	}
}
