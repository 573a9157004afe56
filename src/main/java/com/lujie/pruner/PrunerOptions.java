package com.lujie.pruner;

public class PrunerOptions {
	/** print progress, pruning statistics and unresolved recursion */
	public boolean verbose = false;

	public static PrunerOptions defaults() {
		return new PrunerOptions();
	}
}
