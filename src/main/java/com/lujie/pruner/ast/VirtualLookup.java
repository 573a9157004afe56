package com.lujie.pruner.ast;

/**
 * How the function referenced by an expression is looked up at run time.
 */
public enum VirtualLookup {
	/** the referenced definition is called, it cannot be overridden */
	STATIC,
	/** the most derived override in the calling contract is called */
	VIRTUAL,
	/** lookup starts at the base following the current contract */
	SUPER
}
