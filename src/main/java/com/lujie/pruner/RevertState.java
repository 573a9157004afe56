package com.lujie.pruner;

/**
 * Revert behaviour of a function, ordered by strength of evidence.
 */
public enum RevertState {
	/** recursion still being analysed */
	PENDING,
	ALL_PATHS_REVERT,
	HAS_NON_REVERTING_PATH
}
