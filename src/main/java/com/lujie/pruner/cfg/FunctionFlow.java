package com.lujie.pruner.cfg;

/**
 * Entry, normal exit and revert sink of one function's control flow, as
 * indices into the owning {@link ControlFlowGraph}.
 */
public final class FunctionFlow {
	private final int entry;
	private final int exit;
	private final int revert;

	FunctionFlow(int entry, int exit, int revert) {
		this.entry = entry;
		this.exit = exit;
		this.revert = revert;
	}

	public int getEntry() {
		return entry;
	}

	public int getExit() {
		return exit;
	}

	/**
	 * @return the node reached by every path that aborts the transaction.
	 */
	public int getRevert() {
		return revert;
	}

	@Override
	public String toString() {
		return "flow[entry=" + entry + ", exit=" + exit + ", revert=" + revert + "]";
	}
}
