package com.lujie.pruner.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lujie.pruner.ast.FunctionCall;

/**
 * A program point of a {@link ControlFlowGraph}. Successors are arena
 * indices into the owning graph.
 */
public class CfgNode {
	private final int index;
	private final List<FunctionCall> functionCalls = new ArrayList<FunctionCall>();
	private final List<Integer> exits = new ArrayList<Integer>();

	CfgNode(int index) {
		this.index = index;
	}

	public int getIndex() {
		return index;
	}

	public void addFunctionCall(FunctionCall functionCall) {
		functionCalls.add(functionCall);
	}

	/**
	 * @return the calls evaluated at this point, in evaluation order.
	 */
	public List<FunctionCall> getFunctionCalls() {
		return Collections.unmodifiableList(functionCalls);
	}

	public List<Integer> getExits() {
		return Collections.unmodifiableList(exits);
	}

	void addExit(int target) {
		exits.add(target);
	}

	void replaceExits(int target) {
		exits.clear();
		exits.add(target);
	}

	@Override
	public String toString() {
		return "node#" + index + functionCalls + "->" + exits;
	}
}
