package com.lujie.pruner.cfg;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.ibm.wala.util.collections.HashMapFactory;
import com.ibm.wala.util.collections.Pair;
import com.ibm.wala.util.debug.Assertions;
import com.lujie.pruner.ast.ContractDefinition;
import com.lujie.pruner.ast.FunctionCall;
import com.lujie.pruner.ast.FunctionDefinition;

/**
 * Node arena holding the control flow of every function of a program, keyed
 * by function and the contract it is analysed in. Free functions are keyed
 * with a null contract, library functions with their library.
 */
public class ControlFlowGraph {
	private final List<CfgNode> nodes = new ArrayList<CfgNode>();
	private final Map<Pair<ContractDefinition, FunctionDefinition>, FunctionFlow> functionFlows = HashMapFactory
			.make();

	public CfgNode newNode(FunctionCall... functionCalls) {
		CfgNode node = new CfgNode(nodes.size());
		for (FunctionCall functionCall : functionCalls) {
			node.addFunctionCall(functionCall);
		}
		nodes.add(node);
		return node;
	}

	public CfgNode getNode(int index) {
		if (index < 0 || index >= nodes.size()) {
			throw new IllegalArgumentException("no node with index " + index);
		}
		return nodes.get(index);
	}

	public int getNumberOfNodes() {
		return nodes.size();
	}

	public void addEdge(CfgNode from, CfgNode to) {
		checkOwned(from);
		checkOwned(to);
		from.addExit(to.getIndex());
	}

	public List<CfgNode> getSuccessors(CfgNode node) {
		checkOwned(node);
		List<CfgNode> ret = new ArrayList<CfgNode>();
		for (int exit : node.getExits()) {
			ret.add(nodes.get(exit));
		}
		return ret;
	}

	/**
	 * Creates the entry, exit and revert nodes of a new function flow.
	 *
	 * @param contract contract the function is analysed in, null for free
	 *                 functions.
	 */
	public FunctionFlow newFunctionFlow(FunctionDefinition function, ContractDefinition contract) {
		Pair<ContractDefinition, FunctionDefinition> key = Pair.make(contract, function);
		if (functionFlows.containsKey(key)) {
			throw new IllegalArgumentException("flow of " + function + " in " + contract + " already exists");
		}
		CfgNode entry = newNode();
		CfgNode exit = newNode();
		CfgNode revert = newNode();
		FunctionFlow flow = new FunctionFlow(entry.getIndex(), exit.getIndex(), revert.getIndex());
		functionFlows.put(key, flow);
		return flow;
	}

	public boolean hasFunctionFlow(FunctionDefinition function, ContractDefinition contract) {
		return functionFlows.containsKey(Pair.make(contract, function));
	}

	public FunctionFlow functionFlow(FunctionDefinition function, ContractDefinition contract) {
		FunctionFlow flow = functionFlows.get(Pair.make(contract, function));
		Assertions.productionAssertion(flow != null, "no control flow for " + function + " in " + contract);
		return flow;
	}

	/**
	 * Replaces all exits of {@code node} by a single edge to the revert sink of
	 * {@code flow}.
	 *
	 * @return true if the exits changed.
	 */
	public boolean truncateToRevert(CfgNode node, FunctionFlow flow) {
		checkOwned(node);
		List<Integer> exits = node.getExits();
		if (exits.size() == 1 && exits.get(0) == flow.getRevert()) {
			return false;
		}
		node.replaceExits(flow.getRevert());
		return true;
	}

	private void checkOwned(CfgNode node) {
		if (node.getIndex() >= nodes.size() || nodes.get(node.getIndex()) != node) {
			throw new IllegalArgumentException(node + " does not belong to this graph");
		}
	}
}
