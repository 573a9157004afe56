package com.lujie.pruner;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ibm.wala.util.debug.UnimplementedError;
import com.lujie.pruner.ast.BoolType;
import com.lujie.pruner.ast.ContractDefinition;
import com.lujie.pruner.ast.ContractDefinition.ContractKind;
import com.lujie.pruner.ast.ContractType;
import com.lujie.pruner.ast.Expression;
import com.lujie.pruner.ast.FunctionDefinition;
import com.lujie.pruner.ast.FunctionType;
import com.lujie.pruner.ast.Identifier;
import com.lujie.pruner.ast.IntegerType;
import com.lujie.pruner.ast.MemberAccess;
import com.lujie.pruner.ast.VirtualLookup;

/**
 * contract A { foo(uint256) } contract B is A { foo(uint256) } contract C is
 * B { foo(uint256) } contract D is C { foo(uint256) }, linearized as
 * [D, C, B, A].
 */
class ResolveFunctionTest {

	private ContractDefinition a;
	private ContractDefinition b;
	private ContractDefinition c;
	private ContractDefinition d;
	private FunctionDefinition fooA;
	private FunctionDefinition fooB;
	private FunctionDefinition fooC;
	private FunctionDefinition fooD;

	@BeforeEach
	void setUp() {
		a = new ContractDefinition("A", ContractKind.CONTRACT);
		b = new ContractDefinition("B", ContractKind.CONTRACT);
		c = new ContractDefinition("C", ContractKind.CONTRACT);
		d = new ContractDefinition("D", ContractKind.CONTRACT);
		b.setLinearizedBaseContracts(b, a);
		c.setLinearizedBaseContracts(c, b, a);
		d.setLinearizedBaseContracts(d, c, b, a);
		fooA = a.addFunction("foo", IntegerType.uint256());
		fooB = b.addFunction("foo", IntegerType.uint256());
		fooC = c.addFunction("foo", IntegerType.uint256());
		fooD = d.addFunction("foo", IntegerType.uint256());
	}

	private static Expression expression(FunctionDefinition function, VirtualLookup lookup) {
		return new Identifier(function.getName(), new FunctionType(function), lookup);
	}

	private static Expression superExpression(ContractDefinition within, FunctionDefinition function) {
		return Calls.superCall(within, function).getExpression();
	}

	@Test
	void virtualCallResolvesToOverrideOfCallingContract() {
		Expression call = expression(fooA, VirtualLookup.VIRTUAL);
		assertSame(fooD, new ResolveFunction(fooA, d).resolve(call));
		assertSame(fooB, new ResolveFunction(fooA, b).resolve(call));
		assertSame(fooA, new ResolveFunction(fooA, a).resolve(call));
	}

	@Test
	void virtualCallMatchesParameterTypes() {
		FunctionDefinition fooBool = a.addFunction("foo", new BoolType());
		assertSame(fooBool, new ResolveFunction(fooBool, d).resolve(expression(fooBool, VirtualLookup.VIRTUAL)));
		assertSame(fooD, new ResolveFunction(fooA, d).resolve(expression(fooA, VirtualLookup.VIRTUAL)));
	}

	@Test
	void staticCallIgnoresOverrides() {
		assertSame(fooB, new ResolveFunction(fooB, d).resolve(Calls.staticCall(fooB).getExpression()));
	}

	@Test
	void superCallStartsAfterTheWritingContract() {
		assertSame(fooC, new ResolveFunction(fooD, d).resolve(superExpression(d, fooD)));
		assertSame(fooB, new ResolveFunction(fooC, d).resolve(superExpression(c, fooC)));
		assertSame(fooA, new ResolveFunction(fooB, d).resolve(superExpression(b, fooB)));
		// the same super call written in C behaves differently when C is the most derived contract
		assertSame(fooB, new ResolveFunction(fooC, c).resolve(superExpression(c, fooC)));
	}

	@Test
	void superCallSkipsBasesWithoutOverride() {
		ContractDefinition e = new ContractDefinition("E", ContractKind.CONTRACT);
		ContractDefinition f = new ContractDefinition("F", ContractKind.CONTRACT);
		f.setLinearizedBaseContracts(f, e, b, a);
		FunctionDefinition fooF = f.addFunction("foo", IntegerType.uint256());
		e.addFunction("bar");
		assertSame(fooB, new ResolveFunction(fooF, f).resolve(superExpression(f, fooF)));
	}

	@Test
	void freeFunctionResolvesToItself() {
		FunctionDefinition helper = FunctionDefinition.free("foo", IntegerType.uint256());
		assertSame(helper, new ResolveFunction(helper, d).resolve(expression(helper, VirtualLookup.VIRTUAL)));
		assertSame(helper, new ResolveFunction(helper, null).resolve(expression(helper, VirtualLookup.VIRTUAL)));
	}

	@Test
	void missingLookupIsFatal() {
		Expression call = new Identifier("foo", new FunctionType(fooA), null);
		assertThrows(UnimplementedError.class, () -> new ResolveFunction(fooA, d).resolve(call));
	}

	@Test
	void superLookupOnIdentifierIsFatal() {
		Expression call = expression(fooA, VirtualLookup.SUPER);
		assertThrows(UnimplementedError.class, () -> new ResolveFunction(fooA, d).resolve(call));
	}

	@Test
	void superLookupOnNonSuperReceiverIsFatal() {
		Expression call = new MemberAccess(new Identifier("c", new ContractType(c, false), null), "foo",
				new FunctionType(fooC), VirtualLookup.SUPER);
		assertThrows(UnimplementedError.class, () -> new ResolveFunction(fooC, d).resolve(call));
	}

	@Test
	void superLookupOnIntegerReceiverIsFatal() {
		Expression call = new MemberAccess(new Identifier("x", IntegerType.uint256(), null), "foo",
				new FunctionType(fooC), VirtualLookup.SUPER);
		assertThrows(UnimplementedError.class, () -> new ResolveFunction(fooC, d).resolve(call));
	}

	@Test
	void superCallInLastBaseIsFatal() {
		assertThrows(UnimplementedError.class,
				() -> new ResolveFunction(fooA, d).resolve(superExpression(a, fooA)));
	}

	@Test
	void virtualMemberCallWithoutContractIsFatal() {
		assertThrows(UnimplementedError.class,
				() -> new ResolveFunction(fooA, null).resolve(expression(fooA, VirtualLookup.VIRTUAL)));
	}

	@Test
	void libraryFunctionResolvesToItself() {
		ContractDefinition lib = new ContractDefinition("L", ContractKind.LIBRARY);
		FunctionDefinition libFoo = lib.addFunction("foo", IntegerType.uint256());
		Expression call = Calls.virtualCall(libFoo).getExpression();
		assertSame(libFoo, new ResolveFunction(libFoo, lib).resolve(call));
		assertSame(libFoo, new ResolveFunction(libFoo, d).resolve(call));
		assertSame(libFoo, libFoo.resolveVirtual(d));
	}

	@Test
	void superLookupOfLibraryFunctionIsFatal() {
		ContractDefinition lib = new ContractDefinition("L", ContractKind.LIBRARY);
		FunctionDefinition libFoo = lib.addFunction("foo");
		assertThrows(UnimplementedError.class,
				() -> new ResolveFunction(libFoo, d).resolve(superExpression(d, libFoo)));
	}
}
