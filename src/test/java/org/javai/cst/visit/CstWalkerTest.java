package org.javai.cst.visit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.BaseStatement;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.Expr;
import org.javai.cst.nodes.FunctionDef;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.IntegerLiteral;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.Semicolon;
import org.javai.cst.nodes.ShapeException;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.parser.CstParser;
import org.javai.cst.testsupport.PythonSamples.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.InOrder;

@DisplayName("CstWalker")
class CstWalkerTest {

	private static Name firstName(CstNode root) {
		if (root instanceof Name name) {
			return name;
		}
		for (CstNode child : root.children()) {
			Name found = firstName(child);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	private static boolean contains(CstNode root, CstNode target) {
		if (root == target) {
			return true;
		}
		for (CstNode child : root.children()) {
			if (contains(child, target)) {
				return true;
			}
		}
		return false;
	}

	@Nested
	@DisplayName("visiting")
	class Visiting {

		@Test
		void namesAreVisitedInSourceOrder() {
			List<String> names = new ArrayList<>();
			Module module = CstParser.parseModule("a = b + c\nd(e)\n");

			Module visited = CstWalker.visit(module, new CstVisitor() {
				@Override
				public boolean visitName(Name node) {
					names.add(node.value());
					return true;
				}
			});

			assertThat(visited).isSameAs(module);
			assertThat(names).containsExactly("a", "b", "c", "d", "e");
		}

		@Test
		void returningFalseSkipsChildrenButStillLeaves() {
			List<String> names = new ArrayList<>();
			List<String> left = new ArrayList<>();
			Module module = CstParser.parseModule("def f(x):\n    y = 1\nz = 2\n");

			CstWalker.visit(module, new CstVisitor() {
				@Override
				public boolean visitFunctionDef(FunctionDef node) {
					return false;
				}

				@Override
				public boolean visitName(Name node) {
					names.add(node.value());
					return true;
				}

				@Override
				public void leaveFunctionDef(FunctionDef node) {
					left.add(node.name().value());
				}
			});

			assertThat(names).containsExactly("z");
			assertThat(left).containsExactly("f");
		}

		@Test
		void scopeTracksAncestors() {
			List<Integer> depths = new ArrayList<>();
			List<Class<?>> parents = new ArrayList<>();
			Module module = CstParser.parseModule("x = 1\n");

			CstWalker.visit(module, new CstVisitor() {
				@Override
				public boolean visitIntegerLiteral(IntegerLiteral node) {
					depths.add(scope().depth());
					parents.add(scope().parent().orElseThrow().getClass());
					assertThat(scope().ancestors().get(0)).isSameAs(module);
					return true;
				}
			});

			assertThat(depths).containsExactly(3);
			assertThat(parents).containsExactly(Assign.class);
		}

		@Test
		void scopeAttributesLiveForOneTraversal() {
			CstVisitor counter = new CstVisitor() {
				@Override
				public boolean visitName(Name node) {
					int seen = scope().<Integer>get("names").orElse(0);
					scope().put("names", seen + 1);
					return true;
				}

				@Override
				public void leaveModule(Module node) {
					assertThat(scope().<Integer>get("names")).contains(3);
				}
			};
			Module module = CstParser.parseModule("a = b\nc\n");

			CstWalker.visit(module, counter);
			CstWalker.visit(module, counter);

			assertThatThrownBy(counter::scope)
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("No traversal in progress");
		}

		@Test
		void aVisitorRunsOneTraversalAtATime() {
			Module module = CstParser.parseModule("x\n");
			CstVisitor reentrant = new CstVisitor() {
				@Override
				public boolean visitName(Name node) {
					CstWalker.visit(node, this);
					return true;
				}
			};

			assertThatThrownBy(() -> CstWalker.visit(module, reentrant))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("already running a traversal");
		}

		@Test
		void hooksAreCalledAroundChildren() {
			CstVisitor visitor = spy(CstVisitor.class);
			Module module = CstParser.parseModule("x = 1\n");
			SimpleStatementLine line = (SimpleStatementLine) module.body().get(0);
			Assign assign = (Assign) line.body().get(0);

			CstWalker.visit(module, visitor);

			InOrder order = inOrder(visitor);
			order.verify(visitor).visitModule(module);
			order.verify(visitor).visitAssign(assign);
			order.verify(visitor).visitIntegerLiteral((IntegerLiteral) assign.value());
			order.verify(visitor).leaveAssign(assign);
			order.verify(visitor).leaveModule(module);
			verify(visitor, never()).visitFunctionDef(any());
		}
	}

	@Nested
	@DisplayName("transforming")
	class Transforming {

		@Test
		void identityTransformReturnsTheSameTree() {
			Module module = CstParser.parseModule("def f(a):\n    return a + 1\n");

			CstNode result = CstWalker.transform(module, new CstTransformer() {
			});

			assertThat(result).isSameAs(module);
		}

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modules")
		void identityTransformKeepsEverySample(Sample sample) {
			Module module = CstParser.parseModule(sample.source());

			assertThat(CstWalker.transform(module, new CstTransformer() {
			})).isSameAs(module);
		}

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modules")
		void renamingOneNameSharesEveryOtherStatement(Sample sample) {
			Module module = CstParser.parseModule(sample.source());
			Name first = firstName(module);

			Module result = (Module) CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveName(Name original, Name updated) {
					return original == first ? Name.of("renamed") : updated;
				}
			});

			assertThat(module.code()).isEqualTo(sample.source());
			if (first == null) {
				assertThat(result).isSameAs(module);
				return;
			}
			for (int i = 0; i < module.body().size(); i++) {
				BaseStatement before = module.body().get(i);
				if (contains(before, first)) {
					assertThat(result.body().get(i)).isNotSameAs(before);
				}
				else {
					assertThat(result.body().get(i)).isSameAs(before);
				}
			}
		}

		@Test
		void renamingRebuildsOnlyThePathToTheChange() {
			Module module = CstParser.parseModule("x = 1\ny = 2\n");

			Module result = (Module) CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveName(Name original, Name updated) {
					return original.value().equals("y") ? Name.of("renamed") : updated;
				}
			});

			assertThat(result.code()).isEqualTo("x = 1\nrenamed = 2\n");
			assertThat(result.body().get(0)).isSameAs(module.body().get(0));
			assertThat(result.body().get(1)).isNotSameAs(module.body().get(1));
			assertThat(module.code()).isEqualTo("x = 1\ny = 2\n");
		}

		@Test
		void removingEveryStatementOfABlockLeavesPass() {
			Module module = CstParser.parseModule("def f():\n    a = 1\n    b = 2\n");

			Module result = (Module) CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveSimpleStatementLine(SimpleStatementLine original, SimpleStatementLine updated) {
					return Replacement.remove();
				}
			});

			assertThat(((IndentedBlock) ((FunctionDef) result.body().get(0)).body()).body()).isEmpty();
			assertThat(result.code()).isEqualTo("def f():\n    pass\n");
		}

		@Test
		void flatteningSplicesStatements() {
			Module module = CstParser.parseModule("a\nb\n");

			Module result = (Module) CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveSimpleStatementLine(SimpleStatementLine original, SimpleStatementLine updated) {
					Expr expr = (Expr) original.body().get(0);
					if (!((Name) expr.value()).value().equals("a")) {
						return updated;
					}
					List<BaseStatement> copies = List.of(updated, SimpleStatementLine.of(Expr.of(Name.of("a2"))));
					return Replacement.flatten(copies);
				}
			});

			assertThat(result.code()).isEqualTo("a\na2\nb\n");
		}

		@Test
		void removingAnOptionalChildEmptiesTheSlot() {
			Module module = CstParser.parseModule("a = 1; b = 2\n");

			Module result = (Module) CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveSemicolon(Semicolon original, Semicolon updated) {
					return Replacement.remove();
				}
			});

			assertThat(result.code()).isEqualTo("a = 1; b = 2\n");
			Assign first = (Assign) ((SimpleStatementLine) result.body().get(0)).body().get(0);
			assertThat(first.semicolon()).isNull();
		}

		@Test
		void requiredChildCannotBeRemoved() {
			Module module = CstParser.parseModule("x = 1\n");

			assertThatThrownBy(() -> CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveIntegerLiteral(IntegerLiteral original, IntegerLiteral updated) {
					return Replacement.remove();
				}
			}))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Assign.value is required and cannot be removed");
		}

		@Test
		void optionalChildCannotBeFlattened() {
			Module module = CstParser.parseModule("a; b\n");

			assertThatThrownBy(() -> CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveSemicolon(Semicolon original, Semicolon updated) {
					return Replacement.flatten(List.of(updated));
				}
			}))
					.isInstanceOf(ShapeException.class)
					.hasMessageContaining("cannot be flattened");
		}

		@Test
		void replacementMustFitTheSlot() {
			Module module = CstParser.parseModule("x = 1\n");

			assertThatThrownBy(() -> CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveIntegerLiteral(IntegerLiteral original, IntegerLiteral updated) {
					return SimpleStatementLine.of();
				}
			}))
					.isInstanceOf(ShapeException.class)
					.hasMessageContaining("expects a BaseExpression");
		}

		@Test
		void rootCannotBeRemoved() {
			Module module = CstParser.parseModule("x = 1\n");

			assertThatThrownBy(() -> CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveModule(Module original, Module updated) {
					return Replacement.remove();
				}
			}))
					.isInstanceOf(ShapeException.class)
					.hasMessage("The root Module cannot be removed or flattened");
		}

		@Test
		void leaveSeesUpdatedChildren() {
			Module module = CstParser.parseModule("x = 1\n");
			List<String> seen = new ArrayList<>();

			CstWalker.transform(module, new CstTransformer() {
				@Override
				public Replacement leaveIntegerLiteral(IntegerLiteral original, IntegerLiteral updated) {
					return IntegerLiteral.of("2");
				}

				@Override
				public Replacement leaveAssign(Assign original, Assign updated) {
					seen.add(((IntegerLiteral) original.value()).value());
					seen.add(((IntegerLiteral) updated.value()).value());
					return updated;
				}
			});

			assertThat(seen).containsExactly("1", "2");
		}
	}
}
