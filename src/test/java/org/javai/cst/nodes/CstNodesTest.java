package org.javai.cst.nodes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.cst.parser.CstParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CstNodes")
class CstNodesTest {

	@Nested
	@DisplayName("withChanges")
	class WithChanges {

		@Test
		void replacesOneSlotAndSharesTheRest() {
			BinaryOperation sum = BinaryOperation.of(Name.of("a"), BinaryOp.Kind.ADD, IntegerLiteral.of("1"));

			BinaryOperation changed = CstNodes.withChanges(sum, Map.of("right", IntegerLiteral.of("2")));

			assertThat(changed).isNotSameAs(sum);
			assertThat(changed.right()).isEqualTo(IntegerLiteral.of("2"));
			assertThat(changed.left()).isSameAs(sum.left());
			assertThat(changed.operator()).isSameAs(sum.operator());
			assertThat(sum.right()).isEqualTo(IntegerLiteral.of("1"));
		}

		@Test
		void noChangesGivesAnEqualCopy() {
			Name name = Name.of("x");

			assertThat(CstNodes.withChanges(name, Map.of())).isEqualTo(name);
		}

		@Test
		void replacesAttributes() {
			Name renamed = CstNodes.withChanges(Name.of("old"), Map.of("value", "fresh"));

			assertThat(renamed.value()).isEqualTo("fresh");
		}

		@Test
		void sequencesAreCopied() {
			List<BaseStatement> body = new ArrayList<>();
			body.add(SimpleStatementLine.of(Pass.of()));
			Module module = CstNodes.withChanges(Module.of(List.of()), Map.of("body", body));

			body.clear();

			assertThat(module.body()).hasSize(1);
			assertThat(module.code()).isEqualTo("pass\n");
		}

		@Test
		void optionalChildCanBeRemoved() {
			Assign assign = CstNodes.withChanges(Assign.of(Name.of("x"), Name.of("y")), Map.of("semicolon", Semicolon.withSpace()));
			Map<String, Object> changes = new HashMap<>();
			changes.put("semicolon", null);

			assertThat(CstNodes.withChanges(assign, changes).semicolon()).isNull();
		}

		@Test
		void unknownSlot() {
			assertThatThrownBy(() -> CstNodes.withChanges(Name.of("x"), Map.of("target", Name.of("y"))))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Name has no slot named 'target'");
		}

		@Test
		void requiredChildCannotBeRemoved() {
			Map<String, Object> changes = new HashMap<>();
			changes.put("value", null);

			assertThatThrownBy(() -> CstNodes.withChanges(Assign.of(Name.of("x"), Name.of("y")), changes))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Assign.value is required and cannot be removed");
		}

		@Test
		void childMustHaveTheSlotType() {
			assertThatThrownBy(() -> CstNodes.withChanges(Assign.of(Name.of("x"), Name.of("y")),
					Map.of("value", Pass.of())))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Assign.value expects a BaseExpression but got a Pass");
		}

		@Test
		void sequenceSlotNeedsACollection() {
			assertThatThrownBy(() -> CstNodes.withChanges(Module.of(List.of()), Map.of("body", Pass.of())))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Module.body holds a sequence but got a Pass");
		}

		@Test
		void singleChildSlotRejectsASequence() {
			Assign assign = Assign.of(Name.of("x"), Name.of("y"));

			assertThatThrownBy(() -> CstNodes.withChanges(assign, Map.of("value", List.of(Name.of("z")))))
					.isInstanceOf(ShapeException.class)
					.hasMessageStartingWith("Assign.value expects a BaseExpression but got a List");
			assertThatThrownBy(() -> CstNodes.withChanges(assign, Map.of("semicolon", List.of(Semicolon.withSpace()))))
					.isInstanceOf(ShapeException.class)
					.hasMessageStartingWith("Assign.semicolon expects a Semicolon but got a List");
			assertThat(assign.value()).isEqualTo(Name.of("y"));
		}

		@Test
		void sequenceElementsAreChecked() {
			assertThatThrownBy(() -> CstNodes.withChanges(Module.of(List.of()), Map.of("body", List.of(Name.of("x")))))
					.isInstanceOf(ShapeException.class)
					.hasMessageContaining("Module.body expects a BaseStatement");
		}

		@Test
		void constructorRejectionBecomesAShapeError() {
			assertThatThrownBy(() -> CstNodes.withChanges(Name.of("x"), Map.of("value", "")))
					.isInstanceOf(ShapeException.class)
					.hasMessageStartingWith("Invalid Name:")
					.hasCauseInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void unbalancedParenthesesAreRejected() {
			assertThatThrownBy(() -> CstNodes.withChanges(Name.of("x"), Map.of("lpar", List.of(LeftParen.plain()))))
					.isInstanceOf(ShapeException.class);
		}
	}

	@Nested
	@DisplayName("node family")
	class Family {

		private void collect(Class<?> type, Set<Class<?>> leaves) {
			if (!type.isInterface()) {
				leaves.add(type);
				return;
			}
			assertThat(type.isSealed()).as("%s is sealed", type.getSimpleName()).isTrue();
			for (Class<?> sub : type.getPermittedSubclasses()) {
				collect(sub, leaves);
			}
		}

		@Test
		void everyNodeTypeIsAPermittedRecord() {
			Set<Class<?>> leaves = new HashSet<>();
			collect(CstNode.class, leaves);

			assertThat(leaves).allSatisfy(type -> assertThat(type.isRecord()).as(type.getSimpleName()).isTrue());
			assertThat(leaves).contains(Module.class, Name.class, SimpleStatementLine.class, IndentedBlock.class,
					Newline.class, ImportFrom.class);
		}

		@Test
		void interfacesNarrowTheFamily() {
			Set<Class<?>> expressions = new HashSet<>();
			collect(BaseExpression.class, expressions);

			assertThat(expressions).contains(Name.class, Call.class, SimpleString.class)
					.doesNotContain(Pass.class, SimpleStatementLine.class);
		}
	}

	@Nested
	@DisplayName("generic access")
	class Access {

		@Test
		void childrenInSourceOrder() {
			BinaryOperation sum = BinaryOperation.of(Name.of("a"), BinaryOp.Kind.ADD, Name.of("b"));

			assertThat(CstNodes.children(sum)).containsExactly(sum.left(), sum.operator(), sum.right());
		}

		@Test
		void childrenSkipAbsentOptionals() {
			Assign assign = Assign.of(Name.of("x"), IntegerLiteral.of("1"));

			assertThat(CstNodes.children(assign)).containsExactly(assign.targets().get(0), assign.value());
		}

		@Test
		void leavesHaveNoChildren() {
			assertThat(CstNodes.children(Name.of("x"))).isEmpty();
			assertThat(CstNodes.children(Newline.DEFAULT)).isEmpty();
		}

		@Test
		void slotValue() {
			Name name = Name.of("x");

			assertThat(CstNodes.slotValue(name, "value")).isEqualTo("x");
			assertThatThrownBy(() -> CstNodes.slotValue(name, "nope")).isInstanceOf(ShapeException.class);
		}

		@Test
		void schemaDescribesSlots() {
			NodeSchema schema = CstNodes.schema(Assign.class);

			assertThat(schema.slots()).extracting(NodeSchema.Slot::name).containsExactly("targets", "value", "semicolon");
			assertThat(schema.slot("targets").orElseThrow().kind()).isEqualTo(NodeSchema.SlotKind.SEQUENCE);
			assertThat(schema.slot("value").orElseThrow().kind()).isEqualTo(NodeSchema.SlotKind.REQUIRED);
			assertThat(schema.slot("semicolon").orElseThrow().kind()).isEqualTo(NodeSchema.SlotKind.OPTIONAL);
			assertThat(CstNodes.schema(Name.class).slot("value").orElseThrow().kind())
					.isEqualTo(NodeSchema.SlotKind.ATTRIBUTE);
		}

		@Test
		void ensureType() {
			BaseExpression expression = CstParser.parseExpression("a.b");

			assertThat(CstNodes.ensureType(expression, Attribute.class).attr()).isEqualTo(Name.of("b"));
			assertThatThrownBy(() -> CstNodes.ensureType(expression, Call.class))
					.isInstanceOf(ShapeException.class)
					.hasMessage("Expected a Call but got a Attribute");
			assertThatThrownBy(() -> CstNodes.ensureType(null, Call.class))
					.hasMessage("Expected a Call but got nothing");
		}
	}
}
