package org.javai.cst.nodes;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static helpers for working with nodes generically through their
 * {@link NodeSchema}.
 */
public final class CstNodes {

	private static final ClassValue<NodeSchema> SCHEMAS = new ClassValue<>() {
		@Override
		@SuppressWarnings("unchecked")
		protected NodeSchema computeValue(Class<?> type) {
			return NodeSchema.of((Class<? extends CstNode>) type);
		}
	};

	private CstNodes() {
	}

	public static NodeSchema schema(Class<? extends CstNode> type) {
		return SCHEMAS.get(type);
	}

	public static NodeSchema schema(CstNode node) {
		return SCHEMAS.get(node.getClass());
	}

	/**
	 * The children of {@code node} in source order. Absent optional children are
	 * skipped; sequences contribute each element.
	 */
	public static List<CstNode> children(CstNode node) {
		List<CstNode> children = new ArrayList<>();
		for (NodeSchema.Slot slot : schema(node).slots()) {
			if (!slot.holdsChildren()) {
				continue;
			}
			Object value = slot.read(node);
			if (value instanceof List<?> list) {
				for (Object item : list) {
					children.add((CstNode) item);
				}
			}
			else if (value != null) {
				children.add((CstNode) value);
			}
		}
		return children;
	}

	/**
	 * The current value of one slot.
	 *
	 * @throws ShapeException if the node has no such slot
	 */
	public static Object slotValue(CstNode node, String name) {
		return schema(node).slot(name)
				.orElseThrow(() -> unknownSlot(node, name))
				.read(node);
	}

	/**
	 * Returns a copy of {@code node} with the named slots replaced.
	 *
	 * @throws ShapeException if a slot is unknown, a value has the wrong type or
	 * cardinality, or the node rejects the combination
	 */
	@SuppressWarnings("unchecked")
	public static <T extends CstNode> T withChanges(T node, Map<String, ?> changes) {
		Objects.requireNonNull(node, "node must not be null");
		Objects.requireNonNull(changes, "changes must not be null");
		NodeSchema schema = schema(node);
		for (String name : changes.keySet()) {
			if (schema.slot(name).isEmpty()) {
				throw unknownSlot(node, name);
			}
		}
		List<NodeSchema.Slot> slots = schema.slots();
		Object[] args = new Object[slots.size()];
		for (int i = 0; i < slots.size(); i++) {
			NodeSchema.Slot slot = slots.get(i);
			if (changes.containsKey(slot.name())) {
				Object value = changes.get(slot.name());
				check(node, slot, value);
				args[i] = value instanceof Collection<?> c ? List.copyOf(c) : value;
			}
			else {
				args[i] = slot.read(node);
			}
		}
		try {
			return (T) schema.constructor().newInstance(args);
		}
		catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof IllegalArgumentException || cause instanceof NullPointerException) {
				throw new ShapeException("Invalid " + node.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
			}
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException(cause);
		}
		catch (ReflectiveOperationException e) {
			throw new IllegalStateException("Cannot construct " + node.getClass().getSimpleName(), e);
		}
	}

	/**
	 * Returns {@code node} as {@code type}.
	 *
	 * @throws ShapeException if the node is of another type
	 */
	public static <T extends CstNode> T ensureType(CstNode node, Class<T> type) {
		if (!type.isInstance(node)) {
			throw new ShapeException("Expected a " + type.getSimpleName() + " but got "
					+ (node == null ? "nothing" : "a " + node.getClass().getSimpleName()));
		}
		return type.cast(node);
	}

	private static void check(CstNode node, NodeSchema.Slot slot, Object value) {
		String where = node.getClass().getSimpleName() + "." + slot.name();
		switch (slot.kind()) {
			case REQUIRED -> {
				if (value == null) {
					throw new ShapeException(where + " is required and cannot be removed");
				}
				requireInstance(where, slot.type(), value);
			}
			case OPTIONAL -> {
				if (value != null) {
					requireInstance(where, slot.type(), value);
				}
			}
			case SEQUENCE -> {
				if (!(value instanceof Collection<?> items)) {
					throw new ShapeException(where + " holds a sequence but got "
							+ (value == null ? "nothing" : "a " + value.getClass().getSimpleName()));
				}
				for (Object item : items) {
					if (item == null) {
						throw new ShapeException(where + " cannot hold a null element");
					}
					requireInstance(where, slot.type(), item);
				}
			}
			case ATTRIBUTE -> {
				if (value == null && slot.component().getType().isPrimitive()) {
					throw new ShapeException(where + " cannot be null");
				}
				if (value != null) {
					requireInstance(where, slot.type(), value);
				}
			}
		}
	}

	private static void requireInstance(String where, Class<?> type, Object value) {
		if (!type.isInstance(value)) {
			throw new ShapeException(where + " expects a " + type.getSimpleName() + " but got a "
					+ value.getClass().getSimpleName());
		}
	}

	private static ShapeException unknownSlot(CstNode node, String name) {
		return new ShapeException(node.getClass().getSimpleName() + " has no slot named '" + name + "'");
	}
}
