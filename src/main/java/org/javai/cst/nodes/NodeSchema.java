package org.javai.cst.nodes;

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The slots of one node type, in source order, derived from its record
 * components.
 */
public final class NodeSchema {

	public enum SlotKind {
		REQUIRED,
		OPTIONAL,
		SEQUENCE,
		ATTRIBUTE
	}

	/**
	 * One slot. For sequences {@code type} is the element type.
	 */
	public record Slot(String name, SlotKind kind, Class<?> type, RecordComponent component) {

		public boolean holdsChildren() {
			return kind != SlotKind.ATTRIBUTE;
		}

		Object read(CstNode node) {
			try {
				return component.getAccessor().invoke(node);
			}
			catch (ReflectiveOperationException e) {
				throw new IllegalStateException("Cannot read slot " + name + " of " + node.getClass().getSimpleName(), e);
			}
		}
	}

	private final Class<? extends CstNode> type;
	private final Map<String, Slot> slots;
	private final Constructor<? extends CstNode> constructor;

	private NodeSchema(Class<? extends CstNode> type, Map<String, Slot> slots, Constructor<? extends CstNode> constructor) {
		this.type = type;
		this.slots = slots;
		this.constructor = constructor;
	}

	static NodeSchema of(Class<? extends CstNode> type) {
		if (!type.isRecord()) {
			throw new IllegalArgumentException(type.getName() + " is not a record node type");
		}
		RecordComponent[] components = type.getRecordComponents();
		Map<String, Slot> slots = new LinkedHashMap<>();
		Class<?>[] parameterTypes = new Class<?>[components.length];
		for (int i = 0; i < components.length; i++) {
			RecordComponent component = components[i];
			parameterTypes[i] = component.getType();
			slots.put(component.getName(), slotFor(component));
		}
		try {
			return new NodeSchema(type, slots, type.getDeclaredConstructor(parameterTypes));
		}
		catch (NoSuchMethodException e) {
			throw new IllegalStateException("No canonical constructor on " + type.getName(), e);
		}
	}

	private static Slot slotFor(RecordComponent component) {
		Class<?> raw = component.getType();
		if (List.class.isAssignableFrom(raw)) {
			return new Slot(component.getName(), SlotKind.SEQUENCE, elementType(component.getGenericType()), component);
		}
		if (CstNode.class.isAssignableFrom(raw)) {
			SlotKind kind = component.isAnnotationPresent(OptionalChild.class) ? SlotKind.OPTIONAL : SlotKind.REQUIRED;
			return new Slot(component.getName(), kind, raw, component);
		}
		return new Slot(component.getName(), SlotKind.ATTRIBUTE, boxed(raw), component);
	}

	private static Class<?> elementType(Type generic) {
		if (generic instanceof ParameterizedType parameterized) {
			Type argument = parameterized.getActualTypeArguments()[0];
			if (argument instanceof WildcardType wildcard) {
				argument = wildcard.getUpperBounds()[0];
			}
			if (argument instanceof Class<?> element) {
				return element;
			}
		}
		return CstNode.class;
	}

	private static Class<?> boxed(Class<?> type) {
		if (type == boolean.class) {
			return Boolean.class;
		}
		if (type == int.class) {
			return Integer.class;
		}
		return type;
	}

	public Class<? extends CstNode> type() {
		return type;
	}

	public List<Slot> slots() {
		return List.copyOf(slots.values());
	}

	public Optional<Slot> slot(String name) {
		return Optional.ofNullable(slots.get(name));
	}

	Constructor<? extends CstNode> constructor() {
		return constructor;
	}

	@Override
	public String toString() {
		List<String> parts = new ArrayList<>();
		slots.values().forEach(s -> parts.add(s.name() + ":" + s.kind()));
		return type.getSimpleName() + parts;
	}
}
