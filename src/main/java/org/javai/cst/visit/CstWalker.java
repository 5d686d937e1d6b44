package org.javai.cst.visit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.NodeSchema;
import org.javai.cst.nodes.ShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first, source-order traversal of a tree.
 * <p>
 * {@link #visit} only observes. {@link #transform} rebuilds the tree bottom-up
 * from what the leave hooks return; a parent is rebuilt only when one of its
 * children changed identity, so untouched subtrees are shared with the input.
 */
public final class CstWalker {

	private static final Logger logger = LoggerFactory.getLogger(CstWalker.class);

	private CstWalker() {
	}

	public static <T extends CstNode> T visit(T root, CstVisitor visitor) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(visitor, "visitor must not be null");
		TraversalScope scope = visitor.begin();
		try {
			walk(root, visitor, scope);
		}
		finally {
			visitor.end();
		}
		return root;
	}

	/**
	 * Runs {@code transformer} over the tree and returns the new root.
	 *
	 * @throws ShapeException if the root is removed or flattened, or a
	 * replacement does not fit its slot
	 */
	public static CstNode transform(CstNode root, CstTransformer transformer) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(transformer, "transformer must not be null");
		TraversalScope scope = transformer.begin();
		try {
			Replacement result = rewrite(root, transformer, scope);
			if (!(result instanceof CstNode node)) {
				throw new ShapeException("The root " + root.getClass().getSimpleName() + " cannot be removed or flattened");
			}
			logger.debug("Transformed {} with {}; root {}", root.getClass().getSimpleName(),
					transformer.getClass().getSimpleName(), node == root ? "unchanged" : "replaced");
			return node;
		}
		finally {
			transformer.end();
		}
	}

	private static void walk(CstNode node, CstVisitor visitor, TraversalScope scope) {
		if (visitor.onVisit(node)) {
			scope.push(node);
			try {
				for (CstNode child : node.children()) {
					walk(child, visitor, scope);
				}
			}
			finally {
				scope.pop();
			}
		}
		visitor.onLeave(node);
	}

	private static Replacement rewrite(CstNode node, CstTransformer transformer, TraversalScope scope) {
		CstNode updated = node;
		if (transformer.onVisit(node)) {
			scope.push(node);
			try {
				updated = rewriteChildren(node, transformer, scope);
			}
			finally {
				scope.pop();
			}
		}
		Replacement result = transformer.onLeave(node, updated);
		return Objects.requireNonNull(result, () -> "Leave hook for " + node.getClass().getSimpleName() + " returned null");
	}

	private static CstNode rewriteChildren(CstNode node, CstTransformer transformer, TraversalScope scope) {
		Map<String, Object> changes = new LinkedHashMap<>();
		for (NodeSchema.Slot slot : CstNodes.schema(node).slots()) {
			if (!slot.holdsChildren()) {
				continue;
			}
			Object value = CstNodes.slotValue(node, slot.name());
			switch (slot.kind()) {
				case REQUIRED -> {
					CstNode child = (CstNode) value;
					Replacement result = rewrite(child, transformer, scope);
					if (!(result instanceof CstNode replacement)) {
						throw new ShapeException(describe(node, slot) + " is required and cannot be "
								+ (result instanceof Replacement.Flatten ? "flattened" : "removed"));
					}
					if (replacement != child) {
						changes.put(slot.name(), replacement);
					}
				}
				case OPTIONAL -> {
					if (value == null) {
						continue;
					}
					CstNode child = (CstNode) value;
					Replacement result = rewrite(child, transformer, scope);
					if (result instanceof Replacement.Flatten) {
						throw new ShapeException(describe(node, slot) + " holds a single child and cannot be flattened");
					}
					if (result == Replacement.Removal.INSTANCE) {
						changes.put(slot.name(), null);
					}
					else if (result != child) {
						changes.put(slot.name(), result);
					}
				}
				case SEQUENCE -> {
					List<?> items = (List<?>) value;
					List<CstNode> rewritten = new ArrayList<>(items.size());
					boolean changed = false;
					for (Object item : items) {
						CstNode child = (CstNode) item;
						Replacement result = rewrite(child, transformer, scope);
						if (result == Replacement.Removal.INSTANCE) {
							changed = true;
						}
						else if (result instanceof Replacement.Flatten flatten) {
							rewritten.addAll(flatten.nodes());
							changed = true;
						}
						else {
							CstNode replacement = (CstNode) result;
							rewritten.add(replacement);
							changed |= replacement != child;
						}
					}
					if (changed) {
						changes.put(slot.name(), rewritten);
					}
				}
				default -> throw new IllegalStateException("Unexpected slot kind " + slot.kind());
			}
		}
		return changes.isEmpty() ? node : CstNodes.withChanges(node, changes);
	}

	private static String describe(CstNode node, NodeSchema.Slot slot) {
		return node.getClass().getSimpleName() + "." + slot.name();
	}
}
