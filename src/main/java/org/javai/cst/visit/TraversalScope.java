package org.javai.cst.visit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.cst.nodes.CstNode;

/**
 * Per-traversal state: the ancestors of the node being visited and a map of
 * attributes hooks may use to pass information along. Created when a traversal
 * starts and discarded when it ends.
 */
public final class TraversalScope {

	private final Deque<CstNode> ancestors = new ArrayDeque<>();
	private final Map<String, Object> attributes = new HashMap<>();

	TraversalScope() {
	}

	void push(CstNode node) {
		ancestors.push(node);
	}

	void pop() {
		ancestors.pop();
	}

	/**
	 * The parent of the node being visited, or empty at the root.
	 * <p>
	 * Inside a leave hook the node itself has already been popped, so this is
	 * its parent as well.
	 */
	public Optional<CstNode> parent() {
		return Optional.ofNullable(ancestors.peek());
	}

	/**
	 * Ancestors from the root down to the parent.
	 */
	public List<CstNode> ancestors() {
		List<CstNode> path = new ArrayList<>(ancestors);
		Collections.reverse(path);
		return path;
	}

	public int depth() {
		return ancestors.size();
	}

	public void put(String key, Object value) {
		attributes.put(key, value);
	}

	@SuppressWarnings("unchecked")
	public <T> Optional<T> get(String key) {
		return Optional.ofNullable((T) attributes.get(key));
	}

	public Map<String, Object> attributes() {
		return attributes;
	}
}
