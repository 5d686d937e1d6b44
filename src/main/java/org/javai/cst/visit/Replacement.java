package org.javai.cst.visit;

import java.util.List;
import org.javai.cst.nodes.CstNode;

/**
 * What a transformer's leave hook returns for a node: a node (the same one or a
 * replacement), a removal, or a list of nodes to splice into a sequence slot.
 * Every {@link CstNode} is a replacement for itself.
 */
public interface Replacement {

	/**
	 * Removes the node. Allowed in sequence slots and optional slots; an optional
	 * slot becomes empty.
	 */
	static Replacement remove() {
		return Removal.INSTANCE;
	}

	/**
	 * Splices zero or more nodes in place of the node. Allowed in sequence slots
	 * only.
	 */
	static Replacement flatten(List<? extends CstNode> nodes) {
		return new Flatten(List.copyOf(nodes));
	}

	enum Removal implements Replacement {
		INSTANCE
	}

	record Flatten(List<CstNode> nodes) implements Replacement {
		public Flatten {
			nodes = List.copyOf(nodes);
		}
	}
}
