package org.javai.cst.codegen;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes where each node of a module lands in the module's generated source.
 * <p>
 * Ranges include the whitespace a node owns. Nodes are keyed by identity; a
 * node instance used in more than one place maps to its last occurrence.
 */
public final class PositionCalculator {

	private static final Logger logger = LoggerFactory.getLogger(PositionCalculator.class);

	private PositionCalculator() {
	}

	/**
	 * Maps every node of {@code module} to its range in {@code module.code()}.
	 * Parsed trees reuse the shared constants {@link org.javai.cst.nodes.Newline#DEFAULT}
	 * and {@link org.javai.cst.nodes.SimpleWhitespace#SPACE} wherever the source has
	 * the default line break or a single space, so the range of such a constant is
	 * that of its last use. Look up the enclosing node instead.
	 */
	public static Map<CstNode, CodeRange> compute(Module module) {
		Objects.requireNonNull(module, "module must not be null");
		CodegenState state = new CodegenState(module.defaultIndent(), module.defaultNewline(), true);
		state.emit(module);
		Map<CstNode, CodeRange> positions = state.positions();
		logger.debug("Computed positions for {} nodes", positions.size());
		return Collections.unmodifiableMap(positions);
	}
}
