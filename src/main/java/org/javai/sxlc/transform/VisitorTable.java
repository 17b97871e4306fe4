package org.javai.sxlc.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.sxlc.sxl.SxlNode;

/**
 * Maps source node kinds to the {@link NodeHandler} that {@link SxlTraverser} calls for them.
 * Kinds without a handler are still walked; nothing is called for them.
 *
 * <pre>{@code
 * VisitorTable table = VisitorTable.builder()
 *     .onEnter(SxlNode.CallExpression.class, (call, parent) -> names.add(call.name()))
 *     .onExit(SxlNode.Program.class, (program, parent) -> done())
 *     .build();
 * }</pre>
 */
public final class VisitorTable {

	private static final VisitorTable EMPTY = new VisitorTable(Map.of());

	private final Map<Class<? extends SxlNode>, NodeHandler<?>> handlers;

	private VisitorTable(Map<Class<? extends SxlNode>, NodeHandler<?>> handlers) {
		this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
	}

	public static VisitorTable empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the handler registered for exactly this node kind.
	 */
	@SuppressWarnings("unchecked")
	public <N extends SxlNode> Optional<NodeHandler<N>> handlerFor(Class<N> kind) {
		return Optional.ofNullable((NodeHandler<N>) handlers.get(kind));
	}

	public Set<Class<? extends SxlNode>> registeredKinds() {
		return handlers.keySet();
	}

	public static final class Builder {

		private final Map<Class<? extends SxlNode>, NodeHandler<?>> handlers = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * Registers both callbacks for a kind, replacing anything registered before.
		 */
		public <N extends SxlNode> Builder on(Class<N> kind, NodeCallback<N> enter, NodeCallback<N> exit) {
			Objects.requireNonNull(kind, "kind");
			handlers.put(kind, new NodeHandler<>(enter, exit));
			return this;
		}

		/**
		 * Sets the enter callback for a kind, keeping an exit callback registered earlier.
		 */
		public <N extends SxlNode> Builder onEnter(Class<N> kind, NodeCallback<N> enter) {
			return on(kind, enter, existing(kind).exit());
		}

		/**
		 * Sets the exit callback for a kind, keeping an enter callback registered earlier.
		 */
		public <N extends SxlNode> Builder onExit(Class<N> kind, NodeCallback<N> exit) {
			return on(kind, existing(kind).enter(), exit);
		}

		public VisitorTable build() {
			return new VisitorTable(handlers);
		}

		@SuppressWarnings("unchecked")
		private <N extends SxlNode> NodeHandler<N> existing(Class<N> kind) {
			NodeHandler<N> handler = (NodeHandler<N>) handlers.get(kind);
			return handler != null ? handler : new NodeHandler<>(null, null);
		}
	}
}
