package org.javai.exprcheck.poly;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.exprcheck.ast.CanonicalRenderer;
import org.javai.exprcheck.ast.Expression;

/**
 * Interning table for atomic expressions, keyed by canonical string.
 *
 * Interned atoms live for one normalization run: {@link #reset()} drops them.
 * The counter that labels atoms only grows for the life of the table and is
 * never reset, so labels are not reused across runs. Not thread-safe.
 */
public final class AtomTable {

	private final Map<String, AtomicExpression> atoms = new LinkedHashMap<>();
	private long nextId = 0;

	/**
	 * Returns the atom for the given subtree, creating it on first sight of its
	 * canonical string.
	 */
	public AtomicExpression atomFor(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");
		String canonical = CanonicalRenderer.render(expression);
		return atoms.computeIfAbsent(canonical, key -> new AtomicExpression(expression, key, nextId++));
	}

	/**
	 * Forgets every interned atom. The label counter keeps its value.
	 */
	public void reset() {
		atoms.clear();
	}

	public Collection<AtomicExpression> atoms() {
		return Collections.unmodifiableCollection(atoms.values());
	}

	public int size() {
		return atoms.size();
	}

	/**
	 * The label the next new atom will receive.
	 */
	public long nextId() {
		return nextId;
	}
}
