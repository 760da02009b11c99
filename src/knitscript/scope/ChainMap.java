package knitscript.scope;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A lexical scope layered over an enclosing one. Lookups fall through to the enclosing scope;
 * bindings and removals only touch this layer.
 *
 * A pattern call binds its parameters in a fresh layer over the pattern's captured environment,
 * which is how the captured environment stays untouched.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class ChainMap<K, V> extends AbstractMap<K, V> {
	private final Map<K, V> enclosing;
	private final Map<K, V> local = new HashMap<>();

	public ChainMap(Map<K, V> enclosing) {
		this.enclosing = enclosing;
	}

	@Override
	public V get(Object k) {
		return local.containsKey(k) ? local.get(k) : enclosing.get(k);
	}

	@Override
	public boolean containsKey(Object k) {
		return local.containsKey(k) || enclosing.containsKey(k);
	}

	@Override
	public V put(K k, V v) {
		return local.put(k, v);
	}

	@Override
	public V remove(Object k) {
		return local.remove(k);
	}

	@Override
	public void clear() {
		local.clear();
	}

	/**
	 * @return a snapshot of every visible binding, local ones shadowing the enclosing scope's
	 */
	@Override
	public Set<Entry<K, V>> entrySet() {
		Map<K, V> visible = new LinkedHashMap<>(enclosing);
		visible.putAll(local);
		return Collections.unmodifiableMap(visible).entrySet();
	}

}
