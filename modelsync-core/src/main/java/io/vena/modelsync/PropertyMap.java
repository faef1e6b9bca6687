package io.vena.modelsync;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.pcollections.OrderedPMap;

import static java.util.Collections.emptyMap;
import static java.util.Objects.requireNonNull;

/**
 * An immutable, insertion-ordered {@link Map} of property names to values.
 *
 * <p>
 * Used for the top-level fields of a {@link Payload}, for property groups
 * nested within a payload, and for read-only snapshots of a {@link Session}
 * handed out by {@link Model#bestSession()}.
 *
 * <p>
 * Values are never null. An absent property is simply absent.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class PropertyMap<V> implements Map<String, V> {
	private final OrderedPMap<String, V> contents;

	@SuppressWarnings("unchecked")
	public static <VV> PropertyMap<VV> empty() {
		return EMPTY;
	}

	public static <VV> PropertyMap<VV> singleton(String key, VV value) {
		return new PropertyMap<>(OrderedPMap.singleton(requireNonNull(key), requireNonNull(value)));
	}

	/**
	 * @throws NullPointerException if any key or value is null
	 */
	public static <VV> PropertyMap<VV> fromOrderedMap(Map<String, ? extends VV> entries) {
		OrderedPMap<String, VV> result = OrderedPMap.empty();
		for (Entry<String, ? extends VV> entry: entries.entrySet()) {
			result = result.plus(requireNonNull(entry.getKey()), requireNonNull(entry.getValue(), entry.getKey()));
		}
		return new PropertyMap<>(result);
	}

	public PropertyMap<V> with(String name, V value) {
		if (get(requireNonNull(name)) == requireNonNull(value)) {
			return this;
		} else {
			return new PropertyMap<>(contents.plus(name, value));
		}
	}

	public PropertyMap<V> without(String name) {
		if (containsKey(name)) {
			return new PropertyMap<>(contents.minus(name));
		} else {
			return this;
		}
	}

	@Override
	public String toString() {
		return contents.toString();
	}

	@SuppressWarnings("rawtypes")
	private static final PropertyMap EMPTY = fromOrderedMap(emptyMap());

	///////////////////////
	//
	//  Delegated
	//

	@Override public int size() { return contents.size(); }
	@Override public boolean isEmpty() { return contents.isEmpty(); }
	@Override public boolean containsKey(Object key) { return contents.containsKey(key); }
	@Override public boolean containsValue(Object value) { return contents.containsValue(value); }
	@Override public V get(Object key) { return contents.get(key); }
	@Override public Set<String> keySet() { return contents.keySet(); }
	@Override public Collection<V> values() { return contents.values(); }
	@Override public Set<Entry<String, V>> entrySet() { return contents.entrySet(); }

	@Override public V put(String key, V value) { throw new UnsupportedOperationException(); }
	@Override public V remove(Object key) { throw new UnsupportedOperationException(); }
	@Override public void putAll(Map<? extends String, ? extends V> m) { throw new UnsupportedOperationException(); }
	@Override public void clear() { throw new UnsupportedOperationException(); }

	@Override public void replaceAll(BiFunction<? super String, ? super V, ? extends V> function) { throw new UnsupportedOperationException(); }
	@Override public V putIfAbsent(String key, V value) { throw new UnsupportedOperationException(); }
	@Override public boolean remove(Object key, Object value) { throw new UnsupportedOperationException(); }
	@Override public boolean replace(String key, V oldValue, V newValue) { throw new UnsupportedOperationException(); }
	@Override public V replace(String key, V value) { throw new UnsupportedOperationException(); }
	@Override public V computeIfAbsent(String key, Function<? super String, ? extends V> mappingFunction) { throw new UnsupportedOperationException(); }
	@Override public V computeIfPresent(String key, BiFunction<? super String, ? super V, ? extends V> remappingFunction) { throw new UnsupportedOperationException(); }
	@Override public V compute(String key, BiFunction<? super String, ? super V, ? extends V> remappingFunction) { throw new UnsupportedOperationException(); }
	@Override public V merge(String key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) { throw new UnsupportedOperationException(); }
}
