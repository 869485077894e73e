package works.enumnames;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Build-once cache of {@link NameTable}s keyed by enum class.
 * <p>
 * Each table is built the first time its enum is requested and the same instance
 * is returned to every caller afterward, including callers racing on that first request.
 * Entries are never evicted; a registry lives as long as whatever owns it.
 */
public final class NameTableRegistry {
	private final Map<Class<?>, NameTable<?>> tables = new ConcurrentHashMap<>();

	@SuppressWarnings("unchecked")
	public <E extends Enum<E>> NameTable<E> tableFor(Class<E> enumType) {
		return (NameTable<E>) tables.computeIfAbsent(requireNonNull(enumType), this::build);
	}

	/**
	 * Like {@link #tableFor} for a class known only at runtime.
	 * The class of an enum constant that has a body is accepted too,
	 * and resolves to the table of its declaring enum.
	 *
	 * @throws IllegalArgumentException if <code>type</code> is not an enum class
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	public NameTable<?> tableForClass(Class<?> type) {
		return tableFor((Class) declaringEnum(type));
	}

	/**
	 * @return the enum classes whose tables have been built so far
	 */
	public Set<Class<?>> knownTypes() {
		return Set.copyOf(tables.keySet());
	}

	/**
	 * @throws IllegalArgumentException if <code>type</code> is not an enum class
	 */
	public static Class<?> declaringEnum(Class<?> type) {
		if (type.isEnum()) {
			return type;
		} else if (isConstantBody(type)) {
			return type.getSuperclass();
		} else {
			throw new IllegalArgumentException("Not an enum class: " + type.getName());
		}
	}

	/**
	 * @return true if <code>type</code> is an enum, or the class of an enum constant that has a body.
	 * Note that {@link Enum Enum.class} itself is not an enum class.
	 */
	public static boolean isEnumClass(Class<?> type) {
		return type.isEnum() || isConstantBody(type);
	}

	private static boolean isConstantBody(Class<?> type) {
		Class<?> superclass = type.getSuperclass();
		return superclass != null && superclass.isEnum();
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private NameTable<?> build(Class<?> enumType) {
		NameTable<?> result = NameTable.of((Class) enumType);
		LOGGER.debug("Built {} with members {}", result, result.names());
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NameTableRegistry.class);
}
