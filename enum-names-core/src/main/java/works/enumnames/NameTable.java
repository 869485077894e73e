package works.enumnames;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Bidirectional lookup between the constants of one enum type and their names.
 * <p>
 * Names are exactly {@link Enum#name()}: case-sensitive, with no prefix, suffix,
 * or other transformation. A table only reports whether a name was found;
 * deciding what an unmatched name means is up to the caller.
 *
 * @param <E> the enum type
 */
public final class NameTable<E extends Enum<E>> {
	private final Class<E> enumType;
	private final List<E> members;
	private final Set<String> names;
	private final Map<String, E> membersByName;
	private final Map<E, String> namesByMember;

	private NameTable(Class<E> enumType, List<E> members, Set<String> names, Map<String, E> membersByName, Map<E, String> namesByMember) {
		this.enumType = enumType;
		this.members = members;
		this.names = names;
		this.membersByName = membersByName;
		this.namesByMember = namesByMember;
	}

	/**
	 * @throws IllegalArgumentException if <code>enumType</code> is not an enum class
	 */
	public static <E extends Enum<E>> NameTable<E> of(Class<E> enumType) {
		E[] constants = requireNonNull(enumType).getEnumConstants();
		if (constants == null) {
			throw new IllegalArgumentException("Not an enum class: " + enumType.getName());
		}
		Map<String, E> membersByName = new HashMap<>();
		Map<E, String> namesByMember = new EnumMap<>(enumType);
		Set<String> names = new LinkedHashSet<>();
		for (E constant : constants) {
			String name = constant.name();
			E previous = membersByName.put(name, constant);
			if (previous != null) {
				throw new IllegalArgumentException("Enum " + enumType.getSimpleName() + " has duplicate member name \"" + name + "\"");
			}
			if (namesByMember.put(constant, name) != null) {
				throw new IllegalArgumentException("Enum " + enumType.getSimpleName() + " has duplicate member " + constant);
			}
			names.add(name);
		}
		return new NameTable<>(
			enumType,
			List.of(constants),
			Collections.unmodifiableSet(names),
			Collections.unmodifiableMap(membersByName),
			Collections.unmodifiableMap(namesByMember));
	}

	public Class<E> enumType() {
		return enumType;
	}

	/**
	 * Exact match only. Names differing just in case do not match, and neither does the empty string.
	 */
	public Optional<E> memberNamed(String name) {
		return Optional.ofNullable(membersByName.get(requireNonNull(name)));
	}

	public String nameOf(E member) {
		String result = namesByMember.get(requireNonNull(member));
		assert result != null: "Every constant of " + enumType.getSimpleName() + " has a name";
		return result;
	}

	/**
	 * @return the members in declaration order
	 */
	public List<E> members() {
		return members;
	}

	/**
	 * @return the member names in declaration order
	 */
	public Set<String> names() {
		return names;
	}

	@Override
	public String toString() {
		return "NameTable(" + enumType.getSimpleName() + ")";
	}
}
