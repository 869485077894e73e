package works.enumnames.jackson;

import java.util.function.Predicate;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EnumNameSettings {
	/**
	 * Decides which enum classes {@link EnumNameModule} takes over.
	 * Enums it rejects, and <code>Optional</code>s of them,
	 * are left to Jackson's built-in handling.
	 * <p>
	 * The argument is always the declaring enum class, even for constants that have bodies.
	 * By default, every enum is accepted.
	 */
	@Default Predicate<Class<? extends Enum<?>>> enumFilter = ANY_ENUM;

	public static EnumNameSettings defaults() {
		return DEFAULTS;
	}

	private static final Predicate<Class<? extends Enum<?>>> ANY_ENUM = type -> true;
	private static final EnumNameSettings DEFAULTS = EnumNameSettings.builder().build();
}
