package works.enumnames.jackson;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JavaType;
import works.enumnames.NameTableRegistry;

import static java.util.Objects.requireNonNull;
import static works.enumnames.NameTableRegistry.declaringEnum;
import static works.enumnames.NameTableRegistry.isEnumClass;

/**
 * Decides, from a declared type alone, whether it is an enum or an <code>Optional</code> of an enum,
 * and supplies the corresponding {@link Codec}.
 */
public final class EnumCodecResolver {
	private final NameTableRegistry registry;
	private final EnumNameSettings settings;

	public EnumCodecResolver(NameTableRegistry registry, EnumNameSettings settings) {
		this.registry = requireNonNull(registry);
		this.settings = requireNonNull(settings);
	}

	public boolean canHandle(JavaType type) {
		Class<?> theClass = type.getRawClass();
		if (isHandledEnum(theClass)) {
			return true;
		} else {
			JavaType contents = optionalContents(type);
			return contents != null && isHandledEnum(contents.getRawClass());
		}
	}

	/**
	 * @return an {@link EnumCodec} for an enum type, an {@link OptionalEnumCodec} for
	 * an <code>Optional</code> of an enum type, or null if this resolver doesn't handle <code>type</code>.
	 */
	public Codec<?> resolve(JavaType type) {
		Class<?> theClass = type.getRawClass();
		Codec<?> result;
		if (isHandledEnum(theClass)) {
			result = enumCodec(theClass);
		} else {
			JavaType contents = optionalContents(type);
			if (contents != null && isHandledEnum(contents.getRawClass())) {
				result = OptionalEnumCodec.of(enumCodec(contents.getRawClass()));
			} else {
				return null;
			}
		}
		LOGGER.debug("Resolved {} for {}", result, type);
		return result;
	}

	public NameTableRegistry registry() {
		return registry;
	}

	private boolean isHandledEnum(Class<?> theClass) {
		return isEnumClass(theClass) && settings.enumFilter().test(enumClass(theClass));
	}

	@SuppressWarnings("unchecked")
	private static Class<? extends Enum<?>> enumClass(Class<?> theClass) {
		return (Class<? extends Enum<?>>) declaringEnum(theClass);
	}

	private EnumCodec<?> enumCodec(Class<?> theClass) {
		return EnumCodec.of(registry.tableForClass(theClass));
	}

	/**
	 * @return the type parameter of <code>Optional</code>, or null if <code>type</code> is not an <code>Optional</code>
	 */
	private static JavaType optionalContents(JavaType type) {
		if (type.getRawClass() != Optional.class) {
			return null;
		}
		JavaType[] parameters = type.findTypeParameters(Optional.class);
		if (parameters.length == 1) {
			return parameters[0];
		} else {
			return null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EnumCodecResolver.class);
}
