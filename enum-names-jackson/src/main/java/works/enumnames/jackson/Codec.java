package works.enumnames.jackson;

import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;

/**
 * Converts one Java type to and from a single JSON value.
 * Stateless once constructed, so a codec can be shared freely between threads and mappers.
 */
public sealed interface Codec<T> permits EnumCodec, OptionalEnumCodec {
	/**
	 * @return the enum whose names this codec reads and writes
	 */
	Class<? extends Enum<?>> enumType();

	ValueSerializer<T> serializer();
	ValueDeserializer<T> deserializer();
}
