package works.enumnames.jackson;

import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.util.AccessPattern;
import works.enumnames.NameTable;
import works.enumnames.jackson.exceptions.MalformedEnumValueException;
import works.enumnames.jackson.exceptions.UnknownEnumMemberException;

import static java.util.Objects.requireNonNull;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Represents a required enum value as a JSON string holding the member's exact name.
 * <p>
 * Reading is strict: the only accepted token is a string, and it must match a member
 * name exactly. JSON null is rejected like any other non-string token.
 */
public final class EnumCodec<E extends Enum<E>> implements Codec<E> {
	private final NameTable<E> names;
	private final ValueSerializer<E> serializer;
	private final ValueDeserializer<E> deserializer;

	private EnumCodec(NameTable<E> names) {
		this.names = names;
		this.serializer = new ValueSerializer<>() {
			@Override
			public void serialize(E value, JsonGenerator gen, SerializationContext serializers) {
				gen.writeString(write(value));
			}

			@Override
			public Class<?> handledType() {
				return names.enumType();
			}
		};
		this.deserializer = new ValueDeserializer<>() {
			@Override
			public E deserialize(JsonParser p, DeserializationContext ctxt) {
				return read(p);
			}

			@Override
			public E getNullValue(DeserializationContext ctxt) {
				throw MalformedEnumValueException.unexpectedToken(ctxt.getParser(), VALUE_NULL, EXPECTED, names.enumType());
			}

			@Override
			public Object getAbsentValue(DeserializationContext ctxt) {
				throw MalformedEnumValueException.missing(ctxt.getParser(), names.enumType());
			}

			@Override
			public AccessPattern getNullAccessPattern() {
				// getNullValue throws, so its result must never be cached
				return AccessPattern.DYNAMIC;
			}

			@Override
			public Class<?> handledType() {
				return names.enumType();
			}

			@Override public boolean isCachable() { return true; }
		};
	}

	public static <E extends Enum<E>> EnumCodec<E> of(NameTable<E> names) {
		return new EnumCodec<>(requireNonNull(names));
	}

	@Override
	public Class<E> enumType() {
		return names.enumType();
	}

	public NameTable<E> names() {
		return names;
	}

	public String write(E member) {
		return names.nameOf(member);
	}

	/**
	 * @throws MalformedEnumValueException if the current token is not a string
	 * @throws UnknownEnumMemberException if the string is not exactly the name of a member
	 */
	public E read(JsonParser p) {
		if (p.currentToken() != VALUE_STRING) {
			throw MalformedEnumValueException.unexpectedToken(p, p.currentToken(), EXPECTED, names.enumType());
		}
		return readName(p.getString(), p);
	}

	/**
	 * @param p used only to report where a failure occurred
	 * @throws UnknownEnumMemberException if <code>name</code> is not exactly the name of a member
	 */
	E readName(String name, JsonParser p) {
		return names.memberNamed(name)
			.orElseThrow(() -> new UnknownEnumMemberException(p, name, names));
	}

	@Override
	public ValueSerializer<E> serializer() {
		return serializer;
	}

	@Override
	public ValueDeserializer<E> deserializer() {
		return deserializer;
	}

	@Override
	public String toString() {
		return "EnumCodec(" + names.enumType().getSimpleName() + ")";
	}

	private static final String EXPECTED = "a JSON string";
}
