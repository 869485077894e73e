package works.enumnames.jackson;

import java.util.Optional;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import works.enumnames.jackson.exceptions.MalformedEnumValueException;
import works.enumnames.jackson.exceptions.UnknownEnumMemberException;

import static java.util.Objects.requireNonNull;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Represents an <code>Optional</code> enum value as either the member's name or JSON null.
 * <p>
 * When reading, the empty string also means {@link Optional#empty() absent},
 * since some producers send <code>""</code> instead of null or omitting the field.
 * Only the exact empty string counts; whitespace is an ordinary unknown name.
 * The empty string is never written.
 */
public final class OptionalEnumCodec<E extends Enum<E>> implements Codec<Optional<E>> {
	private final EnumCodec<E> enumCodec;
	private final ValueSerializer<Optional<E>> serializer;
	private final ValueDeserializer<Optional<E>> deserializer;

	private OptionalEnumCodec(EnumCodec<E> enumCodec) {
		this.enumCodec = enumCodec;
		this.serializer = new ValueSerializer<>() {
			@Override
			public void serialize(Optional<E> value, JsonGenerator gen, SerializationContext serializers) {
				write(value, gen);
			}

			@Override
			public boolean isEmpty(SerializationContext provider, Optional<E> value) {
				return value == null || value.isEmpty();
			}

			@Override
			public Class<?> handledType() {
				return Optional.class;
			}
		};
		this.deserializer = new ValueDeserializer<>() {
			@Override
			public Optional<E> deserialize(JsonParser p, DeserializationContext ctxt) {
				return read(p);
			}

			@Override
			public Optional<E> getNullValue(DeserializationContext ctxt) {
				return Optional.empty();
			}

			@Override
			public Object getAbsentValue(DeserializationContext ctxt) {
				return Optional.empty();
			}

			@Override
			public Class<?> handledType() {
				return Optional.class;
			}

			@Override public boolean isCachable() { return true; }
		};
	}

	public static <E extends Enum<E>> OptionalEnumCodec<E> of(EnumCodec<E> enumCodec) {
		return new OptionalEnumCodec<>(requireNonNull(enumCodec));
	}

	@Override
	public Class<E> enumType() {
		return enumCodec.enumType();
	}

	public EnumCodec<E> enumCodec() {
		return enumCodec;
	}

	public void write(Optional<E> value, JsonGenerator gen) {
		if (value == null || value.isEmpty()) {
			gen.writeNull();
		} else {
			gen.writeString(enumCodec.write(value.get()));
		}
	}

	/**
	 * @throws MalformedEnumValueException if the current token is neither a string nor null
	 * @throws UnknownEnumMemberException if the string is non-empty and not exactly the name of a member
	 */
	public Optional<E> read(JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == VALUE_NULL) {
			return Optional.empty();
		} else if (token == VALUE_STRING) {
			String name = p.getString();
			if (name.isEmpty()) {
				return Optional.empty();
			} else {
				return Optional.of(enumCodec.readName(name, p));
			}
		} else {
			throw MalformedEnumValueException.unexpectedToken(p, token, "a JSON string or null", enumType());
		}
	}

	@Override
	public ValueSerializer<Optional<E>> serializer() {
		return serializer;
	}

	@Override
	public ValueDeserializer<Optional<E>> deserializer() {
		return deserializer;
	}

	@Override
	public String toString() {
		return "OptionalEnumCodec(" + enumType().getSimpleName() + ")";
	}
}
