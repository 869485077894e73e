package works.enumnames.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.jsontype.TypeDeserializer;
import tools.jackson.databind.jsontype.TypeSerializer;
import tools.jackson.databind.ser.Serializers;
import tools.jackson.databind.type.ReferenceType;
import works.enumnames.NameTableRegistry;

/**
 * Makes Jackson read and write enums, and <code>Optional</code>s of enums,
 * using the {@link Codec codecs} supplied by an {@link EnumCodecResolver}.
 *
 * <pre>
 * ObjectMapper mapper = JsonMapper.builder()
 *     .addModule(new EnumNameModule())
 *     .build();
 * </pre>
 *
 * Each module owns its own {@link NameTableRegistry} unless one is supplied.
 */
public class EnumNameModule extends JacksonModule {
	private final EnumCodecResolver resolver;

	public EnumNameModule() {
		this(EnumNameSettings.defaults());
	}

	public EnumNameModule(EnumNameSettings settings) {
		this(settings, new NameTableRegistry());
	}

	public EnumNameModule(EnumNameSettings settings, NameTableRegistry registry) {
		this.resolver = new EnumCodecResolver(registry, settings);
	}

	public EnumCodecResolver resolver() {
		return resolver;
	}

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new EnumNameSerializers());
		context.addDeserializers(new EnumNameDeserializers());
	}

	private final class EnumNameSerializers extends Serializers.Base {
		private final Map<JavaType, ValueSerializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			return memo.computeIfAbsent(type, this::getValueSerializer);
		}

		@Override
		public ValueSerializer<?> findReferenceSerializer(SerializationConfig config, ReferenceType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides, TypeSerializer contentTypeSerializer, ValueSerializer<Object> contentValueSerializer) {
			return findSerializer(config, type, beanDescRef, formatOverrides);
		}

		private ValueSerializer<?> getValueSerializer(JavaType type) {
			Codec<?> codec = resolver.resolve(type);
			return (codec == null) ? null : codec.serializer();
		}
	}

	private final class EnumNameDeserializers extends Deserializers.Base {
		private final Map<JavaType, ValueDeserializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueDeserializer<?> findEnumDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			return findDeserializer(type);
		}

		@Override
		public ValueDeserializer<?> findReferenceDeserializer(ReferenceType refType, DeserializationConfig config, BeanDescription.Supplier beanDescRef, TypeDeserializer contentTypeDeserializer, ValueDeserializer<?> contentDeserializer) {
			return findDeserializer(refType);
		}

		/**
		 * Enums and reference types normally arrive through the more specific methods above;
		 * this catches an <code>Optional</code> whose type was not constructed as a {@link ReferenceType}.
		 */
		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			return findDeserializer(type);
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return resolver.canHandle(config.constructType(valueType));
		}

		private ValueDeserializer<?> findDeserializer(JavaType type) {
			return memo.computeIfAbsent(type, this::getValueDeserializer);
		}

		private ValueDeserializer<?> getValueDeserializer(JavaType type) {
			Codec<?> codec = resolver.resolve(type);
			return (codec == null) ? null : codec.deserializer();
		}
	}
}
