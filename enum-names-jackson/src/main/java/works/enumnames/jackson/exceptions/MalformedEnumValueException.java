package works.enumnames.jackson.exceptions;

import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.databind.exc.MismatchedInputException;

/**
 * The JSON token presented for an enum value was not of a kind the codec accepts,
 * such as a number where a string was expected.
 */
public class MalformedEnumValueException extends MismatchedInputException {
	public MalformedEnumValueException(JsonParser p, String message, Class<?> enumType) {
		super(p, message, enumType);
	}

	public static MalformedEnumValueException unexpectedToken(JsonParser p, JsonToken found, String expected, Class<?> enumType) {
		return new MalformedEnumValueException(p, "Expected " + expected + " for " + enumType.getSimpleName() + "; found " + found, enumType);
	}

	public static MalformedEnumValueException missing(JsonParser p, Class<?> enumType) {
		return new MalformedEnumValueException(p, "Missing required " + enumType.getSimpleName() + " value", enumType);
	}
}
