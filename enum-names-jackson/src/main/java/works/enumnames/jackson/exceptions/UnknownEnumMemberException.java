package works.enumnames.jackson.exceptions;

import java.util.Set;
import tools.jackson.core.JsonParser;
import tools.jackson.databind.exc.InvalidFormatException;
import works.enumnames.NameTable;

/**
 * A JSON string did not exactly match the name of any member of the target enum.
 * The offending string is available from {@link #getValue()}.
 */
public class UnknownEnumMemberException extends InvalidFormatException {
	private final Set<String> expectedNames;

	public UnknownEnumMemberException(JsonParser p, String name, NameTable<?> names) {
		super(p,
			"Unknown " + names.enumType().getSimpleName() + " member \"" + name + "\"; expected one of " + names.names(),
			name,
			names.enumType());
		this.expectedNames = names.names();
	}

	public Set<String> expectedNames() {
		return expectedNames;
	}
}
