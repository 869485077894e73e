/**
 * Exceptions thrown while reading enum values by name.
 * <p>
 * Both extend Jackson's {@link tools.jackson.databind.exc.MismatchedInputException MismatchedInputException},
 * so they reach the caller of {@link tools.jackson.databind.ObjectMapper ObjectMapper}
 * unchanged, with the path to the offending property attached.
 */
package works.enumnames.jackson.exceptions;
