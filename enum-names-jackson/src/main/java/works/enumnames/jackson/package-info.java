/**
 * Jackson integration that writes enum constants as their exact names.
 * <p>
 * Register {@link works.enumnames.jackson.EnumNameModule} with a mapper to have every
 * enum, and every <code>Optional</code> of an enum, handled by the codecs in this package.
 * An empty <code>Optional</code> is written as JSON null, and is read from either null or
 * the empty string.
 */
package works.enumnames.jackson;
