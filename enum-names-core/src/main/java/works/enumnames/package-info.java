/**
 * Serializer-independent support for converting enum constants to and from their names.
 * <p>
 * A {@link works.enumnames.NameTable} holds the name lookup for one enum type,
 * and a {@link works.enumnames.NameTableRegistry} builds each table once and shares it.
 */
package works.enumnames;
