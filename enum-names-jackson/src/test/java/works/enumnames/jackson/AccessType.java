package works.enumnames.jackson;

enum AccessType {
	Read,
	Write,
	Admin,
}
