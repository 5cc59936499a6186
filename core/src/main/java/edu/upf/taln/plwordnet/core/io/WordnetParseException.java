package edu.upf.taln.plwordnet.core.io;

/**
 * Fatal failure while loading a wordnet document. A load that throws this never returns a partial graph.
 */
public class WordnetParseException extends Exception
{
	public enum Type {IO, MalformedXml, InvalidAttributeValue, MissingRoot, UnexpectedElement}

	private final Type type;
	private final String tag;
	private final String field;
	private final String value;
	private final String position;
	private final static long serialVersionUID = 1L;

	private WordnetParseException(Type type, String message, String tag, String field, String value,
	                              String position, Throwable cause)
	{
		super(message, cause);
		this.type = type;
		this.tag = tag;
		this.field = field;
		this.value = value;
		this.position = position;
	}

	public static WordnetParseException io(String source, Throwable cause)
	{
		return new WordnetParseException(Type.IO, "Cannot read " + source + ": " + cause.getMessage(),
				null, null, null, null, cause);
	}

	public static WordnetParseException malformedXml(String position, Throwable cause)
	{
		return new WordnetParseException(Type.MalformedXml, "Malformed XML at " + position + ": " + cause.getMessage(),
				null, null, null, position, cause);
	}

	public static WordnetParseException invalidAttributeValue(String tag, String field, String value, String position)
	{
		return new WordnetParseException(Type.InvalidAttributeValue,
				"Invalid value '" + value + "' for " + field + " in <" + tag + "> at " + position,
				tag, field, value, position, null);
	}

	public static WordnetParseException missingRoot()
	{
		return new WordnetParseException(Type.MissingRoot, "End of input reached without a root element",
				null, null, null, null, null);
	}

	public static WordnetParseException unexpectedElement(String tag, String position)
	{
		return new WordnetParseException(Type.UnexpectedElement, "Unexpected element <" + tag + "> at " + position,
				tag, null, null, position, null);
	}

	public Type getType() { return type; }
	public String getTag() { return tag; }
	public String getField() { return field; }
	public String getValue() { return value; }
	public String getPosition() { return position; }
}
