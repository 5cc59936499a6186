package edu.upf.taln.plwordnet.core.io;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * One event of an XML document: element start, self-closing element, character data, element end or end of input.
 * Attributes are looked up by exact name, null if absent. Events handed out by an {@link EventSource} may be
 * backed by the source and are only valid until the next call to {@link EventSource#next()}.
 */
public abstract class ParseEvent
{
	public enum Type {Start, Empty, Text, End, Eof}

	public abstract Type getType();

	// Element name, null for Text and Eof
	public abstract String getTag();

	// Character data of a Text event, null otherwise
	public abstract String getText();

	public abstract String getAttribute(String name);

	public abstract String getPosition();

	public static ParseEvent start(String tag, Map<String, String> attributes)
	{
		return new DetachedEvent(Type.Start, tag, null, attributes);
	}

	public static ParseEvent empty(String tag, Map<String, String> attributes)
	{
		return new DetachedEvent(Type.Empty, tag, null, attributes);
	}

	public static ParseEvent text(String text)
	{
		return new DetachedEvent(Type.Text, null, text, Map.of());
	}

	public static ParseEvent end(String tag)
	{
		return new DetachedEvent(Type.End, tag, null, Map.of());
	}

	public static ParseEvent eof()
	{
		return new DetachedEvent(Type.Eof, null, null, Map.of());
	}

	@Override
	public String toString()
	{
		switch (getType())
		{
			case Start:
				return "<" + getTag() + ">";
			case Empty:
				return "<" + getTag() + "/>";
			case End:
				return "</" + getTag() + ">";
			case Text:
				return "'" + getText() + "'";
			default:
				return "EOF";
		}
	}

	// Event not tied to any source
	private static final class DetachedEvent extends ParseEvent
	{
		private final Type type;
		private final String tag;
		private final String text;
		private final ImmutableMap<String, String> attributes;

		private DetachedEvent(Type type, String tag, String text, Map<String, String> attributes)
		{
			this.type = type;
			this.tag = tag;
			this.text = text;
			this.attributes = ImmutableMap.copyOf(attributes);
		}

		@Override public Type getType() { return type; }
		@Override public String getTag() { return tag; }
		@Override public String getText() { return text; }
		@Override public String getAttribute(String name) { return attributes.get(name); }
		@Override public String getPosition() { return "unknown position"; }
	}
}
