package edu.upf.taln.plwordnet.core.io;

import com.google.common.base.Throwables;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Event source backed by a StAX stream reader.
 * StAX reports self-closing elements as a start immediately followed by an end, so this source never emits
 * {@link ParseEvent.Type#Empty} events. A single event object is reused for the whole document and reads its tag,
 * text and attributes straight from the reader, so nothing is decoded unless the consumer asks for it.
 */
public class StaxEventSource implements EventSource
{
	private final static XMLInputFactory factory = createFactory();
	private final XMLStreamReader reader;
	private final StreamEvent event = new StreamEvent();
	private boolean finished = false;

	public StaxEventSource(InputStream input) throws WordnetParseException
	{
		try
		{
			reader = factory.createXMLStreamReader(input);
		}
		catch (XMLStreamException e)
		{
			throw translate(e);
		}
	}

	@Override
	public ParseEvent next() throws WordnetParseException
	{
		if (finished)
			return event.as(ParseEvent.Type.Eof);

		try
		{
			while (reader.hasNext())
			{
				switch (reader.next())
				{
					case XMLStreamConstants.START_ELEMENT:
						return event.as(ParseEvent.Type.Start);
					case XMLStreamConstants.END_ELEMENT:
						return event.as(ParseEvent.Type.End);
					case XMLStreamConstants.CHARACTERS:
					case XMLStreamConstants.CDATA:
					case XMLStreamConstants.SPACE:
						return event.as(ParseEvent.Type.Text);
					case XMLStreamConstants.END_DOCUMENT:
						finished = true;
						return event.as(ParseEvent.Type.Eof);
					default:
						// comments, processing instructions, DTD
						break;
				}
			}
		}
		catch (XMLStreamException e)
		{
			throw translate(e);
		}

		finished = true;
		return event.as(ParseEvent.Type.Eof);
	}

	@Override
	public void close() throws IOException
	{
		try
		{
			reader.close();
		}
		catch (XMLStreamException e)
		{
			throw new IOException("Failed to close XML reader", e);
		}
	}

	private static XMLInputFactory createFactory()
	{
		XMLInputFactory f = XMLInputFactory.newFactory();
		f.setProperty(XMLInputFactory.SUPPORT_DTD, false);
		f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
		f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
		f.setProperty(XMLInputFactory.IS_COALESCING, true);
		return f;
	}

	/**
	 * StAX wraps failures of the underlying stream in the same exception it uses for syntax errors. A read failure
	 * is reported as an I/O error, anything else as malformed XML.
	 */
	private static WordnetParseException translate(XMLStreamException e)
	{
		final List<Throwable> chain = new ArrayList<>(Throwables.getCausalChain(e));
		if (e.getNestedException() != null)
			chain.addAll(Throwables.getCausalChain(e.getNestedException()));

		for (Throwable t : chain)
		{
			if (t instanceof IOException)
				return WordnetParseException.io("XML stream at " + describe(e.getLocation()), t);
		}
		return WordnetParseException.malformedXml(describe(e.getLocation()), e);
	}

	private static String describe(Location location)
	{
		if (location == null)
			return "unknown position";
		return "line " + location.getLineNumber() + ", column " + location.getColumnNumber() +
				" (offset " + location.getCharacterOffset() + ")";
	}

	private final class StreamEvent extends ParseEvent
	{
		private Type type = Type.Eof;

		private StreamEvent as(Type type)
		{
			this.type = type;
			return this;
		}

		@Override
		public Type getType() { return type; }

		@Override
		public String getTag()
		{
			return type == Type.Start || type == Type.End ? reader.getLocalName() : null;
		}

		@Override
		public String getText()
		{
			return type == Type.Text ? reader.getText() : null;
		}

		@Override
		public String getAttribute(String name)
		{
			return type == Type.Start ? reader.getAttributeValue(null, name) : null;
		}

		@Override
		public String getPosition()
		{
			return type == Type.Eof ? "end of input" : describe(reader.getLocation());
		}
	}
}
