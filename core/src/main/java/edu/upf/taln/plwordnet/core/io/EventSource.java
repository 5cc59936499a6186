package edu.upf.taln.plwordnet.core.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Pull-based sequence of parse events over one document. Once the end of input is reached every further call to
 * next() returns an Eof event.
 */
public interface EventSource extends Closeable
{
	ParseEvent next() throws WordnetParseException;

	@Override
	default void close() throws IOException { }
}
