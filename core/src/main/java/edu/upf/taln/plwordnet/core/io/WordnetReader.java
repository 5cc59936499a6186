package edu.upf.taln.plwordnet.core.io;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import edu.upf.taln.plwordnet.core.PlWordnet;
import edu.upf.taln.plwordnet.core.resources.WordnetProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a plWordNet XML document into an immutable {@link PlWordnet}. The document is streamed once, start to end.
 * Any failure aborts the load.
 */
public class WordnetReader
{
	public static final int DEFAULT_LOG_STEP = 100000;
	private final int log_step;
	private final static Logger log = LogManager.getLogger();

	public WordnetReader()
	{
		this(DEFAULT_LOG_STEP);
	}

	public WordnetReader(WordnetProperties properties)
	{
		this(properties.getLogStep());
	}

	public WordnetReader(int log_step)
	{
		Preconditions.checkArgument(log_step > 0, "Logging step must be positive: %s", log_step);
		this.log_step = log_step;
	}

	public PlWordnet read(Path file) throws WordnetParseException
	{
		Preconditions.checkNotNull(file);
		log.info("Reading wordnet from " + file);
		try (InputStream input = new BufferedInputStream(Files.newInputStream(file)))
		{
			return read(input);
		}
		catch (IOException e)
		{
			throw WordnetParseException.io(file.toString(), e);
		}
	}

	public PlWordnet read(InputStream input) throws WordnetParseException
	{
		Preconditions.checkNotNull(input);
		try (StaxEventSource source = new StaxEventSource(input))
		{
			return read(source);
		}
		catch (IOException e)
		{
			throw WordnetParseException.io("XML stream", e);
		}
	}

	public PlWordnet read(EventSource source) throws WordnetParseException
	{
		final Stopwatch timer = Stopwatch.createStarted();
		final WordnetStateMachine machine = new WordnetStateMachine();
		ParsingContext context = ParsingContext.idle();
		long num_elements = 0;

		for (ParseEvent event = source.next(); event.getType() != ParseEvent.Type.Eof; event = source.next())
		{
			final ParseEvent.Type type = event.getType();
			context = machine.step(context, event);
			if ((type == ParseEvent.Type.Start || type == ParseEvent.Type.Empty) && ++num_elements % log_step == 0)
				log.info(num_elements + " elements parsed");
		}

		final PlWordnet wordnet = machine.finish(context);
		log.info("Wordnet loaded in " + timer.stop() + ": " + wordnet.getMetadata().toSummary());
		return wordnet;
	}
}
