package edu.upf.taln.plwordnet.core.resources;

import edu.upf.taln.plwordnet.core.io.WordnetReader;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class WordnetPropertiesTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String contents) throws Exception
	{
		File file = folder.newFile();
		Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
		return file.toPath();
	}

	@Test
	public void testValues() throws Exception
	{
		File wordnet = folder.newFile("plwordnet.xml");
		WordnetProperties properties = new WordnetProperties(write(
				"wn.file=" + wordnet.getAbsolutePath().replace('\\', '/') + "\nwn.log.step=500\n"));

		assertEquals(wordnet.toPath(), properties.getWordnetPath());
		assertEquals(500, properties.getLogStep());
	}

	@Test
	public void testDefaults() throws Exception
	{
		WordnetProperties properties = new WordnetProperties(write("# nothing set\n"));
		assertNull(properties.getWordnetPath());
		assertEquals(WordnetReader.DEFAULT_LOG_STEP, properties.getLogStep());
	}

	@Test
	public void testUnreadableFileFallsBackToDefaults()
	{
		WordnetProperties properties = new WordnetProperties(folder.getRoot().toPath().resolve("missing.properties"));
		assertNull(properties.getWordnetPath());
		assertEquals(WordnetReader.DEFAULT_LOG_STEP, properties.getLogStep());
	}

	@Test(expected = RuntimeException.class)
	public void testMissingWordnetFile() throws Exception
	{
		new WordnetProperties(write("wn.file=" + folder.getRoot().getAbsolutePath().replace('\\', '/') + "/none.xml\n"));
	}

	@Test(expected = RuntimeException.class)
	public void testInvalidLogStep() throws Exception
	{
		new WordnetProperties(write("wn.log.step=-1\n"));
	}
}
