package edu.upf.taln.plwordnet.core.io;

import edu.upf.taln.plwordnet.core.PlWordnet;
import edu.upf.taln.plwordnet.core.structures.Language;
import edu.upf.taln.plwordnet.core.structures.RelationType;
import edu.upf.taln.plwordnet.core.views.LexicalUnitView;
import edu.upf.taln.plwordnet.core.views.SynsetView;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Drives the state machine with synthetic event lists, including self-closing events that the StAX source never emits.
 */
public class WordnetStateMachineTest
{
	private static final ParseEvent ROOT = ParseEvent.start("array-list", Map.of("owner", "PWr", "date", "2023", "version", "4.2"));

	private static PlWordnet run(ParseEvent... events) throws WordnetParseException
	{
		return new WordnetReader().read(new ListEventSource(events));
	}

	private static WordnetParseException.Type failure(ParseEvent... events)
	{
		try
		{
			run(events);
			fail("Expected load to fail");
			return null;
		}
		catch (WordnetParseException e)
		{
			return e.getType();
		}
	}

	@Test
	public void testSynsetMembersFromText() throws Exception
	{
		PlWordnet wn = run(ROOT,
				ParseEvent.empty("lexical-unit", Map.of("id", "1", "name", "kot", "pos", "noun")),
				ParseEvent.empty("lexical-unit", Map.of("id", "2", "name", "cat", "pos", "noun pwn")),
				ParseEvent.start("synset", Map.of("id", "100")),
				ParseEvent.text("1 2"),
				ParseEvent.end("synset"),
				ParseEvent.end("array-list"));

		SynsetView synset = wn.getSynset(100).orElseThrow();
		List<LexicalUnitView> members = synset.getLexicalUnits();
		assertEquals(2, members.size());
		assertEquals("kot", members.get(0).getName());
		assertEquals(Language.PL, members.get(0).getLanguage());
		assertEquals("cat", members.get(1).getName());
		assertEquals(Language.EN, members.get(1).getLanguage());
		assertEquals(Language.PL, synset.getLanguage());
		assertEquals("PWr", wn.getOwner());
		assertEquals("4.2", wn.getVersion());
	}

	@Test
	public void testWrappedAndDuplicateMembersKeepOrder() throws Exception
	{
		PlWordnet wn = run(ROOT,
				ParseEvent.start("synset", Map.of("id", "5")),
				ParseEvent.text("\n  "),
				ParseEvent.start("unit-id", Map.of()),
				ParseEvent.text("3"),
				ParseEvent.end("unit-id"),
				ParseEvent.text("\n  "),
				ParseEvent.start("unit-id", Map.of()),
				ParseEvent.text(" 1\n"),
				ParseEvent.end("unit-id"),
				ParseEvent.text("3"),
				ParseEvent.end("synset"));

		assertArrayEquals(new long[]{3, 1, 3}, wn.getSynsetsMap().get(5L).getLexicalUnitIds().toArray());
	}

	@Test
	public void testTextOutsideSynsetIgnored() throws Exception
	{
		PlWordnet wn = run(ROOT,
				ParseEvent.text("42"),
				ParseEvent.start("synset", Map.of("id", "5")),
				ParseEvent.end("synset"),
				ParseEvent.text("43"));

		assertTrue(wn.getSynsetsMap().get(5L).getLexicalUnitIds().isEmpty());
	}

	@Test
	public void testRelationTypeTests() throws Exception
	{
		PlWordnet wn = run(ROOT,
				ParseEvent.start("relationtypes", Map.of("id", "10", "name", "hiperonimia")),
				ParseEvent.empty("test", Map.of("text", "x jest y", "pos", "rzeczownik")),
				ParseEvent.empty("test", Map.of("text", "x to y")),
				ParseEvent.end("relationtypes"),
				ParseEvent.empty("relationtypes", Map.of("id", "11")));

		RelationType hyper = wn.getRelationTypesMap().get(10L);
		assertEquals(2, hyper.getTests().size());
		assertEquals("x jest y", hyper.getTests().get(0).getText());
		assertEquals("rzeczownik", hyper.getTests().get(0).getPos());
		assertEquals("", hyper.getTests().get(1).getPos());
		assertTrue(wn.getRelationTypesMap().get(11L).getTests().isEmpty());
	}

	@Test
	public void testTestAfterEmptyRelationTypeFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(ROOT,
				ParseEvent.empty("relationtypes", Map.of("id", "11")),
				ParseEvent.empty("test", Map.of("text", "x"))));
	}

	@Test
	public void testTestOutsideRelationTypeFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(ROOT,
				ParseEvent.start("synset", Map.of("id", "1")),
				ParseEvent.empty("test", Map.of("text", "x"))));
	}

	@Test
	public void testUnknownElementFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(ROOT,
				ParseEvent.empty("emotion", Map.of())));
	}

	@Test
	public void testElementBeforeRootFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(
				ParseEvent.empty("lexical-unit", Map.of("id", "1")),
				ROOT));
	}

	@Test
	public void testSecondRootFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(ROOT, ROOT));
	}

	@Test
	public void testNestedContainerFails()
	{
		assertEquals(WordnetParseException.Type.UnexpectedElement, failure(ROOT,
				ParseEvent.start("synset", Map.of("id", "1")),
				ParseEvent.start("relationtypes", Map.of("id", "2"))));
	}

	@Test
	public void testMissingRoot()
	{
		assertEquals(WordnetParseException.Type.MissingRoot, failure());
		assertEquals(WordnetParseException.Type.MissingRoot, failure(ParseEvent.text("  ")));
	}

	@Test
	public void testInvalidMemberIdFails()
	{
		try
		{
			run(ROOT, ParseEvent.start("synset", Map.of("id", "1")), ParseEvent.text("4 x5"));
			fail("Expected invalid member id");
		}
		catch (WordnetParseException e)
		{
			assertEquals(WordnetParseException.Type.InvalidAttributeValue, e.getType());
			assertEquals("synset", e.getTag());
			assertEquals("unit-id", e.getField());
			assertEquals("x5", e.getValue());
		}
	}

	@Test
	public void testStepTransitions() throws Exception
	{
		WordnetStateMachine machine = new WordnetStateMachine();
		ParsingContext context = ParsingContext.idle();
		assertFalse(machine.hasRoot());

		context = machine.step(context, ROOT);
		assertTrue(machine.hasRoot());
		assertTrue(context.isIdle());

		context = machine.step(context, ParseEvent.start("synset", Map.of("id", "7")));
		assertEquals(ParsingContext.Type.InsideSynset, context.getType());
		assertEquals(7, context.getId());

		context = machine.step(context, ParseEvent.end("unit-id"));
		assertEquals(ParsingContext.Type.InsideSynset, context.getType());

		context = machine.step(context, ParseEvent.end("synset"));
		assertTrue(context.isIdle());

		context = machine.step(context, ParseEvent.start("relationtypes", Map.of("id", "3")));
		assertEquals(ParsingContext.Type.InsideRelationType, context.getType());
		assertEquals(3, context.getId());

		context = machine.step(context, ParseEvent.end("relationtypes"));
		assertTrue(context.isIdle());

		PlWordnet wn = machine.finish(context);
		assertEquals(1, wn.getSynsetsMap().size());
		assertEquals(1, wn.getRelationTypesMap().size());
	}

	@Test
	public void testOpenContainerCommittedAtEnd() throws Exception
	{
		PlWordnet wn = run(ROOT, ParseEvent.start("synset", Map.of("id", "9")), ParseEvent.text("1"));
		assertArrayEquals(new long[]{1}, wn.getSynsetsMap().get(9L).getLexicalUnitIds().toArray());
	}

	@Test
	public void testDuplicateIdReplacesEarlierRecord() throws Exception
	{
		PlWordnet wn = run(ROOT,
				ParseEvent.empty("lexical-unit", Map.of("id", "1", "name", "a")),
				ParseEvent.empty("lexical-unit", Map.of("id", "2", "name", "b")),
				ParseEvent.empty("lexical-unit", Map.of("id", "1", "name", "c")));

		assertEquals(2, wn.getLexicalUnitsMap().size());
		assertEquals("c", wn.getLexicalUnit(1).orElseThrow().getName());
		assertEquals(List.of(1L, 2L), List.copyOf(wn.getLexicalUnitsMap().keySet()));
	}
}
