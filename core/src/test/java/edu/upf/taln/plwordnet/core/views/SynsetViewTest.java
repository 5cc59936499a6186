package edu.upf.taln.plwordnet.core.views;

import edu.upf.taln.plwordnet.core.structures.Language;
import edu.upf.taln.plwordnet.core.structures.LexicalUnit;
import edu.upf.taln.plwordnet.core.structures.RelationType;
import edu.upf.taln.plwordnet.core.structures.Synset;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SynsetViewTest
{
	private static LexicalUnitView unit(long id, String name, String pos)
	{
		return new LexicalUnitView(new LexicalUnit.Builder().id(id).name(name).pos(pos).build());
	}

	private static Synset synset(long id)
	{
		return new Synset.Builder().id(id).build();
	}

	@Test
	public void testLanguageOfEmptySynsetIsPolish()
	{
		assertEquals(Language.PL, new SynsetView(synset(1), List.of()).getLanguage());
	}

	@Test
	public void testLanguageFollowsFirstMember()
	{
		SynsetView en_first = new SynsetView(synset(1), List.of(unit(1, "cat", "noun pwn"), unit(2, "kot", "noun")));
		SynsetView pl_first = new SynsetView(synset(2), List.of(unit(2, "kot", "noun"), unit(1, "cat", "noun pwn")));

		assertEquals(Language.EN, en_first.getLanguage());
		assertEquals(Language.PL, pl_first.getLanguage());
	}

	@Test
	public void testSimpleRendering()
	{
		SynsetView view = new SynsetView(synset(1), List.of(unit(1, "kot", "noun"), unit(3, "kocur", "noun")));
		assertEquals("kot,kocur", view.toSimple());
		assertEquals("", new SynsetView(synset(2), List.of()).toSimple());
	}

	@Test
	public void testViewLanguageMatchesStoredLanguage()
	{
		LexicalUnit stored = new LexicalUnit.Builder().id(5).pos("przymiotnik pwn").build();
		assertEquals(stored.getLanguage(), new LexicalUnitView(stored).getLanguage());

		LexicalUnit suffix_only = new LexicalUnit.Builder().id(6).pos("pwn").build();
		assertEquals(Language.PL, new LexicalUnitView(suffix_only).getLanguage());
	}

	@Test
	public void testRelationViewOptionalEndpoints()
	{
		RelationTypeView type = new RelationTypeView(new RelationType.Builder().id(5).name("hiponimia").build());
		SynsetView parent = new SynsetView(synset(100), List.of());
		SynsetRelationView view = new SynsetRelationView(parent, null, type, true, "x");

		assertEquals(parent, view.getParent().orElseThrow());
		assertFalse(view.getChild().isPresent());
		assertEquals(5, view.getRelation().orElseThrow().getId());
		assertTrue(view.isValid());
		assertEquals("x", view.getOwner());
	}
}
