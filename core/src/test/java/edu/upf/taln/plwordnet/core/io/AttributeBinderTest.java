package edu.upf.taln.plwordnet.core.io;

import edu.upf.taln.plwordnet.core.structures.LexicalUnit;
import edu.upf.taln.plwordnet.core.structures.RelationType;
import edu.upf.taln.plwordnet.core.structures.Synset;
import edu.upf.taln.plwordnet.core.structures.SynsetRelation;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class AttributeBinderTest
{
	@Test
	public void testAbsentAttributesTakeDefaults() throws Exception
	{
		LexicalUnit unit = ElementBindings.LEXICAL_UNIT.bind(ParseEvent.empty("lexical-unit", Map.of("id", "7"))).build();

		assertEquals(7, unit.getId());
		assertEquals("", unit.getName());
		assertEquals("", unit.getPos());
		assertEquals(0, unit.getTagCount());
		assertEquals(0, unit.getVariant());
		assertEquals("", unit.getDescription());
	}

	@Test
	public void testAllFieldsBound() throws Exception
	{
		RelationType type = ElementBindings.RELATION_TYPE.bind(ParseEvent.start("relationtypes", Map.of(
				"id", "10", "type", "relacja pomiędzy synsetami", "reverse", "11", "name", "hiperonimia",
				"description", "opis", "posstr", "rzeczownik", "display", "d", "shortcut", "hiper",
				"autoreverse", "true", "pwn", "@"))).build();

		assertEquals(10, type.getId());
		assertEquals("relacja pomiędzy synsetami", type.getType());
		assertEquals(11, type.getReverse());
		assertEquals("hiperonimia", type.getName());
		assertEquals("opis", type.getDescription());
		assertEquals("rzeczownik", type.getPosStr());
		assertEquals("d", type.getDisplay());
		assertEquals("hiper", type.getShortcut());
		assertTrue(type.isAutoReverse());
		assertEquals("@", type.getPwn());
		assertTrue(type.getTests().isEmpty());
	}

	@Test
	public void testBooleanIsTrueOnlyForLiteralTrue() throws Exception
	{
		Synset yes = ElementBindings.SYNSET.bind(ParseEvent.start("synset", Map.of("id", "1", "abstract", "true"))).build();
		Synset other = ElementBindings.SYNSET.bind(ParseEvent.start("synset", Map.of("id", "2", "abstract", "TRUE"))).build();
		Synset absent = ElementBindings.SYNSET.bind(ParseEvent.start("synset", Map.of("id", "3"))).build();

		assertTrue(yes.isAbstract());
		assertFalse(other.isAbstract());
		assertFalse(absent.isAbstract());
		assertTrue(absent.getLexicalUnitIds().isEmpty());
	}

	@Test
	public void testInvalidIntegerFails()
	{
		try
		{
			ElementBindings.LEXICAL_UNIT.bind(ParseEvent.empty("lexical-unit", Map.of("id", "1", "tagcount", "not-a-number")));
			fail("Expected invalid attribute value");
		}
		catch (WordnetParseException e)
		{
			assertEquals(WordnetParseException.Type.InvalidAttributeValue, e.getType());
			assertEquals("lexical-unit", e.getTag());
			assertEquals("tagcount", e.getField());
			assertEquals("not-a-number", e.getValue());
		}
	}

	@Test
	public void testNegativeIdFails()
	{
		try
		{
			ElementBindings.SYNSET_RELATION.bind(ParseEvent.empty("synsetrelations", Map.of("parent", "-3")));
			fail("Expected invalid attribute value");
		}
		catch (WordnetParseException e)
		{
			assertEquals(WordnetParseException.Type.InvalidAttributeValue, e.getType());
			assertEquals("parent", e.getField());
		}
	}

	@Test
	public void testRelationFields() throws Exception
	{
		SynsetRelation relation = ElementBindings.SYNSET_RELATION.bind(ParseEvent.empty("synsetrelations", Map.of(
				"parent", "100", "child", "999", "relation", "5", "valid", "true", "owner", "x"))).build();

		assertEquals(100, relation.getParent());
		assertEquals(999, relation.getChild());
		assertEquals(5, relation.getRelation());
		assertTrue(relation.isValid());
		assertEquals("x", relation.getOwner());
	}

	@Test
	public void testCustomTable() throws Exception
	{
		AttributeBinder<StringBuilder> binder = AttributeBinder.<StringBuilder>forElement("x", StringBuilder::new)
				.text("a", StringBuilder::append)
				.integer("b", StringBuilder::append)
				.build();

		assertEquals("x", binder.getTag());
		assertEquals("hello0", binder.bind(ParseEvent.empty("x", Map.of("a", "hello"))).toString());
		assertEquals("3", binder.bind(ParseEvent.empty("x", Map.of("b", "3"))).toString());
	}
}
