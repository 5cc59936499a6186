package edu.upf.taln.plwordnet.core.views;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.plwordnet.core.structures.Language;
import edu.upf.taln.plwordnet.core.structures.Synset;

import java.util.List;
import java.util.Objects;

import static java.util.stream.Collectors.joining;

/**
 * Synset projection holding the views of its resolved members.
 * Member ids that do not resolve to a lexical unit are left out.
 */
public final class SynsetView
{
	private final Synset synset;
	private final ImmutableList<LexicalUnitView> lexical_units;

	public SynsetView(Synset synset, List<LexicalUnitView> lexical_units)
	{
		this.synset = synset;
		this.lexical_units = ImmutableList.copyOf(lexical_units);
	}

	public long getId() { return synset.getId(); }
	public String getWorkstate() { return synset.getWorkstate(); }
	public int getSplit() { return synset.getSplit(); }
	public String getOwner() { return synset.getOwner(); }
	public String getDefinition() { return synset.getDefinition(); }
	public String getDescription() { return synset.getDescription(); }
	public boolean isAbstract() { return synset.isAbstract(); }
	public ImmutableList<LexicalUnitView> getLexicalUnits() { return lexical_units; }

	/**
	 * Language of the first resolved member, Polish if there are none.
	 */
	public Language getLanguage()
	{
		return lexical_units.isEmpty() ? Language.PL : lexical_units.get(0).getLanguage();
	}

	/**
	 * Comma-separated names of the resolved members.
	 */
	public String toSimple()
	{
		return lexical_units.stream()
				.map(LexicalUnitView::toSimple)
				.collect(joining(","));
	}

	@Override
	public String toString()
	{
		return Long.toUnsignedString(synset.getId()) + "_" + lexical_units;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SynsetView other = (SynsetView) o;
		return synset.equals(other.synset) && lexical_units.equals(other.lexical_units);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(synset, lexical_units);
	}
}
