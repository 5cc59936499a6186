package edu.upf.taln.plwordnet.core.structures;

/**
 * Edge between two lexical units.
 */
public final class LexicalRelation extends Relation
{
	private LexicalRelation(Builder b)
	{
		super(b);
	}

	public static class Builder extends Relation.Builder<LexicalRelation>
	{
		@Override
		public LexicalRelation build()
		{
			return new LexicalRelation(this);
		}
	}
}
