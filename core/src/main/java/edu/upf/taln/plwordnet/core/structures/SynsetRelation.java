package edu.upf.taln.plwordnet.core.structures;

/**
 * Edge between two synsets.
 */
public final class SynsetRelation extends Relation
{
	private SynsetRelation(Builder b)
	{
		super(b);
	}

	public static class Builder extends Relation.Builder<SynsetRelation>
	{
		@Override
		public SynsetRelation build()
		{
			return new SynsetRelation(this);
		}
	}
}
