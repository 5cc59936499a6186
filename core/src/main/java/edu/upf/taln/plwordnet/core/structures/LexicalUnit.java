package edu.upf.taln.plwordnet.core.structures;

import java.util.Objects;

/**
 * A single word sense: a word form with its part of speech and sense-specific metadata.
 */
public final class LexicalUnit
{
	private final long id;
	private final String name;
	private final String pos;
	private final int tagcount;
	private final String domain;
	private final String desc;
	private final String workstate;
	private final String source;
	private final int variant;
	private final Language language; // derived from pos when the unit is built, never read from the document

	private LexicalUnit(Builder b)
	{
		this.id = b.id;
		this.name = b.name;
		this.pos = b.pos;
		this.tagcount = b.tagcount;
		this.domain = b.domain;
		this.desc = b.desc;
		this.workstate = b.workstate;
		this.source = b.source;
		this.variant = b.variant;
		this.language = Language.fromPos(b.pos);
	}

	public long getId() { return id; }
	public String getName() { return name; }
	public String getPos() { return pos; }
	public int getTagCount() { return tagcount; }
	public String getDomain() { return domain; }
	public String getDescription() { return desc; }
	public String getWorkstate() { return workstate; }
	public String getSource() { return source; }
	public int getVariant() { return variant; }
	public Language getLanguage() { return language; }

	@Override
	public String toString()
	{
		return Long.toUnsignedString(id) + "_" + name + "_" + variant;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LexicalUnit other = (LexicalUnit) o;
		return id == other.id && tagcount == other.tagcount && variant == other.variant &&
				name.equals(other.name) && pos.equals(other.pos) && domain.equals(other.domain) &&
				desc.equals(other.desc) && workstate.equals(other.workstate) && source.equals(other.source);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, name, pos, variant);
	}

	public static class Builder
	{
		private long id = 0;
		private String name = "";
		private String pos = "";
		private int tagcount = 0;
		private String domain = "";
		private String desc = "";
		private String workstate = "";
		private String source = "";
		private int variant = 0;

		public Builder id(long id) { this.id = id; return this; }
		public Builder name(String name) { this.name = name; return this; }
		public Builder pos(String pos) { this.pos = pos; return this; }
		public Builder tagcount(int tagcount) { this.tagcount = tagcount; return this; }
		public Builder domain(String domain) { this.domain = domain; return this; }
		public Builder desc(String desc) { this.desc = desc; return this; }
		public Builder workstate(String workstate) { this.workstate = workstate; return this; }
		public Builder source(String source) { this.source = source; return this; }
		public Builder variant(int variant) { this.variant = variant; return this; }

		public LexicalUnit build()
		{
			return new LexicalUnit(this);
		}
	}
}
