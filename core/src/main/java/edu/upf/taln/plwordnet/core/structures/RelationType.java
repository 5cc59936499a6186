package edu.upf.taln.plwordnet.core.structures;

import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * A named kind of lexical or synset relation, e.g. hypernymy.
 * reverse holds the id of the inverse relation type, 0 if none is declared.
 */
public final class RelationType
{
	private final long id;
	private final String type;
	private final long reverse;
	private final String name;
	private final String description;
	private final String posstr;
	private final String display;
	private final String shortcut;
	private final boolean autoreverse;
	private final String pwn;
	private final ImmutableList<RelationTypeTest> tests;

	private RelationType(Builder b)
	{
		this.id = b.id;
		this.type = b.type;
		this.reverse = b.reverse;
		this.name = b.name;
		this.description = b.description;
		this.posstr = b.posstr;
		this.display = b.display;
		this.shortcut = b.shortcut;
		this.autoreverse = b.autoreverse;
		this.pwn = b.pwn;
		this.tests = b.tests.build();
	}

	public long getId() { return id; }
	public String getType() { return type; }
	public long getReverse() { return reverse; }
	public String getName() { return name; }
	public String getDescription() { return description; }
	public String getPosStr() { return posstr; }
	public String getDisplay() { return display; }
	public String getShortcut() { return shortcut; }
	public boolean isAutoReverse() { return autoreverse; }
	public String getPwn() { return pwn; }
	public ImmutableList<RelationTypeTest> getTests() { return tests; }

	@Override
	public String toString()
	{
		return Long.toUnsignedString(id) + "_" + name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RelationType other = (RelationType) o;
		return id == other.id && reverse == other.reverse && autoreverse == other.autoreverse &&
				type.equals(other.type) && name.equals(other.name) && description.equals(other.description) &&
				posstr.equals(other.posstr) && display.equals(other.display) && shortcut.equals(other.shortcut) &&
				pwn.equals(other.pwn) && tests.equals(other.tests);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, name, reverse);
	}

	public static class Builder
	{
		private long id = 0;
		private String type = "";
		private long reverse = 0;
		private String name = "";
		private String description = "";
		private String posstr = "";
		private String display = "";
		private String shortcut = "";
		private boolean autoreverse = false;
		private String pwn = "";
		private final ImmutableList.Builder<RelationTypeTest> tests = ImmutableList.builder();

		public Builder id(long id) { this.id = id; return this; }
		public Builder type(String type) { this.type = type; return this; }
		public Builder reverse(long reverse) { this.reverse = reverse; return this; }
		public Builder name(String name) { this.name = name; return this; }
		public Builder description(String description) { this.description = description; return this; }
		public Builder posstr(String posstr) { this.posstr = posstr; return this; }
		public Builder display(String display) { this.display = display; return this; }
		public Builder shortcut(String shortcut) { this.shortcut = shortcut; return this; }
		public Builder autoreverse(boolean autoreverse) { this.autoreverse = autoreverse; return this; }
		public Builder pwn(String pwn) { this.pwn = pwn; return this; }
		public Builder addTest(RelationTypeTest test) { tests.add(test); return this; }

		public long getId() { return id; }

		public RelationType build()
		{
			return new RelationType(this);
		}
	}
}
