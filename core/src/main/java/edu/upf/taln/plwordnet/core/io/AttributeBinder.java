package edu.upf.taln.plwordnet.core.io;

import com.google.common.collect.ImmutableList;

import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Binds the attributes of one element to a target object according to a fixed field table.
 * Every field gets a value: an absent attribute silently takes the default of its type, while a present attribute
 * that cannot be coerced fails the whole bind. Collection-valued fields are not part of the table, targets start
 * with them empty.
 *
 * @param <B> type of the object receiving the values, usually an entity builder
 */
public final class AttributeBinder<B>
{
	private final String tag;
	private final Supplier<B> factory;
	private final ImmutableList<Field<B, ?>> fields;

	private AttributeBinder(String tag, Supplier<B> factory, ImmutableList<Field<B, ?>> fields)
	{
		this.tag = tag;
		this.factory = factory;
		this.fields = fields;
	}

	public static <B> Builder<B> forElement(String tag, Supplier<B> factory)
	{
		return new Builder<>(tag, factory);
	}

	public String getTag() { return tag; }

	public B bind(ParseEvent event) throws WordnetParseException
	{
		final B target = factory.get();
		for (Field<B, ?> field : fields)
		{
			field.bind(event, target, tag);
		}
		return target;
	}

	private static final class Field<B, V>
	{
		private final String attribute;
		private final FieldType<V> type;
		private final BiConsumer<B, V> setter;

		private Field(String attribute, FieldType<V> type, BiConsumer<B, V> setter)
		{
			this.attribute = attribute;
			this.type = type;
			this.setter = setter;
		}

		private void bind(ParseEvent event, B target, String tag) throws WordnetParseException
		{
			final String raw = event.getAttribute(attribute);
			if (raw == null)
			{
				setter.accept(target, type.getDefault());
				return;
			}

			final V value;
			try
			{
				value = type.coerce(raw);
			}
			catch (IllegalArgumentException e)
			{
				throw WordnetParseException.invalidAttributeValue(tag, attribute, raw, event.getPosition());
			}
			setter.accept(target, value);
		}
	}

	public static final class Builder<B>
	{
		private final String tag;
		private final Supplier<B> factory;
		private final ImmutableList.Builder<Field<B, ?>> fields = ImmutableList.builder();

		private Builder(String tag, Supplier<B> factory)
		{
			this.tag = tag;
			this.factory = factory;
		}

		public <V> Builder<B> field(String attribute, FieldType<V> type, BiConsumer<B, V> setter)
		{
			fields.add(new Field<>(attribute, type, setter));
			return this;
		}

		public Builder<B> text(String attribute, BiConsumer<B, String> setter) { return field(attribute, FieldType.TEXT, setter); }
		public Builder<B> id(String attribute, BiConsumer<B, Long> setter) { return field(attribute, FieldType.ID, setter); }
		public Builder<B> integer(String attribute, BiConsumer<B, Integer> setter) { return field(attribute, FieldType.INTEGER, setter); }
		public Builder<B> bool(String attribute, BiConsumer<B, Boolean> setter) { return field(attribute, FieldType.BOOLEAN, setter); }

		public AttributeBinder<B> build()
		{
			return new AttributeBinder<>(tag, factory, fields.build());
		}
	}
}
