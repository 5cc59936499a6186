package edu.upf.taln.plwordnet.core.io;

import java.util.function.Function;

/**
 * Declared type of a bound attribute: the value used when the attribute is absent and the coercion applied to the
 * raw value when it is present. A coercion signals an unparseable value with an IllegalArgumentException.
 */
public final class FieldType<V>
{
	public static final FieldType<String> TEXT = new FieldType<>("text", "", Function.identity());
	public static final FieldType<Long> ID = new FieldType<>("unsigned id", 0L, FieldType::parseId);
	public static final FieldType<Integer> INTEGER = new FieldType<>("integer", 0, Integer::parseInt);
	public static final FieldType<Boolean> BOOLEAN = new FieldType<>("boolean", false, "true"::equals);

	private final String name;
	private final V default_value;
	private final Function<String, V> coercion;

	private FieldType(String name, V default_value, Function<String, V> coercion)
	{
		this.name = name;
		this.default_value = default_value;
		this.coercion = coercion;
	}

	public String getName() { return name; }
	public V getDefault() { return default_value; }

	public V coerce(String raw)
	{
		return coercion.apply(raw);
	}

	/**
	 * Parses an unsigned 64-bit id. Values above Long.MAX_VALUE are kept as their two's complement bit pattern, so
	 * ids must be printed with {@link Long#toUnsignedString(long)} and compared with {@link Long#compareUnsigned}.
	 */
	public static long parseId(String raw)
	{
		return Long.parseUnsignedLong(raw);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
