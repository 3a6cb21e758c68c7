package edu.upf.taln.daide.amr.io;

import java.util.List;

/**
 * Roles and concepts given special treatment when reading, printing and translating AMRs.
 * Roles are written without their leading colon.
 */
@SuppressWarnings("unused")
public class AMRSemantics
{
	public static final String ARG0 = "ARG0";
	public static final String ARG1 = "ARG1";
	public static final String ARG2 = "ARG2";
	public static final String ARG3 = "ARG3";
	public static final String ARG4 = "ARG4";
	public static final String destination = "destination";
	public static final String location = "location";
	public static final String mod = "mod";
	public static final String name = "name";
	public static final String part_of = "part-of";
	public static final String polarity = "polarity";
	public static final String op = "op";
	public static final String name_concept = "name";
	public static final String and = "and";
	public static final String country = "country";
	public static final String province = "province";
	public static final String sea = "sea";
	public static final String empty = "amr-empty";
	public static final String negative = "-";
	public static final List<String> named_entity_types = List.of(country, province, sea);

	public static String opRole(int i)
	{
		return op + i;
	}

	public static boolean isOpRole(String role)
	{
		return role.matches("op\\d+");
	}

	public static boolean isNamedEntityType(String concept)
	{
		return named_entity_types.contains(concept);
	}
}
