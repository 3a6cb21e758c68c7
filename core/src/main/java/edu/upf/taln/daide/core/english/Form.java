package edu.upf.taln.daide.core.english;

/**
 * Grammatical form requested from the English generator for a DAIDE sub-expression.
 */
public enum Form
{
	NONE, // default: orders are reported in the past, alliances as clauses
	N, // noun phrase
	N_LIST, // coordinated list of noun phrases
	ORDER, // orders are phrased as obligations ("shall move")
	COMPL // complement of a verb such as "propose"
}
