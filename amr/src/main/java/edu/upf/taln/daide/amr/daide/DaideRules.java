package edu.upf.taln.daide.amr.daide;

import java.util.List;

/**
 * Rules translating AMR subgraphs into DAIDE, tried in order until one matches.
 * More specific rules come before more general ones sharing the same head concept.
 */
public class DaideRules
{
	private static final List<String> proposal_concepts = List.of("propose-01", "agree-01");

	public static final List<DaideRule> rules = List.of(
			// units: (ITA AMY BUR), (FRA FLT (SPA NCS))
			new DaideRule("($utype(army|fleet) :mod $power(country) :location $location(sea|province|coast))",
					"($power $utype $location)"),
			// orders
			new DaideRule("(move-01 :ARG1 $unit :ARG2 $destination)", "$unit MTO $destination"),
			new DaideRule("(coast :location ($compass(north|east|south|west) :part-of $province(province)))",
					"($province $compass)"),
			new DaideRule("(hold-03 :ARG1 $unit)", "$unit HLD"),
			new DaideRule("(support-01 :ARG0 $supporter :ARG1 $supportee)", "$supporter SUP $supportee"),
			// alliances and proposals
			new DaideRule("(ally-01 :ARG1 $allies :ARG3 $ennemies)", "ALY ($allies) VSS ($ennemies)"),
			new DaideRule("(ally-01 :ARG1 $allies)", "ALY ($allies)"),
			new DaideRule("(submit-01 :ARG1 $submission)", "SUB $submission"),
			new DaideRule("(propose-01 :ARG1 $proposal)", "PRP ($proposal)"),
			new DaideRule("(build-01 :ARG0 $power(country) :ARG1 $utype(army|fleet) :location $location(province))",
					"($power $utype $location) BLD"),
			new DaideRule("(agree-01 :ARG1 $proposal)", "YES ($proposal)"),
			new DaideRule("(reject-01 :ARG1 $proposal)", "REJ ($proposal)"),
			new DaideRule("(demilitarize-01 :ARG1 $powers :ARG2 $locations)", "DMZ ($powers) ($locations)"),
			new DaideRule("(remove-01 :ARG1 $unit(army|fleet))", "$unit REM"),
			// convoys and retreats
			new DaideRule("(transport-01 :ARG1 $army(army) :ARG3 $destination(province) :ARG4 $path(sea))",
					"$army CTO $destination VIA $path"),
			new DaideRule("(transport-01 :ARG0 $fleet(fleet) :ARG1 $army(army) :ARG3 $destination(province))",
					"$fleet CVY $army CTO $destination"),
			new DaideRule("(retreat-01 :ARG1 $unit(army|fleet) :destination $destination(province|sea))",
					"$unit RTO $destination"),
			// supply centre ownership, only as part of a proposal or agreement
			new DaideRule("(have-03 :ARG0 $owner(country) :ARG1 $province(province))", "SCD ($owner $province)",
					n -> n.hasAncestor(proposal_concepts)),
			// peace
			new DaideRule("(peace :op1 $c1(country) :op2 $c2(country) :op3 $c3(country))", "PCE ($c1 $c2 $c3)"),
			new DaideRule("(peace :op1 $c1(country) :op2 $c2(country))", "PCE ($c1 $c2)"),
			new DaideRule("(peace :op1 $powers(and))", "PCE ($powers)"));

	private DaideRules() {}
}
