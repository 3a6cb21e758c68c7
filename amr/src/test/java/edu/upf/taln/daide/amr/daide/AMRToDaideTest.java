package edu.upf.taln.daide.amr.daide;

import edu.upf.taln.daide.amr.io.AMRReader;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import org.apache.commons.lang3.StringUtils;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

public class AMRToDaideTest
{
	private static final String italian_army_in_burgundy = "(a / army :mod (c / country :name (n / name :op1 \"Italy\")) " +
			":location (p / province :name (n2 / name :op1 \"Burgundy\")))";
	private static LexicalResources resources;
	private final AMRReader reader = new AMRReader();

	@BeforeClass
	public static void loadResources() throws Exception
	{
		resources = LexicalResources.loadDefault();
	}

	private String daide(String amr)
	{
		return new AMRToDaide(resources, new Options()).translate(reader.parse(amr).orElseThrow());
	}

	private static String country(int i, String name)
	{
		return "(c" + i + " / country :name (m" + i + " / name :op1 \"" + name + "\"))";
	}

	@Test
	public void testUnit()
	{
		Assert.assertEquals("(ITA AMY BUR)", daide(italian_army_in_burgundy));
	}

	@Test
	public void testHold()
	{
		Assert.assertEquals("(ITA AMY BUR) HLD", daide("(h / hold-03 :ARG1 " + italian_army_in_burgundy + ")"));
	}

	@Test
	public void testNegatedHold()
	{
		Assert.assertEquals("NOT ((ITA AMY BUR) HLD)",
				daide("(h / hold-03 :polarity - :ARG1 " + italian_army_in_burgundy + ")"));
	}

	@Test
	public void testMoveFromCoast()
	{
		Assert.assertEquals("(FRA FLT (SPA NCS)) MTO MAO",
				daide("(m / move-01 :ARG1 (f / fleet :mod " + country(1, "France") +
						" :location (c2 / coast :location (n3 / north :part-of (p / province :name (n2 / name :op1 \"Spain\")))))" +
						" :ARG2 (s / sea :name (n4 / name :op1 \"Mid-Atlantic\" :op2 \"Ocean\")))"));
	}

	@Test
	public void testSubmit()
	{
		Assert.assertEquals("SUB ((ENG AMY LVP) HLD)",
				daide("(s / submit-01 :ARG0 (w / we) :ARG1 (h / hold-03 :ARG1 (a / army :mod " + country(1, "England") +
						" :location (p / province :name (n2 / name :op1 \"Liverpool\")))))"));
	}

	@Test
	public void testProposeAlliance()
	{
		Assert.assertEquals("PRP (ALY (GER AUS) VSS (FRA))",
				daide("(p / propose-01 :ARG0 (i / i) :ARG1 (a / ally-01 :ARG1 (a2 / and :op1 " + country(1, "Germany") +
						" :op2 " + country(2, "Austria") + ") :ARG3 " + country(3, "France") + "))"));
		Assert.assertEquals("ALY (GER AUS)",
				daide("(a / ally-01 :ARG1 (a2 / and :op1 " + country(1, "Germany") + " :op2 " + country(2, "Austria") + "))"));
	}

	@Test
	public void testPeace()
	{
		Assert.assertEquals("PCE (ITA FRA GER)",
				daide("(p / peace :op1 (a / and :op1 " + country(1, "Italy") + " :op2 " + country(2, "France") +
						" :op3 " + country(3, "Germany") + "))"));
		Assert.assertEquals("PCE (ITA FRA)",
				daide("(p / peace :op1 " + country(1, "Italy") + " :op2 " + country(2, "France") + ")"));
	}

	@Test
	public void testSupplyCentreOnlyInProposals()
	{
		final String have = "(h / have-03 :ARG0 " + country(1, "Italy") +
				" :ARG1 (p2 / province :name (n2 / name :op1 \"Venice\")))";
		Assert.assertEquals("PRP (SCD (ITA VEN))", daide("(p / propose-01 :ARG1 " + have + ")"));
		Assert.assertEquals("(have-03 :ARG0 ITA :ARG1 VEN)", daide(have));
	}

	@Test
	public void testConjunction()
	{
		Assert.assertEquals("x ITA (ITA AMY BUR)",
				daide("(x / and :op1 \"x\" :op2 " + country(1, "Italy") + " :op3 " + italian_army_in_burgundy + ")"));
		Assert.assertEquals("((ITA AMY BUR) HLD)",
				daide("(x / and :op1 (h / hold-03 :ARG1 " + italian_army_in_burgundy + "))"));
		Assert.assertEquals("((ITA AMY BUR) HLD) ((ITA AMY BUR) HLD)",
				daide("(x / and :op1 (h / hold-03 :ARG1 " + italian_army_in_burgundy + ") :op2 h)"));
	}

	@Test
	public void testUnmatched()
	{
		Assert.assertEquals("(attack-01 :ARG0 ITA :ARG1 FRA)",
				daide("(a / attack-01 :ARG0 " + country(1, "Italy") + " :ARG1 " + country(2, "France") + ")"));
		Assert.assertEquals("(country :name (name :op1 \"Atlantis\"))", daide(country(1, "Atlantis")));
		Assert.assertEquals("(possible-01 :polarity - :ARG1 (ITA AMY BUR) HLD)",
				daide("(p / possible-01 :polarity - :ARG1 (h / hold-03 :ARG1 " + italian_army_in_burgundy + "))"));
	}

	@Test
	public void testOtherRules()
	{
		Assert.assertEquals("(GER AMY MUN) BLD",
				daide("(b / build-01 :ARG0 " + country(1, "Germany") + " :ARG1 (a / army) :location " +
						"(p / province :name (n / name :op1 \"Munich\")))"));
		Assert.assertEquals("(ITA AMY BUR) RTO MAR",
				daide("(r / retreat-01 :ARG1 " + italian_army_in_burgundy + " :destination " +
						"(p2 / province :name (n3 / name :op1 \"Marseilles\")))"));
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testCycle()
	{
		daide("(a / foo :arg1 (b / bar :arg2 a))");
	}

	// (x0 / hold-03 :ARG1 (x1 / hold-03 :ARG1 ... (z / zzz)))
	private static String chain(String concept, int length)
	{
		final StringBuilder b = new StringBuilder();
		for (int i = 0; i < length; ++i)
			b.append("(x").append(i).append(" / ").append(concept).append(" :ARG1 ");
		b.append("(z / zzz)");
		return b.append(")".repeat(length)).toString();
	}

	@Test
	public void testNestingWithinDefaultLimit()
	{
		final int max_depth = new Options().max_depth;
		final String daide = daide(chain("hold-03", max_depth + 1));
		Assert.assertTrue(daide.contains("zzz HLD"));
		Assert.assertEquals(max_depth + 1, StringUtils.countMatches(daide, "HLD"));
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testNestingBeyondDefaultLimit()
	{
		final int max_depth = new Options().max_depth;
		daide(chain("hold-03", max_depth + 2));
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testVeryDeepNestingFailsOnLimit()
	{
		daide(chain("hold-03", 900));
	}

	@Test(timeout = 5000)
	public void testPartialMatchesTranslatedOnce()
	{
		// every move-01 binds its :ARG1 before failing on the missing :ARG2
		final String daide = daide(chain("move-01", 30));
		Assert.assertTrue(daide.startsWith("(move-01 :ARG1 (move-01 :ARG1 "));
		Assert.assertEquals(30, StringUtils.countMatches(daide, "move-01"));
	}
}
