package edu.upf.taln.daide.core.english;

import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.daide.DaideParser;
import edu.upf.taln.daide.core.daide.DaideTree;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

public class EnglishGeneratorTest
{
	private static LexicalResources resources;
	private final DaideParser parser = new DaideParser();

	@BeforeClass
	public static void loadResources() throws Exception
	{
		resources = LexicalResources.loadDefault();
	}

	private String english(String daide)
	{
		final EnglishGenerator generator = new EnglishGenerator(resources, new Options());
		return generator.toEnglish(parser.parse(daide).getTree());
	}

	@Test
	public void testSubmitSingleOrder()
	{
		Assert.assertEquals("We submit the following order: the English army in Liverpool shall remain in place.",
				english("SUB ((ENG AMY LVP) HLD)"));
	}

	@Test
	public void testSubmitSeveralOrders()
	{
		Assert.assertEquals("We submit the following orders: " +
						"(1) the English army in Liverpool shall remain in place; " +
						"(2) the English fleet in London shall move to the North Sea; and " +
						"(3) the English fleet in Edinburgh shall support the English fleet in London moving to the North Sea.",
				english("SUB ((ENG AMY LVP) HLD) ((ENG FLT LON) MTO NTH) ((ENG FLT EDI) SUP (ENG FLT LON) MTO NTH)"));
	}

	@Test
	public void testMoveFromCoast()
	{
		Assert.assertEquals("The French fleet on the north coast of Spain moved to the Mid-Atlantic Ocean.",
				english("(FRA FLT (SPA NCS)) MTO MAO"));
	}

	@Test
	public void testAlliance()
	{
		Assert.assertEquals("Germany, Austria and Italy are allies against France and Russia.",
				english("ALY (GER AUS ITA) (FRA RUS)"));
		Assert.assertEquals("Germany and Austria are allies against France.",
				english("ALY (GER AUS) VSS (FRA)"));
	}

	@Test
	public void testProposal()
	{
		Assert.assertEquals("We propose an alliance between Germany, Austria and Italy against France and Russia.",
				english("PRP (ALY (GER AUS ITA) (FRA RUS))"));
		Assert.assertEquals("We propose an alliance.", english("PRP (ALY)"));
	}

	@Test
	public void testNames()
	{
		Assert.assertEquals("Austria", english("AUS"));
		Assert.assertEquals("Austria", english("(AUS)"));
		Assert.assertEquals("the Italian fleet in Venice", english("ITA FLT VEN"));
		Assert.assertEquals("English Channel", english("ECH"));
		Assert.assertEquals("XYZ the English Channel", english("XYZ ECH"));
	}

	@Test
	public void testGenericFallback()
	{
		Assert.assertEquals("PCE (France Germany)", english("PCE (FRA GER)"));
		Assert.assertEquals("XYZ (London (army))", english("XYZ (LON (AMY))"));
	}

	@Test
	public void testGlossTags()
	{
		final EnglishGenerator generator = new EnglishGenerator(resources, new Options());

		final Gloss coast = generator.generate(parser.parse("SPA SCS").getTree());
		Assert.assertEquals("the south coast of Spain", coast.getText());
		Assert.assertTrue(coast.isCoast());
		Assert.assertFalse(coast.isClause());

		final Gloss hold = generator.generate(parser.parse("(ENG AMY LVP) HLD").getTree(), Form.ORDER);
		Assert.assertEquals("the English army in Liverpool shall remain in place", hold.getText());
		Assert.assertTrue(hold.isClause());
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testDepthLimit()
	{
		final Options options = new Options();
		options.max_depth = 3;
		final EnglishGenerator generator = new EnglishGenerator(resources, options);
		final DaideTree tree = parser.parse("A (B (C (D (E))))").getTree();
		generator.generate(tree);
	}

	private static String nested(String daide, int levels)
	{
		return "(".repeat(levels) + daide + ")".repeat(levels);
	}

	@Test
	public void testNestingWithinDefaultLimit()
	{
		final int max_depth = new Options().max_depth;
		final EnglishGenerator generator = new EnglishGenerator(resources, new Options());
		final Gloss gloss = generator.generate(parser.parse(nested("ENG", max_depth - 1)).getTree());
		Assert.assertEquals(nested("England", max_depth - 2), gloss.getText());
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testNestingBeyondDefaultLimit()
	{
		final int max_depth = new Options().max_depth;
		english(nested("ENG", max_depth + 1));
	}

	@Test(expected = DepthLimitExceededException.class)
	public void testVeryDeepNestingFailsOnLimit()
	{
		english(nested("ENG", 5000));
	}
}
