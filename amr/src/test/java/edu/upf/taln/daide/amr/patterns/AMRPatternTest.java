package edu.upf.taln.daide.amr.patterns;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class AMRPatternTest
{
	@Test
	public void testParse()
	{
		final AMRPattern p = AMRPattern.parse("($utype(army|fleet) :mod $power(country) :location $location)");

		Assert.assertTrue(p.getHead().isSlot());
		Assert.assertEquals("utype", p.getHead().getText());
		Assert.assertEquals(List.of("army", "fleet"), p.getHead().getAlternatives());
		Assert.assertEquals(2, p.getConstraints().size());
		Assert.assertEquals("mod", p.getConstraints().get(0).getLeft());
		Assert.assertEquals(List.of("country"), p.getConstraints().get(0).getRight().getAlternatives());
		Assert.assertTrue(p.getConstraints().get(1).getRight().getAlternatives().isEmpty());
	}

	@Test
	public void testParseNested()
	{
		final AMRPattern p = AMRPattern.parse("(coast :location ($compass(north|south) :part-of $province(province)))");

		Assert.assertTrue(p.getHead().isLiteral());
		Assert.assertEquals("coast", p.getHead().getText());
		final PatternTerm location = p.getConstraints().get(0).getRight();
		Assert.assertTrue(location.isPattern());
		Assert.assertEquals("part-of", location.getPattern().orElseThrow().getConstraints().get(0).getLeft());
		Assert.assertEquals("(coast :location ($compass(north|south) :part-of $province(province)))", p.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnbalanced()
	{
		AMRPattern.parse("(hold-03 :ARG1 $unit");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingRole()
	{
		AMRPattern.parse("(hold-03 $unit)");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTrailingText()
	{
		AMRPattern.parse("(hold-03 :ARG1 $unit) HLD");
	}
}
