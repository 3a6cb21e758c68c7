package edu.upf.taln.daide.amr.patterns;

import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class DaideTemplateTest
{
	@Test
	public void testNoDoubleParentheses()
	{
		Assert.assertEquals("(A B)", new DaideTemplate("($x)").instantiate(Map.of("x", "(A B)"), false));
	}

	@Test
	public void testMultiTokenValues()
	{
		final DaideTemplate submit = new DaideTemplate("SUB $submission");
		Assert.assertEquals("SUB ((ENG AMY LVP) HLD)",
				submit.instantiate(Map.of("submission", "(ENG AMY LVP) HLD"), false));
		Assert.assertEquals("SUB (ENG AMY LVP)", submit.instantiate(Map.of("submission", "(ENG AMY LVP)"), false));

		// already enclosed by the template
		final DaideTemplate alliance = new DaideTemplate("ALY ($allies) VSS ($enemies)");
		Assert.assertEquals("ALY (GER AUS) VSS (FRA)",
				alliance.instantiate(Map.of("allies", "GER AUS", "enemies", "FRA"), false));
		Assert.assertEquals("ALY ((GER AMY MUN) AUS) VSS (FRA)",
				alliance.instantiate(Map.of("allies", "(GER AMY MUN) AUS", "enemies", "FRA"), false));
	}

	@Test
	public void testUnboundPlaceholder()
	{
		Assert.assertEquals("ITA MTO $destination",
				new DaideTemplate("$unit MTO $destination").instantiate(Map.of("unit", "ITA"), false));
	}

	@Test
	public void testNegation()
	{
		Assert.assertEquals("NOT ((ITA AMY BUR) HLD)",
				new DaideTemplate("$unit HLD").instantiate(Map.of("unit", "(ITA AMY BUR)"), true));
		Assert.assertEquals("NOT (PCE (ITA FRA))",
				new DaideTemplate("PCE ($c1 $c2)").instantiate(Map.of("c1", "ITA", "c2", "FRA"), true));
	}

	@Test
	public void testCollapse()
	{
		Assert.assertEquals("PRP (ALY (GER))",
				new DaideTemplate("PRP ($proposal)").instantiate(Map.of("proposal", "ALY ((GER))"), false));
	}

	@Test
	public void testMatchingOuterParentheses()
	{
		Assert.assertTrue(DaideTemplate.hasMatchingOuterParentheses("(A B)"));
		Assert.assertTrue(DaideTemplate.hasMatchingOuterParentheses("(A (B) C)"));
		Assert.assertFalse(DaideTemplate.hasMatchingOuterParentheses("(A) (B)"));
		Assert.assertFalse(DaideTemplate.hasMatchingOuterParentheses("A B"));
		Assert.assertFalse(DaideTemplate.hasMatchingOuterParentheses("((A)"));
	}
}
