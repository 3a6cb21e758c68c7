package edu.upf.taln.daide.tools;

import org.junit.Assert;
import org.junit.Test;

public class CoverageTest
{
	@Test
	public void testFull()
	{
		Assert.assertEquals(Coverage.FULL, Coverage.of("(ITA AMY BUR) HLD"));
		Assert.assertEquals("Full-DAIDE", Coverage.of("PCE (ITA FRA)").getLabel());
	}

	@Test
	public void testPartial()
	{
		Assert.assertEquals(Coverage.PARTIAL, Coverage.of("(attack-01 :ARG0 ITA :ARG1 FRA)"));
	}

	@Test
	public void testNone()
	{
		Assert.assertEquals(Coverage.NONE, Coverage.of(""));
		Assert.assertEquals(Coverage.NONE, Coverage.of("(want-01 :ARG0 (i / i))"));
		Assert.assertEquals("No-DAIDE", Coverage.NONE.toString());
	}
}
