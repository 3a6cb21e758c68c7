package edu.upf.taln.daide.core.utils;

import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

public class SlotValuesTest
{
	@Test
	public void testGet()
	{
		final String line = "::s1 of course ::s2 ::cost 0.3";
		Assert.assertEquals(Optional.of("of course"), SlotValues.get(line, "s1"));
		Assert.assertEquals(Optional.of(""), SlotValues.get(line, "s2"));
		Assert.assertEquals(Optional.of("0.3"), SlotValues.get(line, "cost"));
		Assert.assertFalse(SlotValues.get(line, "s3").isPresent());
		Assert.assertFalse(SlotValues.getNonEmpty(line, "s2").isPresent());
	}

	@Test
	public void testSimilarSlotNames()
	{
		final String line = "::power-id ENG ::power-name England";
		Assert.assertEquals(Optional.of("ENG"), SlotValues.get(line, "power-id"));
		Assert.assertEquals(Optional.of("England"), SlotValues.get(line, "power-name"));
		Assert.assertFalse(SlotValues.get(line, "name").isPresent());
	}
}
