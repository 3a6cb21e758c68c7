package edu.upf.taln.daide.core.daide;

import org.junit.Assert;
import org.junit.Test;

public class DaideParserTest
{
	private final DaideParser parser = new DaideParser();

	@Test
	public void testParse()
	{
		final DaideParse parse = parser.parse("SUB ((ENG AMY LVP) HLD) ((ENG FLT LON) MTO NTH)");
		Assert.assertFalse(parse.hasErrors());

		final DaideTree tree = parse.getTree();
		Assert.assertEquals(3, tree.size());
		Assert.assertTrue(tree.hasToken(0, "SUB"));
		Assert.assertEquals(DaideTree.list(
				DaideTree.list(DaideTree.leaf("ENG"), DaideTree.leaf("AMY"), DaideTree.leaf("LVP")),
				DaideTree.leaf("HLD")), tree.get(1));
		Assert.assertEquals("SUB ((ENG AMY LVP) HLD) ((ENG FLT LON) MTO NTH)", tree.toString());
	}

	@Test
	public void testWhitespaceNormalized()
	{
		final DaideParse parse = parser.parse("  ( FRA\tFLT (SPA  NCS))MTO MAO ");
		Assert.assertFalse(parse.hasErrors());
		Assert.assertEquals("(FRA FLT (SPA NCS)) MTO MAO", parse.getTree().toString());
	}

	@Test
	public void testSpuriousCloseParenthesis()
	{
		final DaideParse parse = parser.parse("ENG) HLD");
		Assert.assertEquals(1, parse.getErrors().size());
		Assert.assertEquals("Ignoring spurious close parenthesis at position 3", parse.getErrors().get(0));
		Assert.assertEquals("ENG HLD", parse.getTree().toString());
	}

	@Test
	public void testMissingCloseParenthesis()
	{
		final DaideParse parse = parser.parse("PRP (ALY (GER AUS");
		Assert.assertEquals(2, parse.getErrors().size());
		Assert.assertEquals("Missing close parenthesis", parse.getErrors().get(0));
		Assert.assertEquals("PRP (ALY (GER AUS))", parse.getTree().toString());
		Assert.assertEquals(17, parse.getNextIndex());
	}

	@Test
	public void testSpuriousCharacter()
	{
		final DaideParse parse = parser.parse("ENG 1 AMY");
		Assert.assertEquals(1, parse.getErrors().size());
		Assert.assertEquals("Ignoring spurious character 1 at position 4", parse.getErrors().get(0));
		Assert.assertEquals("ENG AMY", parse.getTree().toString());
	}

	@Test
	public void testNeverFails()
	{
		final StringBuilder deep = new StringBuilder();
		for (int i = 0; i < 100000; ++i)
			deep.append('(');
		DaideParse parse = parser.parse(deep.toString());
		Assert.assertEquals(100000, parse.getErrors().size());

		parse = parser.parse(")))");
		Assert.assertEquals(3, parse.getErrors().size());
		Assert.assertEquals(0, parse.getTree().size());

		parse = parser.parse("");
		Assert.assertFalse(parse.hasErrors());
		Assert.assertEquals("", parse.getTree().toString());
	}

	@Test
	public void testStartIndex()
	{
		final DaideParse parse = parser.parse("DAIDE: ENG AMY", 6);
		Assert.assertFalse(parse.hasErrors());
		Assert.assertEquals("ENG AMY", parse.getTree().toString());
	}
}
