package com.jeffdisher.murmur.logic;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.murmur.types.ILogger;


public class TestStandardLogger
{
	@Test
	public void testNesting() throws Throwable
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream stream = new PrintStream(bytes, true);
		StandardLogger logger = StandardLogger.topLogger(stream, false);
		ILogger first = logger.logStart("first");
		first.logOperation("op");
		ILogger nested = first.logStart("nested");
		nested.logFinish("done nested");
		first.logFinish("done first");
		logger.logStart("second").logFinish("done second");
		String out = bytes.toString();
		Assert.assertEquals(">1> first\n"
				+ "=1= op\n"
				+ ">1.1> nested\n"
				+ "<1.1< done nested\n"
				+ "<1< done first\n"
				+ ">2> second\n"
				+ "<2< done second\n"
				, out.replace(System.lineSeparator(), "\n"));
	}

	@Test
	public void testVerbose() throws Throwable
	{
		ByteArrayOutputStream quietBytes = new ByteArrayOutputStream();
		StandardLogger.topLogger(new PrintStream(quietBytes, true), false).logVerbose("hidden");
		Assert.assertEquals(0, quietBytes.size());

		ByteArrayOutputStream loudBytes = new ByteArrayOutputStream();
		StandardLogger.topLogger(new PrintStream(loudBytes, true), true).logVerbose("shown");
		Assert.assertTrue(loudBytes.toString().contains("shown"));
	}

	@Test
	public void testErrorPropagates() throws Throwable
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		StandardLogger logger = StandardLogger.topLogger(new PrintStream(bytes, true), false);
		ILogger clean = logger.logStart("clean");
		clean.logFinish("ok");
		Assert.assertFalse(logger.didErrorOccur());

		ILogger failing = logger.logStart("failing");
		failing.logError("broken");
		Assert.assertTrue(failing.didErrorOccur());
		// Only reported up once the nested context finishes.
		Assert.assertFalse(logger.didErrorOccur());
		failing.logFinish("failed");
		Assert.assertTrue(logger.didErrorOccur());
		Assert.assertTrue(bytes.toString().contains("!2! broken"));
	}
}
