package com.jeffdisher.murmur.logic;

import java.io.PrintStream;

import com.jeffdisher.murmur.types.ILogger;


public class StandardLogger implements ILogger
{
	public static StandardLogger topLogger(PrintStream stream, boolean verbose)
	{
		return new StandardLogger(null, stream, "", verbose);
	}


	private final StandardLogger _parent;
	private final PrintStream _stream;
	private final String _prefix;
	private final boolean _verbose;
	private int _nextOperationCounter;
	private boolean _errorOccurred;

	private StandardLogger(StandardLogger parent
			, PrintStream stream
			, String prefix
			, boolean verbose
	)
	{
		_parent = parent;
		_stream = stream;
		_prefix = prefix;
		_verbose = verbose;
		_nextOperationCounter = 0;
	}

	@Override
	public ILogger logStart(String openingMessage)
	{
		int operationNumber = _nextOperationCounter + 1;
		_nextOperationCounter += 1;
		String prefix = _prefix.isEmpty()
				? ("" + operationNumber)
				: (_prefix + "." + operationNumber)
		;
		_stream.println(">" + prefix + "> " + openingMessage);
		return new StandardLogger(this, _stream, prefix, _verbose);
	}

	@Override
	public void logOperation(String message)
	{
		_stream.println("=" + _prefix + "= " + message);
	}

	@Override
	public void logFinish(String finishMessage)
	{
		_stream.println("<" + _prefix + "< " + finishMessage);
		if (_errorOccurred && (null != _parent))
		{
			_parent._errorOccurred = true;
		}
	}

	@Override
	public void logVerbose(String message)
	{
		if (_verbose)
		{
			_stream.println("*" + _prefix + "* " + message);
		}
	}

	@Override
	public void logError(String message)
	{
		_stream.println("!" + _prefix + "! " + message);
		_errorOccurred = true;
	}

	@Override
	public boolean didErrorOccur()
	{
		return _errorOccurred;
	}
}
