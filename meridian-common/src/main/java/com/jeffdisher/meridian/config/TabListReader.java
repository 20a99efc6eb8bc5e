package com.jeffdisher.meridian.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;


/**
 * Reads the "tab list" data files used for dimension types and server options.
 * The format is line-oriented and trivial to edit by hand:
 * -each non-empty line not starting with '#' is a record
 * -fields within a line are separated by tabs (so values can contain spaces without any quoting rules)
 * -the first field is the record name and the rest are its parameters
 * -a line starting with a tab is a sub-record of the most recent top-level record
 */
public class TabListReader
{
	/**
	 * Parses the entire stream, sending all parse events to callbacks.  Closes the stream on completion.
	 * 
	 * @param callbacks Will receive the parser events as the parse runs.
	 * @param stream The stream containing the data (will be closed when done).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			TabListReader parser = new TabListReader(callbacks);
			String line = reader.readLine();
			while (null != line)
			{
				parser._handleLine(line);
				line = reader.readLine();
			}
			parser._finish();
		}
	}


	private final IParseCallbacks _callbacks;
	private boolean _isInRecord;

	private TabListReader(IParseCallbacks callbacks)
	{
		_callbacks = callbacks;
	}


	private void _handleLine(String line) throws TabListException
	{
		// Skip empty lines or lines which start with '#' (comments).
		if ((line.length() > 0) && ('#' != line.charAt(0)))
		{
			String[] parts = line.split("\t");
			if (0 == parts.length)
			{
				throw new TabListException("Line contains only tabs");
			}
			boolean isSubRecord = (0 == parts[0].length());
			int nameIndex = isSubRecord ? 1 : 0;
			if (nameIndex >= parts.length)
			{
				throw new TabListException("Record missing name");
			}
			
			// Names must not start or end in whitespace, mostly to catch spaces used instead of tabs.
			String name = parts[nameIndex];
			if (name.isEmpty() || (name.trim().length() < name.length()))
			{
				throw new TabListException("Name edges cannot be whitespace: \"" + name + "\"");
			}
			String[] parameters = Arrays.copyOfRange(parts, nameIndex + 1, parts.length);
			
			if (isSubRecord)
			{
				if (!_isInRecord)
				{
					throw new TabListException("Sub-record missing outer record: \"" + name + "\"");
				}
				_callbacks.processSubRecord(name, parameters);
			}
			else
			{
				if (_isInRecord)
				{
					_callbacks.endRecord();
				}
				_callbacks.startNewRecord(name, parameters);
				_isInRecord = true;
			}
		}
	}

	private void _finish() throws TabListException
	{
		if (_isInRecord)
		{
			_callbacks.endRecord();
			_isInRecord = false;
		}
	}


	/**
	 * The interface which receives callbacks from the parse operation.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called when a new top-level record is encountered.
		 * 
		 * @param name The name of the record.
		 * @param parameters The remaining fields of the line (can be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void startNewRecord(String name, String[] parameters) throws TabListException;
		/**
		 * Called when a top-level record ends (either at the next record or the end of the file).
		 * 
		 * @throws TabListException The record was incomplete.
		 */
		void endRecord() throws TabListException;
		/**
		 * Called for each sub-record within the current top-level record.
		 * 
		 * @param name The name of the sub-record.
		 * @param parameters The remaining fields of the line (can be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void processSubRecord(String name, String[] parameters) throws TabListException;
	}

	/**
	 * Used for logical errors within the tablist file.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public TabListException(String message)
		{
			super(message);
		}
	}
}
