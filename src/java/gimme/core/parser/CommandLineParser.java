/**
 *
 */
package gimme.core.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;


/**
 * Command line parser for the flag/value style used by the programs: <i>-flag value -flag value</i>
 */
public final class CommandLineParser {

	private enum ArgType {
		STRING("String"),
		INTEGER("int"),
		BOOLEAN("boolean");

		private final String display;

		private ArgType(String display) {
			this.display = display;
		}
	}

	private boolean isParsed;
	private ArrayList<String> programDescription;

	private HashMap<String,ArgType> argTypes;
	private HashMap<String,String> argDescriptions;
	private HashMap<String,Object> argDefaults;

	private HashSet<String> requiredArgs;
	private HashMap<String,String> commandLineValues;


	public CommandLineParser() {
		isParsed = false;
		argTypes = new HashMap<String,ArgType>();
		argDescriptions = new HashMap<String,String>();
		argDefaults = new HashMap<String,Object>();
		programDescription = new ArrayList<String>();
		requiredArgs = new HashSet<String>();
		commandLineValues = new HashMap<String,String>();
	}

	/**
	 * Sets program description to be printed as part of help menu
	 * @param description The program description
	 */
	public void setProgramDescription(String description) {
		programDescription.add(description);
	}

	/**
	 * Adds new string argument to set of arguments
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 */
	public void addStringArg(String flag, String description, boolean required) {
		addArg(flag, description, required, ArgType.STRING, null);
	}

	/**
	 * Adds new string argument to set of arguments and stores default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addStringArg(String flag, String description, boolean required, String def) {
		addArg(flag, description, required, ArgType.STRING, def);
	}

	/**
	 * Adds new int argument to set of arguments and stores default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addIntegerArg(String flag, String description, boolean required, Integer def) {
		addArg(flag, description, required, ArgType.INTEGER, def);
	}

	/**
	 * Adds new boolean argument to set of arguments and stores default
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addBooleanArg(String flag, String description, boolean required, Boolean def) {
		addArg(flag, description, required, ArgType.BOOLEAN, def);
	}

	private void addArg(String flag, String description, boolean required, ArgType type, Object def) {
		if(argTypes.containsKey(flag)) {
			throw new IllegalArgumentException("Flag " + flag + " has already been used.");
		}
		if(argDescriptions.containsValue(description)) {
			throw new IllegalArgumentException("Description " + description + " has already been used.");
		}
		argTypes.put(flag, type);
		argDescriptions.put(flag, description);
		if(def != null) argDefaults.put(flag, def);
		if(required) requiredArgs.add(flag);
	}

	/**
	 * Parse command arguments
	 * @param args the command line arguments passed to a main program
	 * @throws IllegalArgumentException if the command line is not in proper form or a required argument is missing
	 */
	public void parse(String[] args) {

		isParsed = false;
		commandLineValues.clear();
		int i=0;
		while(i < args.length) {

			// Stop when output redirection is encountered
			if(args[i].contentEquals(">") || args[i].contentEquals(">>") || args[i].contentEquals("|")) break;

			if(!hasFlag(args[i])) {
				throw new IllegalArgumentException("Unknown argument " + args[i]);
			}
			if(commandLineValues.containsKey(args[i])) {
				throw new IllegalArgumentException("Argument " + args[i] + " given twice");
			}
			// A flag shouldn't be the last item and the next item should not be a flag
			if(args.length == i+1 || hasFlag(args[i+1])) {
				throw new IllegalArgumentException("Argument " + args[i] + " needs a value");
			}

			commandLineValues.put(args[i], args[i+1]);
			i += 2;
		}

		for(String req : requiredArgs) {
			if(!commandLineValues.containsKey(req)) {
				throw new IllegalArgumentException("Invalid command line: argument " + req + " is required");
			}
		}

		isParsed = true;
	}

	/**
	 * Parse command arguments. If the command line is not in proper form prints the problem and the help menu and exits
	 * @param args the command line arguments passed to a main program
	 */
	public void parseOrExit(String[] args) {
		try {
			parse(args);
		} catch (IllegalArgumentException e) {
			System.err.println("\n------------------------------------------------------");
			System.err.println(e.getMessage());
			System.err.println("------------------------------------------------------\n");
			printHelpMessage();
			System.exit(-1);
		}
	}

	/**
	 * Get value of String parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return String specified on command line, the default, or null if neither exists
	 */
	public String getStringArg(String flag) {
		String value = getValue(flag, ArgType.STRING);
		if(value == null) {
			return (String) argDefaults.get(flag);
		}
		return value;
	}

	/**
	 * Get value of int parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Integer specified on command line or the default
	 */
	public int getIntArg(String flag) {
		String value = getValue(flag, ArgType.INTEGER);
		if(value == null) {
			Integer def = (Integer) argDefaults.get(flag);
			if(def == null) {
				throw new IllegalArgumentException("No value or default for " + flag);
			}
			return def.intValue();
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Argument " + flag + " expects an integer, got " + value, e);
		}
	}

	/**
	 * Get value of boolean parameter specified by flag
	 * @param flag The command line flag for the argument
	 * @return Boolean specified on command line, the default, or false
	 */
	public boolean getBooleanArg(String flag) {
		String value = getValue(flag, ArgType.BOOLEAN);
		if(value == null) {
			Boolean def = (Boolean) argDefaults.get(flag);
			return def != null && def.booleanValue();
		}
		return Boolean.parseBoolean(value);
	}

	private String getValue(String flag, ArgType type) {
		// Make sure command line has been parsed
		if(!isParsed) {
			throw new IllegalStateException("Cannot get parameter value without first calling method parse()");
		}
		// Make sure parameter type is correct
		if(argTypes.get(flag) != type) {
			throw new IllegalArgumentException("Trying to get " + type.display + " value for parameter " + flag);
		}
		return commandLineValues.get(flag);
	}

	/**
	 * Prints program description plus argument flags and descriptions
	 */
	public void printHelpMessage() {
		System.err.println();
		for(String s : programDescription) System.err.println(s + "\n");

		Set<String> args = new TreeSet<String>();
		for(Map.Entry<String,ArgType> entry : argTypes.entrySet()) {
			String key = entry.getKey();
			String msg = key + " <" + entry.getValue().display + ">\t" + argDescriptions.get(key);
			if(requiredArgs.contains(key)) msg += " (required)";
			else msg += " (default=" + argDefaults.get(key) + ")";
			args.add(msg);
		}
		for(String s : args) {
			System.err.println(s);
		}
		System.err.println();
	}

	/**
	 * Checks if flag has already been added
	 * @param flag
	 * @return true if and only if flag has already been used
	 */
	private boolean hasFlag(String flag) {
		return argTypes.containsKey(flag);
	}

}
