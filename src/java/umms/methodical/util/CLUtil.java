package umms.methodical.util;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Command line parsing: arguments are given as "-key value" pairs (or "key=value"); a key with no value is a flag.
 */
public class CLUtil {

	private CLUtil() {}

	public static ArgumentMap getParameters(String[] args, String usage, String defaultTask) {
		ArgumentMap argMap = new ArgumentMap(args.length, usage, defaultTask);
		for (int i = 0; i < args.length; i++) {
			if (args[i].startsWith("-") && args[i].length() > 1 && !isNumber(args[i])) {
				String key = args[i].substring(1);
				String val = "";
				if (i + 1 < args.length && (!args[i + 1].startsWith("-") || isNumber(args[i + 1]))) {
					val = args[i + 1];
					i++;
				}
				argMap.put(key, val);
			} else {
				String[] arg = args[i].split("=");
				if (arg.length != 2) {
					throw new IllegalArgumentException("Cannot parse argument \"" + args[i] + "\"\n" + usage);
				}
				argMap.put(arg[0], arg[1]);
			}
		}
		return argMap;
	}

	public static ArgumentMap getParameters(String[] args, String usage) {
		return getParameters(args, usage, null);
	}

	private static boolean isNumber(String s) {
		try {
			Double.parseDouble(s);
			return true;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	public static class ArgumentMap extends HashMap<String, List<String>> {
		private static final long serialVersionUID = 2312363L;
		private String usage;
		private String defaultTask;
		private String task;
		private String output;

		public ArgumentMap(int size, String usage, String defaultTask) {
			super(Math.max(size, 1));
			this.usage = usage;
			this.defaultTask = defaultTask;
		}

		public String get(String key) {
			List<String> result = super.get(key);
			return result == null || result.size() == 0 ? "" : result.get(0);
		}

		public String get(String key, String defaultValue) {
			return super.containsKey(key) ? get(key) : defaultValue;
		}

		public void put(String key, String value) {
			if (key.toLowerCase().equals("task")) {
				this.task = value;
			} else if (key.toLowerCase().equals("out")) {
				this.output = value;
			} else {
				List<String> values = super.get(key);
				if (values == null) {
					values = new ArrayList<String>();
					super.put(key, values);
				}
				values.add(value);
			}
		}

		public String getTask() {
			if (task == null && defaultTask == null) {
				throw new IllegalArgumentException("Missing task\n" + usage);
			}
			return task == null ? defaultTask : task;
		}

		public String getOutput() {
			if (output == null) {
				throw new IllegalArgumentException("Must provide an \"out\"\n" + usage);
			}
			return output;
		}

		public boolean isOutputSet() {
			return output != null;
		}

		/**
		 * @return a writer on the "out" file, or on standard output if none was given
		 */
		public BufferedWriter getOutputWriter() throws IOException {
			if (output != null) {
				return new BufferedWriter(new FileWriter(output));
			}
			return new BufferedWriter(new OutputStreamWriter(System.out));
		}

		public String getMandatory(String key) throws IllegalArgumentException {
			List<String> parameter = super.get(key);
			if (parameter == null || parameter.size() == 0) {
				throw new IllegalArgumentException("Argument " + key + " is mandatory\n" + usage);
			}
			return parameter.get(0);
		}

		/**
		 * @throws NumberFormatException - if the value could not be converted to an integer.
		 */
		public int getInteger(String key) throws NumberFormatException {
			return Integer.parseInt(getMandatory(key));
		}

		public int getInteger(String key, int defaultValue) throws NumberFormatException {
			return super.containsKey(key) ? getInteger(key) : defaultValue;
		}

		public double getDouble(String key) {
			return Double.parseDouble(getMandatory(key));
		}

		public double getDouble(String key, double defaultValue) throws NumberFormatException {
			return super.containsKey(key) ? getDouble(key) : defaultValue;
		}

		public boolean isPresent(String key) {
			return super.get(key) != null && super.get(key).size() > 0;
		}

		/**
		 * @return the value of key parsed as true/false, or defaultValue if absent. A bare flag counts as true.
		 */
		public boolean getBoolean(String key, boolean defaultValue) {
			if (!containsKey(key)) return defaultValue;
			String value = get(key);
			if ("".equals(value) || "TRUE".equalsIgnoreCase(value)) return true;
			if ("FALSE".equalsIgnoreCase(value)) return false;
			throw new IllegalArgumentException("Argument " + key + " must be true or false, got " + value + "\n" + usage);
		}
	}
}
