package cfgnorm;

import java.io.*;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings of the normalizer.
 *
 * Defaults can be overridden by a <code>cfgnorm.ini</code> file in the working directory
 * (lines of the form <code>key = value</code>) and by <code>cfgnorm.KEY</code> system properties,
 * the latter taking precedence.
 */
public class Config {

	public static final String configFile = "cfgnorm.ini";

	private static final String propertyPrefix = "cfgnorm.";

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("primeMarker", "'");
		put("epsilonMarker", "ε");
		put("arrow", "→");
	}};

	/** Appended to a non terminal name to create the fresh non terminal of a left recursion rewrite */
	public static String primeMarker(){
		return config.get("primeMarker");
	}

	/** Printed for empty production bodies */
	public static String epsilonMarker(){
		return config.get("epsilonMarker");
	}

	/** Printed between the left and right hand side of a production */
	public static String arrow(){
		return config.get("arrow");
	}

	private static void loadConfig(File file){
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), "UTF-8"))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						set(parts[0].trim(), parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Cannot read " + file, e);
		}
	}

	private static void loadSystemProperties(){
		for (String key : config.keySet()){
			String value = System.getProperty(propertyPrefix + key);
			if (value != null){
				set(key, value);
			}
		}
	}

	private static void set(String key, String value){
		if (value.isEmpty() && key.equals("primeMarker")){
			throw new CFGException("The prime marker must not be empty");
		}
		config.put(key, value);
	}

	static {
		loadConfig(new File(configFile));
		loadSystemProperties();
	}
}
