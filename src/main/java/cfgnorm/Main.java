package cfgnorm;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

import picocli.CommandLine;

public class Main {

	public static void main(String... args) {
		configureLogging();
		int exitCode = new CommandLine(new NormalizerCli()).execute(args);
		System.exit(exitCode);
	}

	private static void configureLogging(){
		try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
			if (config != null){
				LogManager.getLogManager().readConfiguration(config);
			}
		} catch (IOException e) {
			System.err.println("Cannot load the logging configuration: " + e.getMessage());
		}
	}
}
