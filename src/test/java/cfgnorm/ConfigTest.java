package cfgnorm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@Test
	public void testDefaults(){
		assertEquals("'", Config.primeMarker());
		assertEquals("ε", Config.epsilonMarker());
		assertEquals("→", Config.arrow());
	}
}
