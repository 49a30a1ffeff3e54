package com.github.micycle1.specrecon.operators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.specrecon.ConfigurationException;

public class CfaPatternTest {

	@Test
	void gbrgTile() {
		CfaPattern p = CfaPattern.parse("gbrg");
		assertEquals(1, p.channelAt(0, 0));
		assertEquals(2, p.channelAt(0, 1));
		assertEquals(0, p.channelAt(1, 0));
		assertEquals(1, p.channelAt(1, 1));
		// tiling repeats every two pixels
		assertEquals(p.channelAt(0, 1), p.channelAt(2, 3));
		assertEquals(p.channelAt(1, 0), p.channelAt(5, 4));
	}

	@Test
	void caseInsensitive() {
		CfaPattern p = CfaPattern.parse("RGGB");
		assertEquals(0, p.channelAt(0, 0));
		assertEquals(2, p.channelAt(1, 1));
		assertEquals("rggb", p.toString());
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "rgb", "rggbb", "rgbx", "rrgb", "gggb", "bggb", "r g b" })
	void unsupportedPatternsAreRejected(String pattern) {
		assertThrows(ConfigurationException.class, () -> CfaPattern.parse(pattern));
	}

	@Test
	void nullIsRejected() {
		assertThrows(ConfigurationException.class, () -> CfaPattern.parse(null));
	}
}
