package com.github.micycle1.specrecon.operators;

import java.util.Locale;

import com.github.micycle1.specrecon.ConfigurationException;

/**
 * Bayer colour-filter-array layout, given as the four symbols of the top-left
 * 2x2 tile read row by row, e.g. {@code "gbrg"}. Channels are numbered
 * {@code r = 0}, {@code g = 1}, {@code b = 2}.
 */
public final class CfaPattern {

	public static final int CHANNELS = 3;

	private static final String SYMBOLS = "rgb";

	private final String name;
	private final int[] tile; // channel per tile position, row-major

	private CfaPattern(String name, int[] tile) {
		this.name = name;
		this.tile = tile;
	}

	public static CfaPattern parse(String pattern) {
		if (pattern == null || pattern.length() != 4) {
			throw new ConfigurationException("CFA pattern must have exactly four symbols, got '" + pattern + "'");
		}
		String lower = pattern.toLowerCase(Locale.ROOT);
		int[] tile = new int[4];
		int[] counts = new int[CHANNELS];
		for (int i = 0; i < 4; i++) {
			int ch = SYMBOLS.indexOf(lower.charAt(i));
			if (ch < 0) {
				throw new ConfigurationException("Unrecognized CFA symbol '" + pattern.charAt(i) + "' in '" + pattern + "'");
			}
			tile[i] = ch;
			counts[ch]++;
		}
		if (counts[0] != 1 || counts[1] != 2 || counts[2] != 1) {
			throw new ConfigurationException("Unsupported CFA pattern '" + pattern + "': expected one r, two g and one b");
		}
		return new CfaPattern(lower, tile);
	}

	/** Sensor channel sampled at the given pixel. */
	public int channelAt(int row, int col) {
		return tile[(row & 1) * 2 + (col & 1)];
	}

	@Override
	public String toString() {
		return name;
	}
}
