package com.github.micycle1.specrecon.operators;

import com.github.micycle1.specrecon.ConfigurationException;

/**
 * Pixel grid of an image. Vectorized images list element {@code (row, col, k)}
 * at {@code row + rows * (col + cols * k)}, i.e. column-major pixels with the
 * channel or band index outermost.
 */
public final class ImageSampling {

	public final int rows;
	public final int cols;

	public ImageSampling(int rows, int cols) {
		if (rows <= 0 || cols <= 0) {
			throw new ConfigurationException("Image sampling must be positive, got " + rows + "x" + cols);
		}
		this.rows = rows;
		this.cols = cols;
	}

	public int pixels() {
		return rows * cols;
	}

	public int index(int row, int col, int k) {
		return row + rows * (col + cols * k);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ImageSampling)) {
			return false;
		}
		ImageSampling other = (ImageSampling) o;
		return rows == other.rows && cols == other.cols;
	}

	@Override
	public int hashCode() {
		return 31 * rows + cols;
	}

	@Override
	public String toString() {
		return rows + "x" + cols;
	}
}
