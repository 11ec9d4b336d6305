package borg.screenmatch.templatematching;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import borg.screenmatch.raster.NormalizedRaster;

/**
 * Splits a scan into overlapping chunks sized relative to the template. Neighbouring chunks overlap by at
 * least template size - 1 pixels, so every template sized window lies completely inside at least one chunk.
 */
public class ChunkPartitioner {

	static final Logger logger = LoggerFactory.getLogger(ChunkPartitioner.class);

	private final ExecutorService bandExecutor;

	/**
	 * Extracts all row bands on the calling thread
	 */
	public ChunkPartitioner() {
		this(null);
	}

	/**
	 * @param bandExecutor
	 *            Runs one extraction per row band, or <code>null</code> to extract on the calling thread
	 */
	public ChunkPartitioner(ExecutorService bandExecutor) {
		this.bandExecutor = bandExecutor;
	}

	public List<Chunk> partition(final NormalizedRaster scan, int templateWidth, int templateHeight) throws InterruptedException {
		if (templateWidth <= 0 || templateHeight <= 0 || templateWidth > scan.getWidth() || templateHeight > scan.getHeight()) {
			throw new TemplateDimensionException(templateWidth, templateHeight, scan.getWidth(), scan.getHeight());
		}

		final List<int[]> columns = spans(scan.getWidth(), templateWidth);
		final List<int[]> bands = spans(scan.getHeight(), templateHeight);

		List<Chunk> chunks = new ArrayList<>(columns.size() * bands.size());
		if (this.bandExecutor == null || bands.size() == 1) {
			for (int[] band : bands) {
				chunks.addAll(extractBand(scan, band, columns));
			}
		} else {
			List<Future<List<Chunk>>> futures = new ArrayList<>(bands.size());
			for (final int[] band : bands) {
				futures.add(this.bandExecutor.submit(new Callable<List<Chunk>>() {
					@Override
					public List<Chunk> call() throws Exception {
						return extractBand(scan, band, columns);
					}
				}));
			}
			try {
				for (Future<List<Chunk>> future : futures) {
					chunks.addAll(future.get());
				}
			} catch (ExecutionException e) {
				throw new IllegalStateException("Failed to extract a row band of " + scan, e.getCause());
			} finally {
				for (Future<List<Chunk>> future : futures) {
					future.cancel(true);
				}
			}
		}

		if (logger.isDebugEnabled()) {
			logger.debug("Partitioned " + scan + " into " + chunks.size() + " chunk(s) (" + columns.size() + " x " + bands.size() + ") for a " + templateWidth + "x"
					+ templateHeight + " template");
		}
		return chunks;
	}

	private static List<Chunk> extractBand(NormalizedRaster scan, int[] band, List<int[]> columns) {
		List<Chunk> row = new ArrayList<>(columns.size());
		for (int[] column : columns) {
			row.add(Chunk.extract(scan, column[0], band[0], column[1], band[1]));
		}
		return row;
	}

	/**
	 * Origin and length of all chunks along one axis
	 */
	static List<int[]> spans(int scanSize, int templateSize) {
		final int chunkSize = chunkSize(scanSize, templateSize);
		final int overlap = overlap(scanSize, templateSize, chunkSize);
		final int stride = Math.max(1, chunkSize - overlap);

		List<int[]> spans = new ArrayList<>();
		for (int origin = 0; origin < scanSize; origin += stride) {
			final int length = Math.min(chunkSize, scanSize - origin);
			if (length >= templateSize) {
				spans.add(new int[] { origin, length });
			}
			if (origin + chunkSize >= scanSize) {
				// Reached the far edge
				break;
			}
		}
		return spans;
	}

	/**
	 * Between 2 and 6 template sizes, growing with the scan/template ratio, but at most a third of the scan.
	 * Small scans relative to the template get a single chunk spanning the whole axis.
	 */
	static int chunkSize(int scanSize, int templateSize) {
		if (scanSize < templateSize * 6) {
			return scanSize;
		}
		final double ratio = scanSize / (double) templateSize;
		final int size = (int) (templateSize * clamp(ratio / 4, 2, 6));
		return Math.min(size, scanSize / 3);
	}

	static int overlap(int scanSize, int templateSize, int chunkSize) {
		if (chunkSize == scanSize) {
			return templateSize;
		}
		final double ratio = scanSize / (double) templateSize;
		return Math.max(templateSize - 1, (int) (templateSize / Math.max(ratio / 8, 1.5)));
	}

	private static double clamp(double value, double min, double max) {
		return Math.max(min, Math.min(max, value));
	}

}
